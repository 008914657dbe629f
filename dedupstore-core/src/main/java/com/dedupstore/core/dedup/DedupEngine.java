package com.dedupstore.core.dedup;

import com.dedupstore.core.model.DedupDecision;
import com.dedupstore.core.storage.ContentBlobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Decides whether incoming content is new or already held. Resolution locks the blob row,
 * so the decision stays valid until the surrounding upload transaction ends.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DedupEngine {
    
    private final ContentBlobStore blobStore;
    
    @Transactional(propagation = Propagation.MANDATORY)
    public DedupDecision resolve(String fingerprint) {
        DedupDecision decision = blobStore.lock(fingerprint)
            .map(blob -> DedupDecision.existingCanonical(blob.getCanonicalFileId()))
            .orElseGet(DedupDecision::newContent);
        log.debug("[UPLOAD] Dedup resolved | fingerprint={} | newContent={} | canonicalId={}",
            fingerprint, decision.isNewContent(), decision.getCanonicalId());
        return decision;
    }
}
