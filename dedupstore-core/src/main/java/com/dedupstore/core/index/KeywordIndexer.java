package com.dedupstore.core.index;

import com.dedupstore.common.constants.IndexStatus;
import com.dedupstore.core.exception.ExtractionException;
import com.dedupstore.core.exception.PermanentTaskException;
import com.dedupstore.core.exception.RetryableTaskException;
import com.dedupstore.core.exception.StorageIOException;
import com.dedupstore.core.extractor.ContentExtractorRegistry;
import com.dedupstore.core.model.IndexResult;
import com.dedupstore.core.storage.ContentBlobStore;
import com.dedupstore.data.entity.FileRecord;
import com.dedupstore.data.entity.IndexEntry;
import com.dedupstore.data.entity.Keyword;
import com.dedupstore.data.repository.FileRecordRepository;
import com.dedupstore.data.repository.IndexEntryRepository;
import com.dedupstore.data.repository.KeywordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Builds the keyword index for one file. Re-indexing replaces the file's entries as a whole,
 * so repeated or overlapping runs end with the same entry set.
 */
@Service
@Slf4j
public class KeywordIndexer {
    
    private static final int LOOKUP_BATCH_SIZE = 500;
    
    private final FileRecordRepository fileRecordRepository;
    private final KeywordRepository keywordRepository;
    private final IndexEntryRepository indexEntryRepository;
    private final ContentBlobStore blobStore;
    private final ContentExtractorRegistry extractorRegistry;
    private final KeywordTokenizer tokenizer;
    private final KeywordIndexer self;
    
    public KeywordIndexer(
        FileRecordRepository fileRecordRepository,
        KeywordRepository keywordRepository,
        IndexEntryRepository indexEntryRepository,
        ContentBlobStore blobStore,
        ContentExtractorRegistry extractorRegistry,
        KeywordTokenizer tokenizer,
        @Lazy KeywordIndexer self
    ) {
        this.fileRecordRepository = fileRecordRepository;
        this.keywordRepository = keywordRepository;
        this.indexEntryRepository = indexEntryRepository;
        this.blobStore = blobStore;
        this.extractorRegistry = extractorRegistry;
        this.tokenizer = tokenizer;
        this.self = self;
    }
    
    public IndexResult indexFile(UUID fileId) {
        long startTime = System.currentTimeMillis();
        FileRecord record = fileRecordRepository.findById(fileId)
            .filter(r -> !r.isDeleted())
            .orElseThrow(() -> new PermanentTaskException("File not found or deleted: " + fileId));
        String mimeType = record.getDeclaredType();
        
        if (!extractorRegistry.isSupported(mimeType)) {
            self.replaceEntries(fileId, List.of(), IndexStatus.UNSUPPORTED);
            log.info("[INDEX] No extractor for type, marked unsupported | fileId={} | type={}", fileId, mimeType);
            return IndexResult.builder().fileId(fileId).status(IndexStatus.UNSUPPORTED).keywordCount(0).build();
        }
        
        byte[] content = readContent(record);
        String text;
        try {
            text = extractorRegistry.getExtractor(mimeType).extract(content, mimeType);
        } catch (ExtractionException e) {
            // Entries from an earlier successful run must not outlive the failure
            self.replaceEntries(fileId, List.of(), IndexStatus.FAILED);
            throw new PermanentTaskException("Content extraction failed for file " + fileId + ": " + e.getMessage(), e);
        }
        
        Set<String> tokens = tokenizer.tokenize(text);
        Collection<UUID> keywordIds = ensureKeywords(tokens).values();
        int indexed = self.replaceEntries(fileId, keywordIds, IndexStatus.INDEXED);
        
        log.info("[INDEX] File indexed | fileId={} | type={} | textChars={} | keywords={} | durationMs={}",
            fileId, mimeType, text.length(), indexed, System.currentTimeMillis() - startTime);
        return IndexResult.builder().fileId(fileId).status(IndexStatus.INDEXED).keywordCount(indexed).build();
    }
    
    /**
     * Swaps the file's index entries for {@code keywordIds} under the record row lock.
     */
    @Transactional
    public int replaceEntries(UUID fileId, Collection<UUID> keywordIds, IndexStatus status) {
        FileRecord record = fileRecordRepository.findByIdForUpdate(fileId)
            .filter(r -> !r.isDeleted())
            .orElseThrow(() -> new PermanentTaskException("File deleted during indexing: " + fileId));
        
        indexEntryRepository.deleteByFileId(fileId);
        List<IndexEntry> entries = new ArrayList<>(keywordIds.size());
        for (UUID keywordId : keywordIds) {
            entries.add(IndexEntry.builder()
                .fileId(fileId)
                .keyword(keywordRepository.getReferenceById(keywordId))
                .build());
        }
        indexEntryRepository.saveAll(entries);
        
        record.setIndexStatus(status);
        record.setIndexError(null);
        record.setIndexedAt(Instant.now());
        return entries.size();
    }
    
    @Transactional
    public int removeFile(UUID fileId) {
        int removed = indexEntryRepository.deleteByFileId(fileId);
        log.debug("[INDEX] Removed index entries | fileId={} | entries={}", fileId, removed);
        return removed;
    }
    
    @Transactional(readOnly = true)
    public List<String> keywordsOf(UUID fileId) {
        return indexEntryRepository.findKeywordsByFileId(fileId);
    }
    
    private byte[] readContent(FileRecord record) {
        try (InputStream inputStream = blobStore.open(record.getFingerprint())) {
            return inputStream.readAllBytes();
        } catch (StorageIOException e) {
            throw new RetryableTaskException("Content unavailable for file " + record.getId() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new RetryableTaskException("Failed to read content for file " + record.getId(), e);
        }
    }
    
    /**
     * Returns keyword ids for every token, inserting the missing ones. Each insert commits on
     * its own; a unique conflict means another indexer inserted it first.
     */
    private Map<String, UUID> ensureKeywords(Set<String> tokens) {
        Map<String, UUID> ids = new HashMap<>();
        List<String> pending = new ArrayList<>(tokens);
        for (int from = 0; from < pending.size(); from += LOOKUP_BATCH_SIZE) {
            List<String> batch = pending.subList(from, Math.min(from + LOOKUP_BATCH_SIZE, pending.size()));
            for (Keyword keyword : keywordRepository.findByKeywordIn(batch)) {
                ids.put(keyword.getKeyword(), keyword.getId());
            }
        }
        
        for (String token : tokens) {
            if (!ids.containsKey(token)) {
                ids.put(token, createKeyword(token).getId());
            }
        }
        return ids;
    }
    
    private Keyword createKeyword(String token) {
        try {
            return keywordRepository.saveAndFlush(Keyword.builder().keyword(token).build());
        } catch (DataIntegrityViolationException e) {
            log.debug("[INDEX] Keyword '{}' inserted concurrently, reusing it", token);
            return keywordRepository.findByKeyword(token)
                .orElseThrow(() -> new RetryableTaskException("Keyword missing after insert conflict: " + token, e));
        }
    }
}
