package com.dedupstore.core;

import com.dedupstore.core.service.FileRegistry;
import com.dedupstore.data.entity.FileRecord;
import com.dedupstore.data.repository.ContentBlobRepository;
import com.dedupstore.data.repository.FileRecordRepository;
import com.dedupstore.data.repository.IndexEntryRepository;
import com.dedupstore.data.repository.IndexJobRepository;
import com.dedupstore.data.repository.KeywordRepository;
import com.dedupstore.data.repository.UserStorageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

@SpringBootTest
public abstract class IntegrationTestSupport {
    
    @Autowired
    protected FileRegistry fileRegistry;
    
    @Autowired
    protected FileRecordRepository fileRecordRepository;
    
    @Autowired
    protected ContentBlobRepository contentBlobRepository;
    
    @Autowired
    protected UserStorageRepository userStorageRepository;
    
    @Autowired
    protected IndexJobRepository indexJobRepository;
    
    @Autowired
    protected IndexEntryRepository indexEntryRepository;
    
    @Autowired
    protected KeywordRepository keywordRepository;
    
    @BeforeEach
    void cleanDatabase() {
        indexEntryRepository.deleteAllInBatch();
        keywordRepository.deleteAllInBatch();
        indexJobRepository.deleteAllInBatch();
        fileRecordRepository.deleteAllInBatch();
        contentBlobRepository.deleteAllInBatch();
        userStorageRepository.deleteAllInBatch();
    }
    
    protected FileRecord uploadText(String userId, String filename, String content) {
        return upload(userId, filename, "text/plain", content.getBytes(StandardCharsets.UTF_8));
    }
    
    protected FileRecord upload(String userId, String filename, String type, byte[] content) {
        return fileRegistry.upload(userId, new ByteArrayInputStream(content), filename, type);
    }
    
    protected long actualUsed(String userId) {
        return userStorageRepository.findById(userId).map(s -> s.getActualUsed()).orElse(0L);
    }
    
    protected long logicalUsed(String userId) {
        return userStorageRepository.findById(userId).map(s -> s.getLogicalUsed()).orElse(0L);
    }
}
