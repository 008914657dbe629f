package com.dedupstore.core.index;

import com.dedupstore.common.constants.IndexStatus;
import com.dedupstore.core.IntegrationTestSupport;
import com.dedupstore.core.exception.PermanentTaskException;
import com.dedupstore.core.model.IndexResult;
import com.dedupstore.core.model.IndexStats;
import com.dedupstore.data.entity.FileRecord;
import com.dedupstore.data.entity.Keyword;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeywordIndexerIntegrationTest extends IntegrationTestSupport {
    
    @Autowired
    private KeywordIndexer keywordIndexer;
    
    @Autowired
    private SearchService searchService;
    
    @Test
    void indexesDistinctKeywordsAndMarksFileIndexed() {
        FileRecord record = uploadText("alice", "minutes.txt", "Budget review: the budget was approved. Travel deferred!");
        
        IndexResult result = keywordIndexer.indexFile(record.getId());
        
        assertThat(result.getStatus()).isEqualTo(IndexStatus.INDEXED);
        assertThat(keywordIndexer.keywordsOf(record.getId()))
            .containsExactly("approved", "budget", "deferred", "review", "travel");
        FileRecord reloaded = fileRecordRepository.findById(record.getId()).orElseThrow();
        assertThat(reloaded.getIndexStatus()).isEqualTo(IndexStatus.INDEXED);
        assertThat(reloaded.getIndexedAt()).isNotNull();
    }
    
    @Test
    void reindexingConvergesToSameEntries() {
        FileRecord record = uploadText("alice", "plan.txt", "launch plan marketing launch budget");
        keywordIndexer.indexFile(record.getId());
        List<String> once = keywordIndexer.keywordsOf(record.getId());
        
        for (int i = 0; i < 3; i++) {
            keywordIndexer.indexFile(record.getId());
        }
        
        assertThat(keywordIndexer.keywordsOf(record.getId())).isEqualTo(once);
        assertThat(keywordRepository.count()).isEqualTo(once.size());
    }
    
    @Test
    void concurrentIndexingOfSameFileConverges() {
        FileRecord record = uploadText("alice", "race.txt", "parallel indexing should converge nicely");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            CompletableFuture<?>[] runs = new CompletableFuture[4];
            for (int i = 0; i < runs.length; i++) {
                runs[i] = CompletableFuture.runAsync(() -> keywordIndexer.indexFile(record.getId()), executor);
            }
            CompletableFuture.allOf(runs).join();
        } finally {
            executor.shutdownNow();
        }
        
        assertThat(keywordIndexer.keywordsOf(record.getId()))
            .containsExactly("converge", "indexing", "nicely", "parallel", "should");
    }
    
    @Test
    void searchIsScopedToOwnerEvenForSharedContent() {
        FileRecord alices = uploadText("alice", "shared.txt", "confidential merger memo");
        FileRecord bobs = uploadText("bob", "shared-copy.txt", "confidential merger memo");
        keywordIndexer.indexFile(alices.getId());
        keywordIndexer.indexFile(bobs.getId());
        
        assertThat(searchService.search("alice", List.of("merger")))
            .extracting(FileRecord::getId).containsExactly(alices.getId());
        assertThat(searchService.search("bob", List.of("MERGER")))
            .extracting(FileRecord::getId).containsExactly(bobs.getId());
        assertThat(searchService.search("carol", List.of("merger"))).isEmpty();
    }
    
    @Test
    void searchUsesOrSemanticsAndNewestFirst() throws Exception {
        FileRecord older = uploadText("alice", "apples.txt", "apples orchard");
        Thread.sleep(5);
        FileRecord newer = uploadText("alice", "pears.txt", "pears orchard");
        keywordIndexer.indexFile(older.getId());
        keywordIndexer.indexFile(newer.getId());
        
        assertThat(searchService.search("alice", List.of("apples", "pears")))
            .extracting(FileRecord::getId).containsExactly(newer.getId(), older.getId());
        assertThat(searchService.search("alice", List.of("the", "at"))).isEmpty();
    }
    
    @Test
    void deletedFilesDropOutOfSearch() {
        FileRecord record = uploadText("alice", "temp.txt", "ephemeral scratch");
        keywordIndexer.indexFile(record.getId());
        
        fileRegistry.delete("alice", record.getId());
        
        assertThat(keywordIndexer.keywordsOf(record.getId())).isEmpty();
        assertThat(searchService.search("alice", List.of("ephemeral"))).isEmpty();
        assertThatThrownBy(() -> keywordIndexer.indexFile(record.getId())).isInstanceOf(PermanentTaskException.class);
    }
    
    @Test
    void unsupportedTypesAreMarkedWithoutEntries() {
        FileRecord archive = upload("alice", "bundle.zip", "application/zip", "PK not really".getBytes(StandardCharsets.US_ASCII));
        
        IndexResult result = keywordIndexer.indexFile(archive.getId());
        
        assertThat(result.getStatus()).isEqualTo(IndexStatus.UNSUPPORTED);
        assertThat(keywordIndexer.keywordsOf(archive.getId())).isEmpty();
        assertThat(fileRecordRepository.findById(archive.getId()).orElseThrow().getIndexStatus())
            .isEqualTo(IndexStatus.UNSUPPORTED);
    }
    
    @Test
    void corruptDocumentFailsPermanentlyButStaysDownloadable() throws Exception {
        byte[] bogus = "definitely not a pdf".getBytes(StandardCharsets.US_ASCII);
        FileRecord pdf = upload("alice", "broken.pdf", "application/pdf", bogus);
        
        assertThatThrownBy(() -> keywordIndexer.indexFile(pdf.getId()))
            .isInstanceOf(PermanentTaskException.class)
            .hasMessageContaining("extraction failed");
        
        try (InputStream in = fileRegistry.openContent("alice", pdf.getId())) {
            assertThat(in.readAllBytes()).isEqualTo(bogus);
        }
    }
    
    @Test
    void failedReindexDropsEntriesFromEarlierRun() {
        byte[] bogus = "still not a pdf".getBytes(StandardCharsets.US_ASCII);
        FileRecord pdf = upload("alice", "report.pdf", "application/pdf", bogus);
        Keyword stale = keywordRepository.saveAndFlush(Keyword.builder().keyword("quarterly").build());
        keywordIndexer.replaceEntries(pdf.getId(), List.of(stale.getId()), IndexStatus.INDEXED);
        assertThat(searchService.search("alice", List.of("quarterly"))).hasSize(1);
        
        assertThatThrownBy(() -> keywordIndexer.indexFile(pdf.getId()))
            .isInstanceOf(PermanentTaskException.class);
        
        assertThat(keywordIndexer.keywordsOf(pdf.getId())).isEmpty();
        assertThat(searchService.search("alice", List.of("quarterly"))).isEmpty();
        assertThat(fileRecordRepository.findById(pdf.getId()).orElseThrow().getIndexStatus())
            .isEqualTo(IndexStatus.FAILED);
    }
    
    @Test
    void indexStatsReportMostCommonKeyword() {
        keywordIndexer.indexFile(uploadText("alice", "one.txt", "common alpha").getId());
        keywordIndexer.indexFile(uploadText("alice", "two.txt", "common beta").getId());
        keywordIndexer.indexFile(uploadText("bob", "three.txt", "common gamma").getId());
        
        IndexStats stats = searchService.indexStats();
        
        assertThat(stats.getTotalKeywords()).isEqualTo(4);
        assertThat(stats.getMostCommonKeyword()).isEqualTo("common");
        assertThat(stats.getMostCommonKeywordCount()).isEqualTo(3);
    }
}
