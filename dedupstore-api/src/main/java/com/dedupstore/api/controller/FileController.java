package com.dedupstore.api.controller;

import com.dedupstore.api.dto.response.FileResponse;
import com.dedupstore.api.dto.response.IndexStatusResponse;
import com.dedupstore.api.security.UserIdFilter;
import com.dedupstore.core.exception.StorageIOException;
import com.dedupstore.core.exception.ValidationException;
import com.dedupstore.core.index.KeywordIndexer;
import com.dedupstore.core.model.DeduplicationStats;
import com.dedupstore.core.model.FileQuery;
import com.dedupstore.core.model.UserStorageStats;
import com.dedupstore.core.quota.QuotaLedger;
import com.dedupstore.core.service.FileRegistry;
import com.dedupstore.core.worker.IndexingTaskQueue;
import com.dedupstore.data.entity.FileRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.InputStreamResource;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/files")
@RequiredArgsConstructor
@Slf4j
public class FileController {
    
    private final FileRegistry fileRegistry;
    private final QuotaLedger quotaLedger;
    private final KeywordIndexer keywordIndexer;
    private final IndexingTaskQueue taskQueue;
    
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<FileResponse> uploadFile(
            @RequestParam("file") MultipartFile file,
            @RequestAttribute(UserIdFilter.ATTRIBUTE) String userId
    ) {
        log.debug("Upload request received | userId={} | name={} | size={} | contentType={}",
            userId, file.getOriginalFilename(), file.getSize(), file.getContentType());
        if (file.isEmpty()) {
            throw new ValidationException("File is empty");
        }
        
        try (InputStream content = file.getInputStream()) {
            FileRecord record = fileRegistry.upload(userId, content, file.getOriginalFilename(), file.getContentType());
            return ResponseEntity.status(HttpStatus.CREATED).body(FileResponse.from(record));
        } catch (IOException e) {
            throw new StorageIOException("Failed to read uploaded file", e);
        }
    }
    
    @GetMapping
    public ResponseEntity<Page<FileResponse>> listFiles(
            @ModelAttribute FileQuery query,
            @PageableDefault(size = 20, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable,
            @RequestAttribute(UserIdFilter.ATTRIBUTE) String userId
    ) {
        Page<FileRecord> files = fileRegistry.listFiles(userId, query, pageable);
        return ResponseEntity.ok(files.map(FileResponse::from));
    }
    
    @GetMapping("/{fileId}")
    public ResponseEntity<FileResponse> getFile(
            @PathVariable UUID fileId,
            @RequestAttribute(UserIdFilter.ATTRIBUTE) String userId
    ) {
        return ResponseEntity.ok(FileResponse.from(fileRegistry.getFile(userId, fileId)));
    }
    
    @GetMapping("/{fileId}/content")
    public ResponseEntity<InputStreamResource> downloadFile(
            @PathVariable UUID fileId,
            @RequestAttribute(UserIdFilter.ATTRIBUTE) String userId
    ) {
        FileRecord record = fileRegistry.getFile(userId, fileId);
        InputStream content = fileRegistry.openContent(userId, fileId);
        
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(record.getDeclaredType()))
            .contentLength(record.getSizeBytes())
            .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                .filename(record.getFilename(), StandardCharsets.UTF_8)
                .build()
                .toString())
            .body(new InputStreamResource(content));
    }
    
    @GetMapping("/{fileId}/index")
    public ResponseEntity<IndexStatusResponse> getIndexStatus(
            @PathVariable UUID fileId,
            @RequestAttribute(UserIdFilter.ATTRIBUTE) String userId
    ) {
        FileRecord record = fileRegistry.getFile(userId, fileId);
        return ResponseEntity.ok(IndexStatusResponse.from(
            record, keywordIndexer.keywordsOf(fileId), taskQueue.jobsForFile(fileId)));
    }
    
    @DeleteMapping("/{fileId}")
    public ResponseEntity<Void> deleteFile(
            @PathVariable UUID fileId,
            @RequestAttribute(UserIdFilter.ATTRIBUTE) String userId
    ) {
        fileRegistry.delete(userId, fileId);
        return ResponseEntity.noContent().build();
    }
    
    @GetMapping("/storage-stats")
    public ResponseEntity<UserStorageStats> storageStats(@RequestAttribute(UserIdFilter.ATTRIBUTE) String userId) {
        return ResponseEntity.ok(quotaLedger.stats(userId));
    }
    
    @GetMapping("/deduplication-stats")
    public ResponseEntity<DeduplicationStats> deduplicationStats() {
        return ResponseEntity.ok(fileRegistry.deduplicationStats());
    }
    
    @GetMapping("/file-types")
    public ResponseEntity<List<String>> fileTypes(@RequestAttribute(UserIdFilter.ATTRIBUTE) String userId) {
        return ResponseEntity.ok(fileRegistry.fileTypes(userId));
    }
}
