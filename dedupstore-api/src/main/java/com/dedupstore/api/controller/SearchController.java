package com.dedupstore.api.controller;

import com.dedupstore.api.dto.response.FileResponse;
import com.dedupstore.api.security.UserIdFilter;
import com.dedupstore.core.index.SearchService;
import com.dedupstore.core.model.IndexStats;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/search")
@RequiredArgsConstructor
public class SearchController {
    
    private final SearchService searchService;
    
    /**
     * Files matching any of the comma-separated keywords in {@code q}.
     */
    @GetMapping
    public ResponseEntity<List<FileResponse>> search(
            @RequestParam(value = "q", required = false) List<String> keywords,
            @RequestAttribute(UserIdFilter.ATTRIBUTE) String userId
    ) {
        List<FileResponse> results = searchService.search(userId, keywords == null ? List.of() : keywords).stream()
            .map(FileResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(results);
    }
    
    @GetMapping("/stats")
    public ResponseEntity<IndexStats> indexStats() {
        return ResponseEntity.ok(searchService.indexStats());
    }
}
