package com.dedupstore.core.service;

import com.dedupstore.core.model.FileQuery;
import com.dedupstore.data.entity.FileRecord;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

final class FileRecordSpecifications {
    
    private FileRecordSpecifications() {}
    
    static Specification<FileRecord> forOwner(String ownerId, FileQuery query) {
        Specification<FileRecord> spec = ownedBy(ownerId).and(live());
        if (query == null) {
            return spec;
        }
        if (hasText(query.getSearch())) {
            spec = spec.and(containsIgnoreCase("filename", query.getSearch()));
        }
        if (hasText(query.getFileType())) {
            spec = spec.and(containsIgnoreCase("declaredType", query.getFileType()));
        }
        if (query.getMinSize() != null) {
            spec = spec.and((root, cq, cb) -> cb.greaterThanOrEqualTo(root.get("sizeBytes"), query.getMinSize()));
        }
        if (query.getMaxSize() != null) {
            spec = spec.and((root, cq, cb) -> cb.lessThanOrEqualTo(root.get("sizeBytes"), query.getMaxSize()));
        }
        if (query.getStartDate() != null) {
            spec = spec.and((root, cq, cb) -> cb.greaterThanOrEqualTo(root.get("createdAt"), query.getStartDate()));
        }
        if (query.getEndDate() != null) {
            spec = spec.and((root, cq, cb) -> cb.lessThanOrEqualTo(root.get("createdAt"), query.getEndDate()));
        }
        return spec;
    }
    
    private static Specification<FileRecord> ownedBy(String ownerId) {
        return (root, cq, cb) -> cb.equal(root.get("ownerId"), ownerId);
    }
    
    private static Specification<FileRecord> live() {
        return (root, cq, cb) -> cb.isNull(root.get("deletedAt"));
    }
    
    private static Specification<FileRecord> containsIgnoreCase(String attribute, String value) {
        String pattern = "%" + escapeLike(value.trim().toLowerCase(Locale.ROOT)) + "%";
        return (root, cq, cb) -> cb.like(cb.lower(root.get(attribute)), pattern, '\\');
    }
    
    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
    
    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
