package com.dedupstore.core.quota;

import com.dedupstore.common.util.FileUtils;
import com.dedupstore.core.config.StorageProperties;
import com.dedupstore.core.exception.QuotaExceededException;
import com.dedupstore.core.model.UserStorageStats;
import com.dedupstore.data.entity.UserStorage;
import com.dedupstore.data.repository.UserStorageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-user usage counters. Logical usage counts every live file at full size; actual usage
 * counts only content the user introduced and is what the quota is checked against.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuotaLedger {
    
    private final UserStorageRepository userStorageRepository;
    private final StorageProperties storageProperties;
    
    /**
     * Ensures a ledger row exists so later reservations can lock it.
     */
    public void openLedger(String userId) {
        if (userStorageRepository.existsById(userId)) {
            return;
        }
        try {
            userStorageRepository.saveAndFlush(UserStorage.builder().userId(userId).build());
            log.info("Opened storage ledger | userId={}", userId);
        } catch (DataIntegrityViolationException e) {
            log.debug("Ledger for user {} created concurrently: {}", userId, e.getMessage());
        }
    }
    
    /**
     * Records an upload of {@code bytes}. Only actual reservations can exceed the quota;
     * the check and the increment happen under the ledger row lock.
     */
    @Transactional
    public UserStorage reserve(String userId, long bytes, boolean countsAsActual) {
        UserStorage ledger = lockLedger(userId);
        long quota = storageProperties.getQuotaPerUser();
        
        if (countsAsActual && ledger.getActualUsed() + bytes > quota) {
            long remaining = Math.max(quota - ledger.getActualUsed(), 0);
            log.info("[UPLOAD] Quota exceeded | userId={} | requested={} | used={} | quota={}",
                userId, bytes, ledger.getActualUsed(), quota);
            throw new QuotaExceededException(
                String.format("Storage quota exceeded: %s requested, %s remaining of %s",
                    FileUtils.formatFileSize(bytes), FileUtils.formatFileSize(remaining), FileUtils.formatFileSize(quota)),
                userId, bytes, ledger.getActualUsed(), quota);
        }
        
        ledger.setLogicalUsed(ledger.getLogicalUsed() + bytes);
        if (countsAsActual) {
            ledger.setActualUsed(ledger.getActualUsed() + bytes);
        }
        return ledger;
    }
    
    @Transactional
    public UserStorage release(String userId, long bytes, boolean releasesActual) {
        UserStorage ledger = lockLedger(userId);
        ledger.setLogicalUsed(Math.max(ledger.getLogicalUsed() - bytes, 0));
        if (releasesActual) {
            ledger.setActualUsed(Math.max(ledger.getActualUsed() - bytes, 0));
        }
        return ledger;
    }
    
    @Transactional(readOnly = true)
    public UserStorageStats stats(String userId) {
        UserStorage ledger = userStorageRepository.findById(userId)
            .orElseGet(() -> UserStorage.builder().userId(userId).build());
        long quota = storageProperties.getQuotaPerUser();
        long actual = ledger.getActualUsed();
        long logical = ledger.getLogicalUsed();
        long savings = Math.max(logical - actual, 0);
        
        return UserStorageStats.builder()
            .userId(userId)
            .actualUsed(actual)
            .logicalUsed(logical)
            .storageSavings(savings)
            .savingsPercentage(logical > 0 ? round(savings * 100.0 / logical) : 0.0)
            .quotaLimit(quota)
            .quotaRemaining(Math.max(quota - actual, 0))
            .quotaUsagePercentage(quota > 0 ? round(actual * 100.0 / quota) : 0.0)
            .build();
    }
    
    private UserStorage lockLedger(String userId) {
        return userStorageRepository.findByUserIdForUpdate(userId)
            .orElseThrow(() -> new IllegalStateException("No storage ledger for user " + userId));
    }
    
    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
