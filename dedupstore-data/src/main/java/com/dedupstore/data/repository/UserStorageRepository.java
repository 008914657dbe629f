package com.dedupstore.data.repository;

import com.dedupstore.data.entity.UserStorage;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserStorageRepository extends JpaRepository<UserStorage, String> {
    
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM UserStorage u WHERE u.userId = :userId")
    Optional<UserStorage> findByUserIdForUpdate(@Param("userId") String userId);
}
