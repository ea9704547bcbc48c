package com.ewale.ewale.repository;

import com.ewale.ewale.entity.UssdLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UssdLogRepository extends JpaRepository<UssdLog, UUID> {
    Optional<UssdLog> findBySessionId(String sessionId);
    List<UssdLog> findByMobileNumberOrderByDialedAtDesc(String mobileNumber);
    long countByStatus(String status);
    long countByDialedAtGreaterThanEqual(LocalDateTime since);

    @Query("SELECT COUNT(DISTINCT l.mobileNumber) FROM UssdLog l")
    long countDistinctMobileNumbers();

    @Query("SELECT COUNT(DISTINCT l.mobileNumber) FROM UssdLog l WHERE l.dialedAt >= :since")
    long countDistinctMobileNumbersSince(@Param("since") LocalDateTime since);
}
