package com.ewale.ewale.repository;

import com.ewale.ewale.entity.CommissionTransactionLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CommissionTransactionLogRepository extends JpaRepository<CommissionTransactionLog, UUID> {
    Optional<CommissionTransactionLog> findByClientReference(String clientReference);
    Optional<CommissionTransactionLog> findFirstBySessionIdOrderByCreatedAtDesc(String sessionId);
    List<CommissionTransactionLog> findByMobileNumberOrderByCreatedAtDesc(String mobileNumber);

    /**
     * Sum of amounts over paid and delivered commission purchases of a mobile number.
     */
    @Query("SELECT COALESCE(SUM(c.amount), 0) FROM CommissionTransactionLog c " +
           "WHERE c.mobileNumber = :mobileNumber " +
           "AND c.status = com.ewale.ewale.entity.PaymentStatus.PAID " +
           "AND c.commissionServiceStatus = com.ewale.ewale.entity.CommissionServiceStatus.DELIVERED")
    BigDecimal sumDeliveredAmountByMobileNumber(@Param("mobileNumber") String mobileNumber);
}
