package com.ewale.ewale.repository;

import com.ewale.ewale.entity.PaymentTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransaction, UUID> {
    Optional<PaymentTransaction> findByOrderId(String orderId);

    /**
     * Sets the fulfilment flag only if it is still clear.
     *
     * @return 1 when this call claimed fulfilment, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PaymentTransaction t SET t.fulfillmentTriggered = true " +
           "WHERE t.orderId = :orderId AND t.fulfillmentTriggered = false")
    int claimFulfillment(@Param("orderId") String orderId);

    boolean existsByOrderId(String orderId);

    /**
     * Latest record of a session that has not yet been matched to a Hubtel order.
     */
    @Query("SELECT t FROM PaymentTransaction t WHERE t.sessionId = :sessionId " +
           "AND t.orderId IS NULL " +
           "ORDER BY t.createdAt DESC")
    List<PaymentTransaction> findUnmatchedBySessionId(@Param("sessionId") String sessionId);

    /**
     * Transactions still waiting for a final status, created before the given time.
     */
    @Query("SELECT t FROM PaymentTransaction t WHERE " +
           "(t.status = com.ewale.ewale.entity.TransactionStatus.PENDING " +
           "OR t.status = com.ewale.ewale.entity.TransactionStatus.PROCESSING) " +
           "AND t.createdAt < :beforeTime " +
           "ORDER BY t.createdAt ASC")
    List<PaymentTransaction> findPendingCreatedBefore(@Param("beforeTime") LocalDateTime beforeTime);
}
