package com.ewale.ewale.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "withdrawals", indexes = {
        @Index(name = "idx_withdrawals_mobile", columnList = "mobile_number")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Withdrawal {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "client_reference", nullable = false, unique = true)
    private String clientReference;

    @Column(name = "hubtel_transaction_id")
    private String hubtelTransactionId;

    @Column(name = "external_transaction_id")
    private String externalTransactionId;

    @Column(name = "mobile_number", nullable = false, length = 20)
    private String mobileNumber;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "charges", precision = 12, scale = 2)
    private BigDecimal charges = BigDecimal.ZERO;

    @Column(name = "currency_code", length = 10)
    private String currencyCode = "GHS";

    @Column(name = "channel", length = 30)
    private String channel;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private WithdrawalStatus status = WithdrawalStatus.PENDING;

    @Column(name = "is_fulfilled", nullable = false)
    private Boolean isFulfilled = false;

    @Column(name = "refunded", nullable = false)
    private Boolean refunded = false;

    @Column(name = "refunded_at")
    private LocalDateTime refundedAt;

    @Column(name = "response_code", length = 10)
    private String responseCode;

    @Column(name = "message", length = 1000)
    private String message;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
