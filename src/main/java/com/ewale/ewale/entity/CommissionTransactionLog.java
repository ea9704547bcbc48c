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
@Table(name = "commission_transaction_logs", indexes = {
        @Index(name = "idx_commission_logs_mobile", columnList = "mobile_number")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommissionTransactionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "client_reference", nullable = false, unique = true)
    private String clientReference; // Hubtel OrderId of the paid checkout

    @Column(name = "hubtel_transaction_id")
    private String hubtelTransactionId;

    @Column(name = "external_transaction_id")
    private String externalTransactionId;

    @Column(name = "mobile_number", nullable = false, length = 20)
    private String mobileNumber;

    @Column(name = "session_id", nullable = false)
    private String sessionId;

    @Column(name = "service_type", nullable = false, length = 50)
    private String serviceType;

    @Column(name = "network", length = 50)
    private String network;

    @Column(name = "tv_provider", length = 50)
    private String tvProvider;

    @Column(name = "utility_provider", length = 50)
    private String utilityProvider;

    @Column(name = "bundle_value")
    private String bundleValue;

    @Column(name = "account_number", length = 50)
    private String accountNumber;

    @Column(name = "meter_number", length = 50)
    private String meterNumber;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "commission", precision = 12, scale = 2)
    private BigDecimal commission; // Reported by the commission-service callback

    @Column(name = "charges", precision = 12, scale = 2)
    private BigDecimal charges;

    @Column(name = "amount_after_charges", precision = 12, scale = 2)
    private BigDecimal amountAfterCharges;

    @Column(name = "currency_code", length = 10)
    private String currencyCode = "GHS";

    @Column(name = "payment_method", length = 50)
    private String paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaymentStatus status = PaymentStatus.PENDING;

    @Column(name = "is_fulfilled", nullable = false)
    private Boolean isFulfilled = false;

    @Column(name = "response_code", length = 10)
    private String responseCode;

    @Column(name = "message", length = 1000)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "commission_service_status", nullable = false, length = 20)
    private CommissionServiceStatus commissionServiceStatus = CommissionServiceStatus.PENDING;

    @Column(name = "commission_service_message", length = 1000)
    private String commissionServiceMessage;

    @Column(name = "commission_service_date")
    private LocalDateTime commissionServiceDate;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "retry_count", nullable = false)
    private Integer retryCount = 0;

    @Column(name = "is_retryable", nullable = false)
    private Boolean isRetryable = true;

    @Column(name = "transaction_date")
    private LocalDateTime transactionDate;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
