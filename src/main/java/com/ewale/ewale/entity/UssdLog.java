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
@Table(name = "ussd_logs", indexes = {
        @Index(name = "idx_ussd_logs_mobile", columnList = "mobile_number")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UssdLog {

    public static final String STATUS_INITIATED = "initiated";
    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "session_id", nullable = false, unique = true)
    private String sessionId;

    @Column(name = "mobile_number", length = 20)
    private String mobileNumber;

    @Column(name = "sequence")
    private Integer sequence;

    @Column(name = "last_message", length = 200)
    private String lastMessage;

    @Column(name = "service_type", length = 50)
    private String serviceType;

    @Column(name = "service")
    private String service;

    @Column(name = "flow", length = 10)
    private String flow;

    @Column(name = "network", length = 50)
    private String network;

    @Column(name = "tv_provider", length = 50)
    private String tvProvider;

    @Column(name = "utility_provider", length = 50)
    private String utilityProvider;

    @Column(name = "account_number", length = 50)
    private String accountNumber;

    @Column(name = "meter_number", length = 50)
    private String meterNumber;

    @Column(name = "bundle_value")
    private String bundleValue;

    @Column(name = "recipient_name")
    private String recipientName;

    @Column(name = "recipient_mobile", length = 20)
    private String recipientMobile;

    @Column(name = "quantity")
    private Integer quantity;

    @Column(name = "amount", precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "total_amount", precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "status", nullable = false, length = 20)
    private String status = STATUS_INITIATED;

    @Column(name = "is_successful")
    private Boolean isSuccessful;

    @Column(name = "order_id")
    private String orderId;

    @Column(name = "payment_status", length = 50)
    private String paymentStatus;

    @Column(name = "amount_paid", precision = 12, scale = 2)
    private BigDecimal amountPaid;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "dialed_at", nullable = false)
    private LocalDateTime dialedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "duration_seconds")
    private Long durationSeconds;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
