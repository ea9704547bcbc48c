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
@Table(name = "ussd_transactions", indexes = {
        @Index(name = "idx_ussd_transactions_session_id", columnList = "session_id"),
        @Index(name = "idx_ussd_transactions_status_created", columnList = "status, created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PaymentTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "session_id", nullable = false)
    private String sessionId;

    @Column(name = "order_id", unique = true)
    private String orderId; // Hubtel OrderId, known once the payment callback arrives

    @Column(name = "client_reference", nullable = false)
    private String clientReference; // Reference used against the status API

    @Enumerated(EnumType.STRING)
    @Column(name = "service_type")
    private UssdServiceType serviceType;

    @Column(name = "product_name")
    private String productName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private TransactionStatus status = TransactionStatus.PENDING;

    @Column(name = "payment_status", length = 50)
    private String paymentStatus; // OrderInfo.Status as sent by Hubtel

    @Column(name = "customer_mobile_number", length = 20)
    private String customerMobileNumber;

    @Column(name = "customer_name")
    private String customerName;

    @Column(name = "customer_email")
    private String customerEmail;

    @Column(name = "currency", length = 10)
    private String currency = "GHS";

    @Column(name = "amount", precision = 12, scale = 2)
    private BigDecimal amount; // Amount requested at checkout

    @Column(name = "amount_paid", precision = 12, scale = 2)
    private BigDecimal amountPaid;

    @Column(name = "amount_after_charges", precision = 12, scale = 2)
    private BigDecimal amountAfterCharges;

    @Column(name = "charges", precision = 12, scale = 2)
    private BigDecimal charges;

    @Column(name = "payment_type", length = 50)
    private String paymentType;

    @Column(name = "payment_description", length = 500)
    private String paymentDescription;

    @Column(name = "payment_date")
    private LocalDateTime paymentDate;

    @Column(name = "order_date")
    private LocalDateTime orderDate;

    @Column(name = "external_transaction_id")
    private String externalTransactionId;

    @Column(name = "extra_data", length = 4000)
    private String extraData; // JSON

    @Column(name = "callback_received", nullable = false)
    private Boolean callbackReceived = false;

    @Column(name = "fulfillment_triggered", nullable = false)
    private Boolean fulfillmentTriggered = false;

    @Column(name = "status_check_count", nullable = false)
    private Integer statusCheckCount = 0;

    @Column(name = "last_status_check_at")
    private LocalDateTime lastStatusCheckAt;

    @Column(name = "last_response_code", length = 10)
    private String lastResponseCode;

    @Column(name = "message", length = 1000)
    private String message;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
