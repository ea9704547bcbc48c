package com.ewale.ewale.service;

import com.ewale.ewale.dto.PaymentCallbackRequest;
import com.ewale.ewale.dto.TransactionStatusSummary;
import com.ewale.ewale.entity.PaymentStatus;
import com.ewale.ewale.entity.PaymentTransaction;
import com.ewale.ewale.entity.TransactionStatus;
import com.ewale.ewale.entity.UssdServiceType;
import com.ewale.ewale.repository.PaymentTransactionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of every payment attempt. Status only moves forward: a COMPLETED or FAILED
 * transaction is never changed back.
 */
@Service
public class TransactionLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(TransactionLedgerService.class);

    private final PaymentTransactionRepository transactionRepository;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public TransactionLedgerService(PaymentTransactionRepository transactionRepository) {
        this.transactionRepository = transactionRepository;
    }

    /**
     * Records the checkout request before the subscriber is prompted. The session id doubles as the
     * client reference until Hubtel assigns an order id.
     */
    @Transactional
    public PaymentTransaction recordPending(String sessionId, String mobile, UssdServiceType serviceType,
                                            String productName, BigDecimal amount) {
        PaymentTransaction transaction = new PaymentTransaction();
        transaction.setSessionId(sessionId);
        transaction.setClientReference(sessionId);
        transaction.setCustomerMobileNumber(mobile);
        transaction.setServiceType(serviceType);
        transaction.setProductName(productName);
        transaction.setAmount(amount);
        transaction.setStatus(TransactionStatus.PENDING);
        PaymentTransaction saved = transactionRepository.save(transaction);
        logger.info("Recorded pending transaction for session {} - {} GHS {}", sessionId, productName, amount);
        return saved;
    }

    /**
     * Applies a payment callback. Looks the record up by order id, then by the session's unmatched
     * record, and creates one when neither exists.
     */
    @Transactional
    public PaymentTransaction upsertFromCallback(PaymentCallbackRequest callback) {
        PaymentTransaction transaction = transactionRepository.findByOrderId(callback.getOrderId())
                .orElseGet(() -> firstUnmatched(callback.getSessionId()).orElseGet(() -> {
                    logger.warn("No pending transaction for session {}, creating one from callback", callback.getSessionId());
                    PaymentTransaction created = new PaymentTransaction();
                    created.setSessionId(callback.getSessionId());
                    created.setClientReference(callback.getOrderId());
                    return created;
                }));

        PaymentCallbackRequest.OrderInfo orderInfo = callback.getOrderInfo();
        PaymentCallbackRequest.Payment payment = orderInfo.getPayment();

        transaction.setOrderId(callback.getOrderId());
        transaction.setCallbackReceived(true);
        transaction.setPaymentStatus(orderInfo.getStatus());
        if (orderInfo.getCustomerMobileNumber() != null) {
            transaction.setCustomerMobileNumber(orderInfo.getCustomerMobileNumber());
        }
        transaction.setCustomerName(orderInfo.getCustomerName());
        transaction.setCustomerEmail(orderInfo.getCustomerEmail());
        if (orderInfo.getCurrency() != null) {
            transaction.setCurrency(orderInfo.getCurrency());
        }
        transaction.setOrderDate(parseDate(orderInfo.getOrderDate()));
        if (transaction.getAmount() == null) {
            transaction.setAmount(orderInfo.getSubtotal());
        }

        transaction.setAmountPaid(payment.getAmountPaid());
        transaction.setAmountAfterCharges(payment.getAmountAfterCharges());
        if (payment.getAmountPaid() != null && payment.getAmountAfterCharges() != null) {
            transaction.setCharges(payment.getAmountPaid().subtract(payment.getAmountAfterCharges()));
        }
        transaction.setPaymentType(payment.getPaymentType());
        transaction.setPaymentDescription(payment.getPaymentDescription());
        transaction.setPaymentDate(parseDate(payment.getPaymentDate()));
        transaction.setExtraData(toJson(callback.getExtraData()));

        TransactionStatus next = callback.isSuccessful() ? TransactionStatus.COMPLETED : TransactionStatus.FAILED;
        if (transaction.getStatus() != null && transaction.getStatus().isTerminal()) {
            if (transaction.getStatus() != next) {
                logger.warn("Ignoring {} for order {}: already {}", next, callback.getOrderId(), transaction.getStatus());
            }
        } else {
            transaction.setStatus(next);
        }
        transaction.setLastResponseCode(callback.isSuccessful()
                ? HubtelResponseCode.SUCCESS.getCode() : HubtelResponseCode.GENERAL_FAILURE.getCode());
        transaction.setMessage(payment.getPaymentDescription());

        return transactionRepository.save(transaction);
    }

    /**
     * Claims fulfilment for an order with a conditional update, so concurrent deliveries of the
     * same callback get exactly one winner. Returns false when it was already claimed.
     */
    @Transactional
    public boolean markFulfillmentTriggered(String orderId) {
        if (transactionRepository.claimFulfillment(orderId) == 1) {
            return true;
        }
        if (!transactionRepository.existsByOrderId(orderId)) {
            logger.warn("Cannot mark fulfilment for unknown order {}", orderId);
        }
        return false;
    }

    /**
     * Applies a status API result to a non-terminal transaction.
     *
     * @return the status after the update
     */
    @Transactional
    public TransactionStatus applyStatusCheck(PaymentTransaction transaction, TransactionStatusSummary summary) {
        transaction.setStatusCheckCount(transaction.getStatusCheckCount() == null ? 1 : transaction.getStatusCheckCount() + 1);
        transaction.setLastStatusCheckAt(LocalDateTime.now());
        transaction.setLastResponseCode(summary.getResponseCode());

        if (transaction.getStatus() != null && transaction.getStatus().isTerminal()) {
            transactionRepository.save(transaction);
            return transaction.getStatus();
        }

        TransactionStatus next = toTransactionStatus(summary);
        transaction.setStatus(next);
        transaction.setMessage(summary.getMessage());
        if (summary.getData() != null) {
            if (summary.getData().getExternalTransactionId() != null) {
                transaction.setExternalTransactionId(summary.getData().getExternalTransactionId());
            }
            if (summary.getData().getAmountAfterCharges() != null) {
                transaction.setAmountAfterCharges(summary.getData().getAmountAfterCharges());
            }
            if (summary.getData().getCharges() != null) {
                transaction.setCharges(summary.getData().getCharges());
            }
            if (summary.getData().getStatus() != null) {
                transaction.setPaymentStatus(summary.getData().getStatus());
            }
        }
        transactionRepository.save(transaction);
        return next;
    }

    public List<PaymentTransaction> findPendingOlderThan(LocalDateTime beforeTime) {
        return transactionRepository.findPendingCreatedBefore(beforeTime);
    }

    /**
     * Only a paid result or a definitive failure finalises the record. Pending, retryable and
     * unknown-state (0005) results keep it open for the next poll or a late callback.
     */
    static TransactionStatus toTransactionStatus(TransactionStatusSummary summary) {
        if (summary.getStatus() == PaymentStatus.PAID) {
            return TransactionStatus.COMPLETED;
        }
        if (summary.getStatus() == PaymentStatus.PENDING) {
            return TransactionStatus.PENDING;
        }
        if (summary.isShouldRetry()
                || HubtelResponseCode.HTTP_FAILURE.getCode().equals(summary.getResponseCode())) {
            return TransactionStatus.PROCESSING;
        }
        return TransactionStatus.FAILED;
    }

    private Optional<PaymentTransaction> firstUnmatched(String sessionId) {
        List<PaymentTransaction> unmatched = transactionRepository.findUnmatchedBySessionId(sessionId);
        return unmatched.isEmpty() ? Optional.empty() : Optional.of(unmatched.get(0));
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize callback extra data: {}", e.getMessage());
            return null;
        }
    }

    private static LocalDateTime parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toLocalDateTime();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }
}
