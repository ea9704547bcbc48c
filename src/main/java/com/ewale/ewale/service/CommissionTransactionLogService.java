package com.ewale.ewale.service;

import com.ewale.ewale.dto.CommissionCallbackRequest;
import com.ewale.ewale.dto.PaymentCallbackRequest;
import com.ewale.ewale.dto.TransactionStatusSummary;
import com.ewale.ewale.entity.CommissionServiceStatus;
import com.ewale.ewale.entity.CommissionTransactionLog;
import com.ewale.ewale.entity.PaymentStatus;
import com.ewale.ewale.repository.CommissionTransactionLogRepository;
import com.ewale.ewale.service.ussd.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Per-order purchase ledger that earnings are computed from. Keyed by the Hubtel order id.
 */
@Service
public class CommissionTransactionLogService {

    private static final Logger logger = LoggerFactory.getLogger(CommissionTransactionLogService.class);

    private final CommissionTransactionLogRepository commissionLogRepository;

    public CommissionTransactionLogService(CommissionTransactionLogRepository commissionLogRepository) {
        this.commissionLogRepository = commissionLogRepository;
    }

    /**
     * Creates or refreshes the entry for a paid (or declined) checkout.
     *
     * @param state session of the purchase, null when it is no longer available
     */
    @Transactional
    public CommissionTransactionLog recordPayment(PaymentCallbackRequest callback, SessionState state,
                                                  TransactionStatusSummary classification) {
        CommissionTransactionLog log = commissionLogRepository.findByClientReference(callback.getOrderId())
                .orElseGet(CommissionTransactionLog::new);

        PaymentCallbackRequest.OrderInfo orderInfo = callback.getOrderInfo();
        PaymentCallbackRequest.Payment payment = orderInfo.getPayment();

        log.setClientReference(callback.getOrderId());
        log.setSessionId(callback.getSessionId());
        log.setMobileNumber(firstNonBlank(orderInfo.getCustomerMobileNumber(),
                state != null ? state.getMobile() : null, "unknown"));

        BigDecimal amountPaid = payment.getAmountPaid() != null ? payment.getAmountPaid() : BigDecimal.ZERO;
        BigDecimal afterCharges = payment.getAmountAfterCharges() != null ? payment.getAmountAfterCharges() : amountPaid;
        log.setAmount(amountPaid);
        log.setAmountAfterCharges(afterCharges);
        log.setCharges(amountPaid.subtract(afterCharges));
        log.setCurrencyCode(orderInfo.getCurrency() != null ? orderInfo.getCurrency() : "GHS");
        log.setPaymentMethod(payment.getPaymentType());

        log.setStatus(classification.isSuccessful() ? PaymentStatus.PAID : PaymentStatus.UNPAID);
        log.setResponseCode(classification.getResponseCode());
        log.setMessage(payment.getPaymentDescription() != null ? payment.getPaymentDescription() : classification.getMessage());
        log.setTransactionDate(LocalDateTime.now());

        if (state != null) {
            log.setServiceType(state.getServiceType() != null ? state.getServiceType().getCode() : "unknown");
            log.setNetwork(state.getNetwork() != null ? state.getNetwork().getDisplayName() : null);
            log.setTvProvider(state.getTvProvider() != null ? state.getTvProvider().getDisplayName() : null);
            log.setUtilityProvider(state.getUtilityProvider() != null ? state.getUtilityProvider().getDisplayName() : null);
            log.setBundleValue(state.getBundleValue());
            log.setAccountNumber(state.getAccountNumber());
            log.setMeterNumber(state.getMeterNumber());
        } else if (log.getServiceType() == null) {
            log.setServiceType("unknown");
        }

        return commissionLogRepository.save(log);
    }

    @Transactional
    public void updateServiceStatus(String clientReference, CommissionServiceStatus status, String message,
                                    Boolean isFulfilled, String errorMessage) {
        Optional<CommissionTransactionLog> existing = commissionLogRepository.findByClientReference(clientReference);
        if (existing.isEmpty()) {
            logger.warn("No commission log found for client reference {}", clientReference);
            return;
        }
        CommissionTransactionLog log = existing.get();
        log.setCommissionServiceStatus(status);
        log.setCommissionServiceMessage(message);
        log.setCommissionServiceDate(LocalDateTime.now());
        if (isFulfilled != null) {
            log.setIsFulfilled(isFulfilled);
        }
        if (errorMessage != null) {
            log.setErrorMessage(errorMessage);
        }
        commissionLogRepository.save(log);
    }

    /**
     * Applies a status API result. Pending results leave the entry untouched.
     */
    @Transactional
    public void applyStatusCheck(String clientReference, TransactionStatusSummary summary) {
        if (summary.getStatus() == PaymentStatus.PENDING || summary.isShouldRetry()) {
            return;
        }
        commissionLogRepository.findByClientReference(clientReference).ifPresent(log -> {
            if (log.getStatus() == PaymentStatus.PAID) {
                return;
            }
            log.setStatus(summary.getStatus());
            log.setResponseCode(summary.getResponseCode());
            log.setMessage(summary.getMessage());
            if (summary.getData() != null) {
                log.setHubtelTransactionId(summary.getData().getTransactionId());
                log.setExternalTransactionId(summary.getData().getExternalTransactionId());
                if (summary.getData().getCharges() != null) {
                    log.setCharges(summary.getData().getCharges());
                }
                if (summary.getData().getAmountAfterCharges() != null) {
                    log.setAmountAfterCharges(summary.getData().getAmountAfterCharges());
                }
            }
            commissionLogRepository.save(log);
        });
    }

    /**
     * Commission Services delivery callback: records the earned commission and the delivery outcome.
     */
    @Transactional
    public void handleCommissionCallback(CommissionCallbackRequest callback) {
        String reference = callback.getReference();
        logger.info("Commission callback received for {} with code {}", reference, callback.getResponseCode());

        Optional<CommissionTransactionLog> existing = commissionLogRepository.findByClientReference(reference);
        if (existing.isEmpty()) {
            logger.warn("Commission callback for unknown client reference {}", reference);
            return;
        }

        CommissionTransactionLog log = existing.get();
        boolean delivered = HubtelResponseCode.SUCCESS.getCode().equals(callback.getResponseCode());
        log.setCommissionServiceStatus(delivered ? CommissionServiceStatus.DELIVERED : CommissionServiceStatus.FAILED);
        log.setCommissionServiceMessage(callback.getData().getDescription() != null
                ? callback.getData().getDescription() : callback.getMessage());
        log.setCommissionServiceDate(LocalDateTime.now());
        log.setIsFulfilled(delivered);
        log.setHubtelTransactionId(callback.getData().getTransactionId());
        log.setExternalTransactionId(callback.getData().getExternalTransactionId());

        String commission = callback.getCommission();
        if (commission != null) {
            try {
                log.setCommission(new BigDecimal(commission));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non-numeric commission '{}' for {}", commission, reference);
            }
        }
        if (!delivered) {
            log.setErrorMessage(callback.getMessage());
        }
        commissionLogRepository.save(log);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
