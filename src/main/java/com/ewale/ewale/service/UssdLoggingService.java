package com.ewale.ewale.service;

import com.ewale.ewale.dto.PaymentCallbackRequest;
import com.ewale.ewale.dto.UssdStatisticsResponse;
import com.ewale.ewale.entity.UssdLog;
import com.ewale.ewale.repository.UssdLogRepository;
import com.ewale.ewale.service.ussd.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * One {@link UssdLog} per session, refreshed on every turn. Logging never breaks a USSD turn:
 * failures are logged and swallowed here.
 */
@Service
public class UssdLoggingService {

    private static final Logger logger = LoggerFactory.getLogger(UssdLoggingService.class);

    private final UssdLogRepository ussdLogRepository;

    public UssdLoggingService(UssdLogRepository ussdLogRepository) {
        this.ussdLogRepository = ussdLogRepository;
    }

    @Transactional
    public void logSessionState(String sessionId, String mobileNumber, Integer sequence, String message,
                                SessionState state, String status) {
        try {
            UssdLog log = ussdLogRepository.findBySessionId(sessionId).orElseGet(() -> {
                UssdLog created = new UssdLog();
                created.setSessionId(sessionId);
                created.setDialedAt(LocalDateTime.now());
                return created;
            });
            log.setMobileNumber(mobileNumber);
            log.setSequence(sequence);
            log.setLastMessage(message);
            // A finished session keeps its final status
            if (!UssdLog.STATUS_COMPLETED.equals(log.getStatus()) && !UssdLog.STATUS_FAILED.equals(log.getStatus())) {
                log.setStatus(status);
            }
            if (state != null) {
                copyState(state, log);
            }
            ussdLogRepository.save(log);
        } catch (Exception e) {
            logger.error("Error logging session state for {}: {}", sessionId, e.getMessage());
        }
    }

    @Transactional
    public void markCompleted(String sessionId) {
        updateStatus(sessionId, UssdLog.STATUS_COMPLETED, null, null);
    }

    @Transactional
    public void markCompleted(String sessionId, PaymentCallbackRequest callback) {
        updateStatus(sessionId, UssdLog.STATUS_COMPLETED, callback, null);
    }

    @Transactional
    public void markFailed(String sessionId, String errorMessage) {
        updateStatus(sessionId, UssdLog.STATUS_FAILED, null, errorMessage);
    }

    @Transactional
    public void markFailed(String sessionId, PaymentCallbackRequest callback, String errorMessage) {
        updateStatus(sessionId, UssdLog.STATUS_FAILED, callback, errorMessage);
    }

    private void updateStatus(String sessionId, String status, PaymentCallbackRequest callback, String errorMessage) {
        try {
            Optional<UssdLog> existing = ussdLogRepository.findBySessionId(sessionId);
            if (existing.isEmpty()) {
                logger.warn("No USSD log for session {} to mark {}", sessionId, status);
                return;
            }
            UssdLog log = existing.get();
            LocalDateTime now = LocalDateTime.now();
            log.setStatus(status);
            log.setCompletedAt(now);
            log.setIsSuccessful(UssdLog.STATUS_COMPLETED.equals(status));
            if (log.getDialedAt() != null) {
                log.setDurationSeconds(Duration.between(log.getDialedAt(), now).getSeconds());
            }
            if (errorMessage != null) {
                log.setErrorMessage(errorMessage);
            }
            if (callback != null) {
                log.setOrderId(callback.getOrderId());
                log.setPaymentStatus(callback.getOrderInfo().getStatus());
                log.setAmountPaid(callback.getOrderInfo().getPayment().getAmountPaid());
            }
            ussdLogRepository.save(log);
        } catch (Exception e) {
            logger.error("Error updating USSD log {} to {}: {}", sessionId, status, e.getMessage());
        }
    }

    public List<UssdLog> getLogsByMobile(String mobileNumber) {
        return ussdLogRepository.findByMobileNumberOrderByDialedAtDesc(mobileNumber);
    }

    public Optional<UssdLog> getLogBySession(String sessionId) {
        return ussdLogRepository.findBySessionId(sessionId);
    }

    public UssdStatisticsResponse getStatistics() {
        LocalDateTime startOfDay = LocalDate.now().atStartOfDay();
        long totalDialers = ussdLogRepository.countDistinctMobileNumbers();
        long todayDialers = ussdLogRepository.countDistinctMobileNumbersSince(startOfDay);
        long completed = ussdLogRepository.countByStatus(UssdLog.STATUS_COMPLETED);
        long failed = ussdLogRepository.countByStatus(UssdLog.STATUS_FAILED);

        String successRate = "0";
        if (totalDialers > 0) {
            successRate = BigDecimal.valueOf(completed)
                    .multiply(BigDecimal.valueOf(100))
                    .divide(BigDecimal.valueOf(totalDialers), 2, RoundingMode.HALF_UP)
                    .toPlainString();
        }
        return new UssdStatisticsResponse(totalDialers, todayDialers, completed, failed, successRate);
    }

    private static void copyState(SessionState state, UssdLog log) {
        log.setServiceType(state.getServiceType() != null ? state.getServiceType().getCode() : null);
        log.setService(state.getService());
        log.setFlow(state.getFlow() != null ? state.getFlow().name() : null);
        log.setNetwork(state.getNetwork() != null ? state.getNetwork().getDisplayName() : null);
        log.setTvProvider(state.getTvProvider() != null ? state.getTvProvider().getDisplayName() : null);
        log.setUtilityProvider(state.getUtilityProvider() != null ? state.getUtilityProvider().getDisplayName() : null);
        log.setAccountNumber(state.getAccountNumber());
        log.setMeterNumber(state.getMeterNumber());
        log.setBundleValue(state.getBundleValue());
        log.setRecipientName(state.getName());
        log.setRecipientMobile(state.getMobile());
        log.setQuantity(state.getQuantity());
        log.setAmount(state.getAmount());
        log.setTotalAmount(state.getTotalAmount());
    }
}
