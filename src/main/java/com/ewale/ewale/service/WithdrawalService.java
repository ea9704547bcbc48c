package com.ewale.ewale.service;

import com.ewale.ewale.dto.SendMoneyCallbackRequest;
import com.ewale.ewale.dto.SendMoneyRequest;
import com.ewale.ewale.dto.SendMoneyResponse;
import com.ewale.ewale.dto.UserEarningsResponse;
import com.ewale.ewale.dto.WithdrawalResponse;
import com.ewale.ewale.dto.WithdrawalResult;
import com.ewale.ewale.entity.Withdrawal;
import com.ewale.ewale.entity.WithdrawalStatus;
import com.ewale.ewale.repository.WithdrawalRepository;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import com.ewale.ewale.util.MobileNumberUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Commission withdrawals paid out through Send Money. A PENDING withdrawal already counts
 * against the available balance; a failed payout is refunded.
 */
@Service
public class WithdrawalService {

    private static final Logger logger = LoggerFactory.getLogger(WithdrawalService.class);

    private final WithdrawalRepository withdrawalRepository;
    private final EarningsService earningsService;
    private final SendMoneyService sendMoneyService;

    @Value("${hubtel.send-money.callback-url:}")
    private String sendMoneyCallbackUrl;

    public WithdrawalService(WithdrawalRepository withdrawalRepository, EarningsService earningsService,
                             SendMoneyService sendMoneyService) {
        this.withdrawalRepository = withdrawalRepository;
        this.earningsService = earningsService;
        this.sendMoneyService = sendMoneyService;
    }

    /**
     * @param clientReference payout reference, generated when null
     */
    @Transactional
    public WithdrawalResult processWithdrawalRequest(String mobileNumber, BigDecimal amount, String clientReference) {
        BigDecimal minimum = earningsService.getMinimumWithdrawal();
        if (amount == null || amount.compareTo(minimum) < 0) {
            return WithdrawalResult.rejected("Minimum withdrawal amount is GH " + UssdResponseBuilder.formatAmount(minimum));
        }

        UserEarningsResponse earnings = earningsService.getUserEarnings(mobileNumber);
        if (amount.compareTo(earnings.getAvailableBalance()) > 0) {
            return WithdrawalResult.rejected("Insufficient balance. Available: GH "
                    + UssdResponseBuilder.formatAmount(earnings.getAvailableBalance()));
        }

        String msisdn = MobileNumberUtil.normalize(mobileNumber);
        if (msisdn == null) {
            return WithdrawalResult.rejected("Invalid mobile number");
        }
        String reference = clientReference != null ? clientReference
                : "withdrawal_" + msisdn + "_" + System.currentTimeMillis();
        String channel = MobileNumberUtil.sendMoneyChannel(msisdn);

        SendMoneyRequest request = new SendMoneyRequest(mobileNumber, msisdn, null, channel, amount,
                sendMoneyCallbackUrl, "Commission withdrawal for " + mobileNumber, reference);

        Withdrawal withdrawal = new Withdrawal();
        withdrawal.setClientReference(reference);
        withdrawal.setMobileNumber(mobileNumber);
        withdrawal.setAmount(amount);
        withdrawal.setChannel(channel);

        try {
            SendMoneyResponse response = sendMoneyService.sendMoney(request);
            boolean accepted = HubtelResponseCode.SUCCESS.getCode().equals(response.getResponseCode())
                    || HubtelResponseCode.PENDING.getCode().equals(response.getResponseCode());
            withdrawal.setResponseCode(response.getResponseCode());
            withdrawal.setMessage(response.getData() != null && response.getData().getDescription() != null
                    ? response.getData().getDescription() : response.getMessage());
            if (response.getData() != null) {
                withdrawal.setHubtelTransactionId(response.getData().getTransactionId());
                withdrawal.setExternalTransactionId(response.getData().getExternalTransactionId());
                if (response.getData().getCharges() != null) {
                    withdrawal.setCharges(response.getData().getCharges());
                }
            }
            withdrawal.setStatus(accepted ? WithdrawalStatus.PENDING : WithdrawalStatus.FAILED);
            withdrawalRepository.save(withdrawal);

            if (accepted) {
                logger.info("Withdrawal {} submitted for {}: GH {}", reference, mobileNumber, amount);
                return new WithdrawalResult(true,
                        "Withdrawal request submitted successfully. You will receive payment within 24 hours.",
                        reference, amount, WithdrawalStatus.PENDING);
            }
            logger.error("Withdrawal {} rejected by Send Money: {}", reference, withdrawal.getMessage());
            return new WithdrawalResult(false, "Withdrawal failed: " + withdrawal.getMessage(),
                    reference, amount, WithdrawalStatus.FAILED);
        } catch (RuntimeException e) {
            logger.error("Error processing withdrawal {} for {}: {}", reference, mobileNumber, e.getMessage());
            withdrawal.setStatus(WithdrawalStatus.FAILED);
            withdrawal.setMessage(e.getMessage());
            withdrawalRepository.save(withdrawal);
            return new WithdrawalResult(false, "Withdrawal processing failed: " + e.getMessage(),
                    reference, amount, WithdrawalStatus.FAILED);
        }
    }

    /**
     * Final payout result. Only a PENDING withdrawal is changed.
     */
    @Transactional
    public void handleSendMoneyCallback(SendMoneyCallbackRequest callback) {
        String reference = callback.getReference();
        Optional<Withdrawal> existing = withdrawalRepository.findByClientReference(reference);
        if (existing.isEmpty()) {
            logger.error("Withdrawal record not found for client reference: {}", reference);
            return;
        }
        Withdrawal withdrawal = existing.get();
        if (withdrawal.getStatus() != WithdrawalStatus.PENDING) {
            logger.info("Withdrawal {} already {}, ignoring callback", reference, withdrawal.getStatus());
            return;
        }

        withdrawal.setResponseCode(callback.getResponseCode());
        withdrawal.setHubtelTransactionId(callback.getData().getTransactionId());
        withdrawal.setExternalTransactionId(callback.getData().getExternalTransactionId());
        withdrawal.setMessage(callback.getData().getDescription());

        if (HubtelResponseCode.SUCCESS.getCode().equals(callback.getResponseCode())) {
            withdrawal.setStatus(WithdrawalStatus.COMPLETED);
            withdrawal.setIsFulfilled(true);
            logger.info("Withdrawal completed for {}: GH {}", withdrawal.getMobileNumber(), withdrawal.getAmount());
        } else {
            markRefunded(withdrawal);
            logger.warn("Withdrawal failed for {}: GH {} refunded", withdrawal.getMobileNumber(), withdrawal.getAmount());
        }
        withdrawalRepository.save(withdrawal);
    }

    /**
     * Refunds a withdrawal whose order failed. Does nothing when the reference is not a pending withdrawal.
     *
     * @return true when a refund was applied
     */
    @Transactional
    public boolean refundIfWithdrawal(String clientReference) {
        Optional<Withdrawal> existing = withdrawalRepository.findByClientReference(clientReference);
        if (existing.isEmpty() || existing.get().getStatus() != WithdrawalStatus.PENDING) {
            return false;
        }
        Withdrawal withdrawal = existing.get();
        markRefunded(withdrawal);
        withdrawalRepository.save(withdrawal);
        logger.info("Refunded withdrawal {} of GH {}", clientReference, withdrawal.getAmount());
        return true;
    }

    public List<WithdrawalResponse> getWithdrawalHistory(String mobileNumber) {
        return withdrawalRepository.findByMobileNumberOrderByCreatedAtDesc(mobileNumber).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    private void markRefunded(Withdrawal withdrawal) {
        withdrawal.setStatus(WithdrawalStatus.FAILED);
        withdrawal.setIsFulfilled(false);
        withdrawal.setRefunded(true);
        withdrawal.setRefundedAt(LocalDateTime.now());
    }

    private WithdrawalResponse toResponse(Withdrawal withdrawal) {
        return new WithdrawalResponse(withdrawal.getId(), withdrawal.getClientReference(), withdrawal.getMobileNumber(),
                withdrawal.getAmount(), withdrawal.getStatus(), withdrawal.getIsFulfilled(), withdrawal.getRefunded(),
                withdrawal.getResponseCode(), withdrawal.getMessage(), withdrawal.getCreatedAt());
    }
}
