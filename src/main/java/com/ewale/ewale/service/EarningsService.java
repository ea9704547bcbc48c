package com.ewale.ewale.service;

import com.ewale.ewale.dto.UserEarningsResponse;
import com.ewale.ewale.entity.WithdrawalStatus;
import com.ewale.ewale.repository.CommissionTransactionLogRepository;
import com.ewale.ewale.repository.WithdrawalRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Commission earned by a subscriber on delivered purchases, net of withdrawals.
 * availableBalance = totalEarnings - totalWithdrawn - pendingWithdrawals.
 */
@Service
public class EarningsService {

    private final CommissionTransactionLogRepository commissionLogRepository;
    private final WithdrawalRepository withdrawalRepository;

    @Value("${ussd.earnings.commission-percentage:5}")
    private BigDecimal commissionPercentage;

    @Value("${ussd.earnings.minimum-withdrawal:10}")
    private BigDecimal minimumWithdrawal;

    public EarningsService(CommissionTransactionLogRepository commissionLogRepository,
                           WithdrawalRepository withdrawalRepository) {
        this.commissionLogRepository = commissionLogRepository;
        this.withdrawalRepository = withdrawalRepository;
    }

    public UserEarningsResponse getUserEarnings(String mobileNumber) {
        BigDecimal deliveredAmount = nullToZero(commissionLogRepository.sumDeliveredAmountByMobileNumber(mobileNumber));
        BigDecimal totalEarnings = deliveredAmount.multiply(commissionPercentage)
                .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);
        BigDecimal totalWithdrawn = nullToZero(
                withdrawalRepository.sumAmountByMobileNumberAndStatus(mobileNumber, WithdrawalStatus.COMPLETED));
        BigDecimal pendingWithdrawals = nullToZero(
                withdrawalRepository.sumAmountByMobileNumberAndStatus(mobileNumber, WithdrawalStatus.PENDING));
        BigDecimal availableBalance = totalEarnings.subtract(totalWithdrawn).subtract(pendingWithdrawals);
        long totalTransactions = commissionLogRepository.findByMobileNumberOrderByCreatedAtDesc(mobileNumber).size();

        return new UserEarningsResponse(mobileNumber, totalEarnings, totalWithdrawn, pendingWithdrawals,
                availableBalance, totalTransactions, commissionPercentage);
    }

    public BigDecimal getMinimumWithdrawal() {
        return minimumWithdrawal;
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
