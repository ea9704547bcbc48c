package com.ewale.ewale.service;

import com.ewale.ewale.dto.UserEarningsResponse;
import com.ewale.ewale.entity.CommissionTransactionLog;
import com.ewale.ewale.entity.WithdrawalStatus;
import com.ewale.ewale.repository.CommissionTransactionLogRepository;
import com.ewale.ewale.repository.WithdrawalRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EarningsService Unit Tests")
class EarningsServiceTest {

    private static final String MOBILE = "233550982043";

    @Mock
    private CommissionTransactionLogRepository commissionLogRepository;

    @Mock
    private WithdrawalRepository withdrawalRepository;

    @InjectMocks
    private EarningsService earningsService;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(earningsService, "commissionPercentage", new BigDecimal("5"));
        ReflectionTestUtils.setField(earningsService, "minimumWithdrawal", new BigDecimal("10"));
    }

    @Test
    @DisplayName("Available balance is earnings minus completed and pending withdrawals")
    void balanceIdentity() {
        // Given
        when(commissionLogRepository.sumDeliveredAmountByMobileNumber(MOBILE)).thenReturn(new BigDecimal("1000.00"));
        when(withdrawalRepository.sumAmountByMobileNumberAndStatus(MOBILE, WithdrawalStatus.COMPLETED))
                .thenReturn(new BigDecimal("20.00"));
        when(withdrawalRepository.sumAmountByMobileNumberAndStatus(MOBILE, WithdrawalStatus.PENDING))
                .thenReturn(new BigDecimal("10.00"));
        when(commissionLogRepository.findByMobileNumberOrderByCreatedAtDesc(MOBILE))
                .thenReturn(List.of(new CommissionTransactionLog(), new CommissionTransactionLog()));

        // When
        UserEarningsResponse earnings = earningsService.getUserEarnings(MOBILE);

        // Then
        assertThat(earnings.getTotalEarnings()).isEqualByComparingTo("50.00");
        assertThat(earnings.getAvailableBalance()).isEqualByComparingTo("20.00");
        assertThat(earnings.getAvailableBalance()).isEqualByComparingTo(earnings.getTotalEarnings()
                .subtract(earnings.getTotalWithdrawn()).subtract(earnings.getPendingWithdrawals()));
        assertThat(earnings.getTotalTransactions()).isEqualTo(2);
    }

    @Test
    @DisplayName("Subscriber with no history has a zero balance")
    void noHistory() {
        // Given
        when(commissionLogRepository.findByMobileNumberOrderByCreatedAtDesc(MOBILE)).thenReturn(Collections.emptyList());

        // When
        UserEarningsResponse earnings = earningsService.getUserEarnings(MOBILE);

        // Then
        assertThat(earnings.getTotalEarnings()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(earnings.getAvailableBalance()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(earnings.getCommissionPercentage()).isEqualByComparingTo("5");
    }
}
