package com.ewale.ewale.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserEarningsResponse {
    private String mobileNumber;
    private BigDecimal totalEarnings;
    private BigDecimal totalWithdrawn;
    private BigDecimal pendingWithdrawals;
    private BigDecimal availableBalance;
    private long totalTransactions;
    private BigDecimal commissionPercentage;
}
