package com.ewale.ewale.dto;

import com.ewale.ewale.entity.WithdrawalStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WithdrawalResult {
    private boolean success;
    private String message;
    private String clientReference;
    private BigDecimal amount;
    private WithdrawalStatus status;

    public static WithdrawalResult rejected(String message) {
        return new WithdrawalResult(false, message, null, null, null);
    }
}
