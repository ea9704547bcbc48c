package com.ewale.ewale.dto;

import com.ewale.ewale.entity.WithdrawalStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WithdrawalResponse {
    private UUID id;
    private String clientReference;
    private String mobileNumber;
    private BigDecimal amount;
    private WithdrawalStatus status;
    private Boolean isFulfilled;
    private Boolean refunded;
    private String responseCode;
    private String message;
    private LocalDateTime createdAt;
}
