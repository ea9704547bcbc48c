package com.ewale.ewale.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class WithdrawalRequest {
    @NotBlank(message = "Mobile number is required")
    @Pattern(regexp = "^(0\\d{9}|233\\d{9})$", message = "Mobile number must be 0XXXXXXXXX or 233XXXXXXXXX")
    private String mobileNumber;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    private BigDecimal amount;
}
