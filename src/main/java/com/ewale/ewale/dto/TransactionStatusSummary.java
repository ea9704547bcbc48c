package com.ewale.ewale.dto;

import com.ewale.ewale.entity.PaymentStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Classified outcome of a Hubtel response code.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransactionStatusSummary {
    private String responseCode;
    private boolean successful;
    private PaymentStatus status;
    private boolean shouldRetry;
    private String message;
    private TransactionStatusResponse.StatusData data;
}
