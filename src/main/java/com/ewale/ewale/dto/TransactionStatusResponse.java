package com.ewale.ewale.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Body of the Hubtel transaction status API.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransactionStatusResponse {
    private String message;
    private String responseCode;
    private StatusData data;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StatusData {
        private String date;
        private String status; // Paid | Unpaid
        private String transactionId;
        private String externalTransactionId;
        private String paymentMethod;
        private String clientReference;
        private String currencyCode;
        private BigDecimal amount;
        private BigDecimal charges;
        private BigDecimal amountAfterCharges;
        private Boolean isFulfilled;
    }
}
