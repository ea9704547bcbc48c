package com.ewale.ewale.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

/**
 * The {@code Data} block shared by Send Money and Commission Services responses and callbacks.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HubtelTransactionData {
    @JsonProperty("AmountDebited")
    private BigDecimal amountDebited;

    @JsonProperty("TransactionId")
    private String transactionId;

    @JsonProperty("ClientReference")
    private String clientReference;

    @JsonProperty("Description")
    private String description;

    @JsonProperty("ExternalTransactionId")
    private String externalTransactionId;

    @JsonProperty("Amount")
    private BigDecimal amount;

    @JsonProperty("Charges")
    private BigDecimal charges;

    @JsonProperty("Meta")
    private Map<String, Object> meta;

    @JsonProperty("RecipientName")
    private String recipientName;

    @JsonProperty("IsFulfilled")
    private Boolean isFulfilled;
}
