package com.ewale.ewale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SendMoneyRequest {
    @JsonProperty("RecipientName")
    private String recipientName;

    @JsonProperty("RecipientMsisdn")
    private String recipientMsisdn;

    @JsonProperty("CustomerEmail")
    private String customerEmail;

    @JsonProperty("Channel")
    private String channel; // mtn-gh, vodafone-gh, tigo-gh

    @JsonProperty("Amount")
    private BigDecimal amount;

    @JsonProperty("PrimaryCallbackURL")
    private String primaryCallbackUrl;

    @JsonProperty("Description")
    private String description;

    @JsonProperty("ClientReference")
    private String clientReference;
}
