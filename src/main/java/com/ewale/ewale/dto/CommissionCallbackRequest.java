package com.ewale.ewale.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Delivery result posted by Hubtel Commission Services after an airtime, bundle, TV or utility purchase.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CommissionCallbackRequest {

    @NotBlank(message = "ResponseCode is required")
    @JsonProperty("ResponseCode")
    private String responseCode;

    @JsonProperty("Message")
    private String message;

    @NotNull(message = "Data is required")
    @Valid
    @JsonProperty("Data")
    private HubtelTransactionData data;

    @JsonIgnore
    public String getReference() {
        return data != null ? data.getClientReference() : null;
    }

    @JsonIgnore
    public String getCommission() {
        if (data == null || data.getMeta() == null) {
            return null;
        }
        Object commission = data.getMeta().get("Commission");
        return commission != null ? commission.toString() : null;
    }
}
