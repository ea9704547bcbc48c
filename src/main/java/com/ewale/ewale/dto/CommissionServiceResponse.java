package com.ewale.ewale.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CommissionServiceResponse {
    @JsonProperty("ResponseCode")
    private String responseCode;

    @JsonProperty("Message")
    private String message;

    @JsonProperty("Data")
    private HubtelTransactionData data;

    public boolean isDelivered() {
        return "0000".equals(responseCode) && data != null && Boolean.TRUE.equals(data.getIsFulfilled());
    }
}
