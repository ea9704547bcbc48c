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

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SendMoneyCallbackRequest {

    @NotBlank(message = "ResponseCode is required")
    @JsonProperty("ResponseCode")
    private String responseCode;

    @NotNull(message = "Data is required")
    @Valid
    @JsonProperty("Data")
    private HubtelTransactionData data;

    @JsonIgnore
    public String getReference() {
        return data != null ? data.getClientReference() : null;
    }
}
