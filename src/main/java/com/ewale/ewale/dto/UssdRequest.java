package com.ewale.ewale.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One inbound USSD turn as delivered by the Hubtel programmable services gateway.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UssdRequest {

    public static final String TYPE_INITIATION = "initiation";
    public static final String TYPE_RESPONSE = "response";

    @NotBlank(message = "Type is required")
    @JsonProperty("Type")
    private String type;

    @NotBlank(message = "SessionId is required")
    @JsonProperty("SessionId")
    private String sessionId;

    @JsonProperty("Sequence")
    private Integer sequence;

    @JsonProperty("Message")
    private String message;

    @JsonProperty("Mobile")
    private String mobile;

    // Informational fields, not used for routing
    @JsonProperty("ServiceCode")
    private String serviceCode;

    @JsonProperty("Operator")
    private String operator;

    @JsonProperty("ClientState")
    private String clientState;

    @JsonProperty("Platform")
    private String platform;

    public String getMessageOrEmpty() {
        return message == null ? "" : message.trim();
    }
}
