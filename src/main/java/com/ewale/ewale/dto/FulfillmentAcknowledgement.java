package com.ewale.ewale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Final service status reported back to the Hubtel gateway for a checkout order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FulfillmentAcknowledgement {

    public static final String SERVICE_STATUS_SUCCESS = "success";
    public static final String SERVICE_STATUS_FAILED = "failed";

    @JsonProperty("SessionId")
    private String sessionId;

    @JsonProperty("OrderId")
    private String orderId;

    @JsonProperty("MetaData")
    private Object metaData;

    @JsonProperty("ServiceStatus")
    private String serviceStatus;
}
