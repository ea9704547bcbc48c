package com.ewale.ewale.service;

import com.ewale.ewale.dto.FulfillmentAcknowledgement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

/**
 * Reports the final service status of a checkout order back to the Hubtel USSD gateway.
 */
@Service
public class HubtelGatewayClient {

    private static final Logger logger = LoggerFactory.getLogger(HubtelGatewayClient.class);

    @Value("${hubtel.gateway.fulfillment-url:https://gs.hubtel.com/partner/ussd/fulfillment}")
    private String fulfillmentUrl;

    @Value("${hubtel.gateway.access-token:}")
    private String accessToken;

    private final RestTemplate restTemplate;

    public HubtelGatewayClient(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    public boolean sendFulfillmentAcknowledgement(FulfillmentAcknowledgement acknowledgement) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.AUTHORIZATION, "Basic " + accessToken);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    fulfillmentUrl, new HttpEntity<>(acknowledgement, headers), String.class);
            logger.info("Fulfilment acknowledgement for order {} ({}) sent, status {}",
                    acknowledgement.getOrderId(), acknowledgement.getServiceStatus(), response.getStatusCode());
            return true;
        } catch (Exception e) {
            logger.error("Failed to send fulfilment acknowledgement for order {}: {}",
                    acknowledgement.getOrderId(), e.getMessage());
            return false;
        }
    }
}
