package com.ewale.ewale.service;

import com.ewale.ewale.dto.CommissionServiceRequest;
import com.ewale.ewale.dto.CommissionServiceResponse;
import com.ewale.ewale.entity.CommissionServiceStatus;
import com.ewale.ewale.entity.UtilityProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Delivers paid products through Hubtel Commission Services.
 */
@Service
public class CommissionService {

    private static final Logger logger = LoggerFactory.getLogger(CommissionService.class);

    private final RestTemplate restTemplate;
    private final HubtelEndpoints endpoints;
    private final CommissionTransactionLogService commissionLogService;

    @Value("${hubtel.commission.base-url:https://cs.hubtel.com/commissionservices}")
    private String commissionBaseUrl;

    @Value("${hubtel.prepaid-deposit-id:}")
    private String prepaidDepositId;

    @Value("${hubtel.auth-token:}")
    private String authToken;

    @Value("${hubtel.commission.callback-url:}")
    private String defaultCallbackUrl;

    public CommissionService(RestTemplate restTemplate, HubtelEndpoints endpoints,
                             CommissionTransactionLogService commissionLogService) {
        this.restTemplate = restTemplate;
        this.endpoints = endpoints;
        this.commissionLogService = commissionLogService;
    }

    /**
     * Sends the delivery order. Returns null when the order could not be placed; the commission log
     * records the outcome either way.
     */
    public CommissionServiceResponse processCommissionService(CommissionServiceRequest request) {
        logger.info("Processing commission service - Type: {}, Amount: {}, Destination: {}",
                request.getServiceType(), request.getAmount(), request.getDestination());

        String endpoint = endpoints.forRequest(request);
        if (endpoint == null) {
            logger.error("No Commission Services endpoint for {}", request.getServiceType());
            commissionLogService.updateServiceStatus(request.getClientReference(), CommissionServiceStatus.FAILED,
                    "Commission service error", false, "No endpoint for service type " + request.getServiceType());
            return null;
        }

        String url = commissionBaseUrl + "/" + prepaidDepositId + "/" + endpoint;
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.AUTHORIZATION, "Basic " + authToken);

        try {
            ResponseEntity<CommissionServiceResponse> response = restTemplate.exchange(
                    url, HttpMethod.POST, new HttpEntity<>(buildPayload(request), headers),
                    CommissionServiceResponse.class);
            CommissionServiceResponse body = response.getBody();
            logger.info("Commission service response for {}: {}", request.getClientReference(), body);

            if (body == null) {
                commissionLogService.updateServiceStatus(request.getClientReference(), CommissionServiceStatus.FAILED,
                        "Commission service request failed", false, "Empty response");
                return null;
            }

            // 0001 means accepted; the final outcome arrives on the commission callback
            if (HubtelResponseCode.PENDING.getCode().equals(body.getResponseCode())) {
                commissionLogService.updateServiceStatus(request.getClientReference(), CommissionServiceStatus.PENDING,
                        body.getMessage(), false, null);
            } else if (body.isDelivered()) {
                commissionLogService.updateServiceStatus(request.getClientReference(), CommissionServiceStatus.DELIVERED,
                        body.getMessage(), true, null);
            } else {
                commissionLogService.updateServiceStatus(request.getClientReference(), CommissionServiceStatus.FAILED,
                        body.getMessage(), false, body.getMessage());
            }
            return body;
        } catch (Exception e) {
            logger.error("Error processing commission service for {}: ", request.getClientReference(), e);
            commissionLogService.updateServiceStatus(request.getClientReference(), CommissionServiceStatus.FAILED,
                    "Commission service error", false, e.getMessage());
            return null;
        }
    }

    Map<String, Object> buildPayload(CommissionServiceRequest request) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("Destination", request.getDestination());
        payload.put("Amount", request.getAmount());
        payload.put("CallbackUrl", request.getCallbackUrl() != null ? request.getCallbackUrl() : defaultCallbackUrl);
        payload.put("ClientReference", request.getClientReference());

        Map<String, Object> extra = request.getExtraData() != null ? request.getExtraData() : new HashMap<>();
        switch (request.getServiceType()) {
            case AIRTIME: {
                Map<String, Object> data = new HashMap<>(extra);
                data.put("network", request.getNetwork().getDisplayName());
                payload.put("Extradata", data);
                break;
            }
            case BUNDLE: {
                Map<String, Object> data = new HashMap<>();
                data.put("bundle", extra.get("bundleValue"));
                payload.put("Extradata", data);
                break;
            }
            case UTILITY: {
                Map<String, Object> data = new HashMap<>();
                data.put("bundle", extra.get("meterNumber"));
                if (request.getUtilityProvider() == UtilityProvider.GHANA_WATER) {
                    data.put("Email", extra.get("email"));
                    data.put("SessionId", extra.get("sessionId"));
                }
                payload.put("Extradata", data);
                break;
            }
            default:
                break;
        }
        return payload;
    }
}
