package com.ewale.ewale.service;

import com.ewale.ewale.dto.SendMoneyRequest;
import com.ewale.ewale.dto.SendMoneyResponse;
import com.ewale.ewale.exception.HubtelApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Hubtel Send Money: pays out to a mobile money wallet from the prepaid deposit account.
 */
@Service
public class SendMoneyService {

    private static final Logger logger = LoggerFactory.getLogger(SendMoneyService.class);

    private final RestTemplate restTemplate;

    @Value("${hubtel.send-money.base-url:https://smp.hubtel.com/api/merchants}")
    private String sendMoneyBaseUrl;

    @Value("${hubtel.prepaid-deposit-id:}")
    private String prepaidDepositId;

    @Value("${hubtel.auth-token:}")
    private String authToken;

    public SendMoneyService(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    public SendMoneyResponse sendMoney(SendMoneyRequest request) {
        String url = sendMoneyBaseUrl + "/" + prepaidDepositId + "/send/mobilemoney";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.AUTHORIZATION, "Basic " + authToken);

        logger.info("Sending GHS {} to {} on {} - Reference: {}", request.getAmount(), request.getRecipientMsisdn(),
                request.getChannel(), request.getClientReference());
        try {
            ResponseEntity<SendMoneyResponse> response = restTemplate.exchange(
                    url, HttpMethod.POST, new HttpEntity<>(request, headers), SendMoneyResponse.class);
            SendMoneyResponse body = response.getBody();
            if (body == null) {
                throw new HubtelApiException("Send money failed: empty response");
            }
            logger.info("Send money response for {}: {} {}", request.getClientReference(), body.getResponseCode(),
                    body.getMessage());
            return body;
        } catch (HttpStatusCodeException e) {
            logger.error("Send money HTTP error for {}: {} - {}", request.getClientReference(), e.getStatusCode(),
                    e.getResponseBodyAsString());
            throw new HubtelApiException("Send money failed: " + e.getStatusCode(), e);
        } catch (HubtelApiException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Error sending money for {}: ", request.getClientReference(), e);
            throw new HubtelApiException("Send money failed: " + e.getMessage(), e);
        }
    }
}
