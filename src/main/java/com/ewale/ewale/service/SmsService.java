package com.ewale.ewale.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

@Service
public class SmsService {

    private static final Logger logger = LoggerFactory.getLogger(SmsService.class);

    @Value("${sms.api.url:https://smsc.hubtel.com/v1/messages/send}")
    private String smsApiUrl;

    @Value("${sms.client-id:}")
    private String clientId;

    @Value("${sms.client-secret:}")
    private String clientSecret;

    @Value("${sms.sender:E-Wale}")
    private String sender;

    private final RestTemplate restTemplate;

    public SmsService(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * Sends one SMS. Failures are logged and reported through the return value, never thrown.
     */
    public boolean sendSms(String phoneNumber, String message) {
        if (phoneNumber == null || phoneNumber.isBlank()) {
            logger.warn("No phone number provided for SMS");
            return false;
        }

        try {
            URI uri = UriComponentsBuilder.fromHttpUrl(smsApiUrl)
                    .queryParam("clientsecret", clientSecret)
                    .queryParam("clientid", clientId)
                    .queryParam("from", sender)
                    .queryParam("to", phoneNumber)
                    .queryParam("content", message)
                    .encode()
                    .build()
                    .toUri();

            logger.info("Sending SMS to {}", phoneNumber);
            ResponseEntity<String> response = restTemplate.getForEntity(uri, String.class);
            logger.info("SMS sent. Response status: {}", response.getStatusCode());
            logger.debug("SMS response body: {}", response.getBody());
            return response.getStatusCode().is2xxSuccessful();
        } catch (Exception e) {
            logger.error("Error sending SMS to {}: ", phoneNumber, e);
            return false;
        }
    }
}
