package com.ewale.ewale.service;

import com.ewale.ewale.dto.ServiceQueryResponse;
import com.ewale.ewale.entity.NetworkProvider;
import com.ewale.ewale.entity.TvProvider;
import com.ewale.ewale.entity.UtilityProvider;
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
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * Read-only Commission Services queries: data bundles, TV accounts, ECG meters and Ghana Water bills.
 */
@Service
public class HubtelCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(HubtelCatalogService.class);

    private final RestTemplate restTemplate;
    private final HubtelEndpoints endpoints;

    @Value("${hubtel.commission.base-url:https://cs.hubtel.com/commissionservices}")
    private String commissionBaseUrl;

    @Value("${hubtel.prepaid-deposit-id:}")
    private String prepaidDepositId;

    @Value("${hubtel.auth-token:}")
    private String authToken;

    public HubtelCatalogService(RestTemplate restTemplate, HubtelEndpoints endpoints) {
        this.restTemplate = restTemplate;
        this.endpoints = endpoints;
    }

    public ServiceQueryResponse queryBundles(NetworkProvider network, String destination) {
        return query(endpoints.bundle(network), destination, null);
    }

    public ServiceQueryResponse queryTvAccount(TvProvider provider, String accountNumber) {
        return query(endpoints.tv(provider), accountNumber, null);
    }

    public ServiceQueryResponse queryEcgMeters(String mobileNumber) {
        return query(endpoints.utility(UtilityProvider.ECG), mobileNumber, null);
    }

    public ServiceQueryResponse queryGhanaWaterAccount(String meterNumber, String mobileNumber) {
        return query(endpoints.utility(UtilityProvider.GHANA_WATER), meterNumber, mobileNumber);
    }

    private ServiceQueryResponse query(String endpoint, String destination, String mobile) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(commissionBaseUrl)
                .pathSegment(prepaidDepositId, endpoint)
                .queryParam("destination", destination);
        if (mobile != null) {
            builder.queryParam("mobile", mobile);
        }
        URI uri = builder.encode().build().toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.AUTHORIZATION, "Basic " + authToken);

        logger.info("Commission Services query: {}", uri);
        try {
            ResponseEntity<ServiceQueryResponse> response = restTemplate.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(headers), ServiceQueryResponse.class);
            ServiceQueryResponse body = response.getBody();
            if (body == null) {
                throw new HubtelApiException("Commission Services returned an empty response");
            }
            logger.debug("Commission Services query response: {}", body);
            return body;
        } catch (HubtelApiException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Commission Services query to {} failed: {}", endpoint, e.getMessage());
            throw new HubtelApiException("Commission Services query failed: " + e.getMessage(), e);
        }
    }
}
