package com.ewale.ewale.service;

import com.ewale.ewale.dto.CommissionServiceRequest;
import com.ewale.ewale.dto.CommissionServiceResponse;
import com.ewale.ewale.dto.HubtelTransactionData;
import com.ewale.ewale.entity.CommissionServiceStatus;
import com.ewale.ewale.entity.CommissionServiceType;
import com.ewale.ewale.entity.NetworkProvider;
import com.ewale.ewale.entity.UtilityProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CommissionService Unit Tests")
class CommissionServiceTest {

    @Mock
    private RestTemplate restTemplate;

    @Mock
    private CommissionTransactionLogService commissionLogService;

    private CommissionService commissionService;

    @BeforeEach
    void setUp() {
        commissionService = new CommissionService(restTemplate, new HubtelEndpoints(), commissionLogService);
        ReflectionTestUtils.setField(commissionService, "commissionBaseUrl", "https://cs.hubtel.com/commissionservices");
        ReflectionTestUtils.setField(commissionService, "prepaidDepositId", "2023456");
        ReflectionTestUtils.setField(commissionService, "authToken", "dGVzdDp0ZXN0");
        ReflectionTestUtils.setField(commissionService, "defaultCallbackUrl", "https://ewale.test/api/commission/callback");
    }

    private static CommissionServiceRequest airtime() {
        CommissionServiceRequest request = new CommissionServiceRequest();
        request.setClientReference("ORD-1");
        request.setServiceType(CommissionServiceType.AIRTIME);
        request.setNetwork(NetworkProvider.TELECEL);
        request.setDestination("233200000111");
        request.setAmount(new BigDecimal("5.00"));
        return request;
    }

    @Nested
    @DisplayName("Payload")
    class Payload {

        @Test
        @DisplayName("Airtime carries the network display name and the default callback")
        void airtimePayload() {
            Map<String, Object> payload = commissionService.buildPayload(airtime());

            assertThat(payload).containsEntry("Destination", "233200000111")
                    .containsEntry("ClientReference", "ORD-1")
                    .containsEntry("CallbackUrl", "https://ewale.test/api/commission/callback");
            assertThat(extraData(payload)).containsEntry("network", "Telecel Ghana");
        }

        @Test
        @DisplayName("Ghana Water carries meter, email and query session")
        void ghanaWaterPayload() {
            CommissionServiceRequest request = new CommissionServiceRequest();
            request.setServiceType(CommissionServiceType.UTILITY);
            request.setUtilityProvider(UtilityProvider.GHANA_WATER);
            Map<String, Object> extra = new HashMap<>();
            extra.put("meterNumber", "012345678");
            extra.put("email", "billing@example.com");
            extra.put("sessionId", "GW-778");
            request.setExtraData(extra);

            Map<String, Object> payload = commissionService.buildPayload(request);

            assertThat(extraData(payload))
                    .containsEntry("bundle", "012345678")
                    .containsEntry("Email", "billing@example.com")
                    .containsEntry("SessionId", "GW-778");
        }

        @Test
        @DisplayName("TV bills have no extra data")
        void tvPayload() {
            CommissionServiceRequest request = new CommissionServiceRequest();
            request.setServiceType(CommissionServiceType.TV_BILL);

            assertThat(commissionService.buildPayload(request)).doesNotContainKey("Extradata");
        }
    }

    @Nested
    @DisplayName("Delivery")
    class Delivery {

        @Test
        @DisplayName("0001 leaves the delivery pending until the callback")
        void acceptedIsPending() {
            // Given
            when(restTemplate.exchange(anyString(), eq(HttpMethod.POST), any(HttpEntity.class),
                    eq(CommissionServiceResponse.class)))
                    .thenReturn(ResponseEntity.ok(new CommissionServiceResponse("0001", "Accepted", null)));

            // When
            CommissionServiceResponse response = commissionService.processCommissionService(airtime());

            // Then
            assertThat(response.getResponseCode()).isEqualTo("0001");
            verify(restTemplate).exchange(eq("https://cs.hubtel.com/commissionservices/2023456/f4be83ad74c742e185224fdae1304800"),
                    eq(HttpMethod.POST), any(HttpEntity.class), eq(CommissionServiceResponse.class));
            verify(commissionLogService).updateServiceStatus("ORD-1", CommissionServiceStatus.PENDING, "Accepted", false, null);
        }

        @Test
        @DisplayName("Fulfilled 0000 is delivered")
        void delivered() {
            // Given
            HubtelTransactionData data = new HubtelTransactionData();
            data.setIsFulfilled(true);
            when(restTemplate.exchange(anyString(), eq(HttpMethod.POST), any(HttpEntity.class),
                    eq(CommissionServiceResponse.class)))
                    .thenReturn(ResponseEntity.ok(new CommissionServiceResponse("0000", "Success", data)));

            // When
            commissionService.processCommissionService(airtime());

            // Then
            verify(commissionLogService).updateServiceStatus("ORD-1", CommissionServiceStatus.DELIVERED, "Success", true, null);
        }

        @Test
        @DisplayName("Transport error marks the delivery failed")
        void transportError() {
            // Given
            when(restTemplate.exchange(anyString(), eq(HttpMethod.POST), any(HttpEntity.class),
                    eq(CommissionServiceResponse.class)))
                    .thenThrow(new ResourceAccessException("timeout"));

            // When
            CommissionServiceResponse response = commissionService.processCommissionService(airtime());

            // Then
            assertThat(response).isNull();
            verify(commissionLogService).updateServiceStatus("ORD-1", CommissionServiceStatus.FAILED,
                    "Commission service error", false, "timeout");
        }

        @Test
        @DisplayName("Missing provider fails without calling Hubtel")
        void missingProvider() {
            // Given
            CommissionServiceRequest request = airtime();
            request.setNetwork(null);

            // When
            CommissionServiceResponse response = commissionService.processCommissionService(request);

            // Then
            assertThat(response).isNull();
            verifyNoInteractions(restTemplate);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> extraData(Map<String, Object> payload) {
        return (Map<String, Object>) payload.get("Extradata");
    }
}
