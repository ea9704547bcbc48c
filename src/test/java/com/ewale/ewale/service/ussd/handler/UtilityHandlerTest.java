package com.ewale.ewale.service.ussd.handler;

import com.ewale.ewale.dto.ServiceQueryItem;
import com.ewale.ewale.dto.ServiceQueryResponse;
import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.dto.UssdResponse;
import com.ewale.ewale.entity.UssdServiceType;
import com.ewale.ewale.entity.UtilityProvider;
import com.ewale.ewale.service.HubtelCatalogService;
import com.ewale.ewale.service.PaymentRequestService;
import com.ewale.ewale.service.ussd.SessionState;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("UtilityHandler Unit Tests")
class UtilityHandlerTest {

    private static final String SESSION_ID = "S1";

    @Mock
    private HubtelCatalogService catalogService;

    @Mock
    private PaymentRequestService paymentRequestService;

    private UtilityHandler utilityHandler;
    private SessionState state;

    @BeforeEach
    void setUp() {
        utilityHandler = new UtilityHandler(new UssdResponseBuilder(), paymentRequestService, catalogService);
        ReflectionTestUtils.setField(utilityHandler, "ghanaWaterEmail", "billing@example.com");
        state = new SessionState(SESSION_ID);
        state.setServiceType(UssdServiceType.UTILITY_SERVICE);
    }

    private static UssdRequest input(String message) {
        UssdRequest request = new UssdRequest();
        request.setSessionId(SESSION_ID);
        request.setMobile("233550982043");
        request.setMessage(message);
        return request;
    }

    @Nested
    @DisplayName("ECG prepaid")
    class EcgPrepaid {

        @BeforeEach
        void ecg() {
            state.setUtilityProvider(UtilityProvider.ECG);
            state.setMeterType(SessionState.METER_PREPAID);
        }

        @Test
        @DisplayName("Meters linked to the number are listed")
        void listsMeters() {
            // Given
            when(catalogService.queryEcgMeters("233244000111")).thenReturn(new ServiceQueryResponse("0000", "Success",
                    "Meters", List.of(new ServiceQueryItem("Home - P1234", "P1234", null),
                            new ServiceQueryItem("Shop - P5678", "P5678", null))));

            // When
            UssdResponse response = utilityHandler.enterEcgMobile(input("0244000111"), state);

            // Then
            assertThat(response.getMessage()).isEqualTo("Select Meter:\n1. Home - P1234\n2. Shop - P5678\n");
            assertThat(state.getMobile()).isEqualTo("233244000111");
        }

        @Test
        @DisplayName("Failed meter lookup carries Hubtel's message")
        void noMeters() {
            when(catalogService.queryEcgMeters("233244000111"))
                    .thenReturn(new ServiceQueryResponse("2001", "Customer not registered", null, List.of()));

            UssdResponse response = utilityHandler.enterEcgMobile(input("0244000111"), state);

            assertThat(response.getMessage()).isEqualTo("No meters found: Customer not registered");
        }

        @Test
        @DisplayName("Selected meter and amount build the top-up summary")
        void topUpSummary() {
            // Given
            state.setMeterInfo(List.of(new ServiceQueryItem("Home - P1234", "P1234", null)));

            // When
            utilityHandler.selectMeter(input("1"), state);
            UssdResponse tooLow = utilityHandler.enterEcgAmount(input("0.99"), state);
            UssdResponse summary = utilityHandler.enterEcgAmount(input("25"), state);

            // Then
            assertThat(state.getMeterNumber()).isEqualTo("P1234");
            assertThat(tooLow.getMessage()).isEqualTo("Minimum top-up amount is GH₵1.00");
            assertThat(summary.getLabel()).isEqualTo("Utility Top-Up");
            assertThat(summary.getMessage()).startsWith("ECG Prepaid Top-up:").contains("Meter: Home - P1234");
        }

        @Test
        @DisplayName("Out of range meter choice is rejected")
        void invalidMeterChoice() {
            state.setMeterInfo(List.of(new ServiceQueryItem("Home - P1234", "P1234", null)));

            assertThat(utilityHandler.selectMeter(input("2"), state).getMessage())
                    .isEqualTo("Please select a valid meter option");
        }
    }

    @Nested
    @DisplayName("Ghana Water")
    class GhanaWater {

        @BeforeEach
        void ghanaWater() {
            state.setUtilityProvider(UtilityProvider.GHANA_WATER);
            state.setMobile("233244000111");
        }

        @Test
        @DisplayName("Bill amount is taken from the account query")
        void billSummary() {
            // Given
            when(catalogService.queryGhanaWaterAccount("012345678", "233244000111")).thenReturn(
                    new ServiceQueryResponse("0000", "Success", "Bill", List.of(
                            new ServiceQueryItem("name", "Ama Owusu", null),
                            new ServiceQueryItem("amountDue", "-42.50", null),
                            new ServiceQueryItem("sessionId", "GW-778", null))));

            // When
            UssdResponse response = utilityHandler.enterGhanaWaterMeter(input("012345678"), state);

            // Then
            assertThat(response.getLabel()).isEqualTo("Bill Summary");
            assertThat(response.getMessage()).contains("Amount Due: GHS42.50").endsWith("1. Pay Bill\n2. Cancel");
            assertThat(state.getTotalAmount()).isEqualByComparingTo("42.50");
            assertThat(state.getEmail()).isEqualTo("billing@example.com");
            assertThat(state.getMeterInfo()).hasSize(3);
        }

        @Test
        @DisplayName("Zero bill is refused")
        void zeroBill() {
            when(catalogService.queryGhanaWaterAccount("012345678", "233244000111")).thenReturn(
                    new ServiceQueryResponse("0000", "Success", "Bill",
                            List.of(new ServiceQueryItem("amountDue", "0", null))));

            assertThat(utilityHandler.enterGhanaWaterMeter(input("012345678"), state).getMessage())
                    .isEqualTo("Invalid bill amount. Please try again.");
        }

        @Test
        @DisplayName("Unknown account is refused")
        void accountNotFound() {
            when(catalogService.queryGhanaWaterAccount("012345678", "233244000111"))
                    .thenReturn(new ServiceQueryResponse("2001", "Not found", null, List.of()));

            assertThat(utilityHandler.enterGhanaWaterMeter(input("012345678"), state).getMessage())
                    .isEqualTo("Account not found");
        }
    }
}
