package com.ewale.ewale.service;

import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.dto.UssdResponse;
import com.ewale.ewale.entity.BuyerFlow;
import com.ewale.ewale.entity.NetworkProvider;
import com.ewale.ewale.entity.UssdLog;
import com.ewale.ewale.entity.UssdServiceType;
import com.ewale.ewale.service.ussd.InMemorySessionStore;
import com.ewale.ewale.service.ussd.SessionState;
import com.ewale.ewale.service.ussd.SessionStore;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import com.ewale.ewale.service.ussd.UssdRoutingTable;
import com.ewale.ewale.service.ussd.handler.AirtimeHandler;
import com.ewale.ewale.service.ussd.handler.BundleHandler;
import com.ewale.ewale.service.ussd.handler.EarningsHandler;
import com.ewale.ewale.service.ussd.handler.MainMenuHandler;
import com.ewale.ewale.service.ussd.handler.ResultCheckerHandler;
import com.ewale.ewale.service.ussd.handler.TvBillsHandler;
import com.ewale.ewale.service.ussd.handler.UtilityHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("UssdService Unit Tests")
class UssdServiceTest {

    private static final String SESSION_ID = "S1";
    private static final String MOBILE = "233550982043";

    @Mock
    private UssdLoggingService loggingService;

    @Mock
    private PaymentRequestService paymentRequestService;

    @Mock
    private HubtelCatalogService catalogService;

    @Mock
    private EarningsService earningsService;

    @Mock
    private WithdrawalService withdrawalService;

    private final UssdResponseBuilder responses = new UssdResponseBuilder();
    private SessionStore sessionStore;
    private UssdService ussdService;

    @BeforeEach
    void setUp() {
        sessionStore = new InMemorySessionStore();
        UssdRoutingTable routingTable = new UssdRoutingTable(
                new MainMenuHandler(responses),
                new AirtimeHandler(responses, paymentRequestService),
                new BundleHandler(responses, paymentRequestService, catalogService),
                new TvBillsHandler(responses, paymentRequestService, catalogService),
                new UtilityHandler(responses, paymentRequestService, catalogService),
                new ResultCheckerHandler(responses, paymentRequestService),
                new EarningsHandler(responses, earningsService, withdrawalService));
        ussdService = new UssdService(sessionStore, routingTable, responses, loggingService);
    }

    private static UssdRequest turn(int sequence, String message) {
        return new UssdRequest(UssdRequest.TYPE_RESPONSE, SESSION_ID, sequence, message, MOBILE,
                "*713*1#", "mtn", null, "USSD");
    }

    private static UssdRequest initiation() {
        return new UssdRequest(UssdRequest.TYPE_INITIATION, SESSION_ID, 1, "*713*1#", MOBILE,
                "*713*1#", "mtn", null, "USSD");
    }

    @Nested
    @DisplayName("Session lifecycle")
    class SessionLifecycle {

        @Test
        @DisplayName("Initiation creates the session and returns the main menu")
        void initiationReturnsMainMenu() {
            // When
            UssdResponse response = ussdService.handleUssdRequest(initiation());

            // Then
            assertThat(response.getType()).isEqualTo(UssdResponse.TYPE_RESPONSE);
            assertThat(response.getDataType()).isEqualTo(UssdResponse.DATA_TYPE_INPUT);
            assertThat(response.getFieldType()).isEqualTo(UssdResponse.FIELD_TYPE_NUMBER);
            assertThat(response.getMessage()).isEqualTo(UssdResponseBuilder.MAIN_MENU);
            assertThat(sessionStore.exists(SESSION_ID)).isTrue();
            verify(loggingService).logSessionState(eq(SESSION_ID), eq(MOBILE), eq(1), anyString(),
                    any(SessionState.class), eq(UssdLog.STATUS_INITIATED));
        }

        @Test
        @DisplayName("Response turn without a session releases with the expiry message")
        void missingSessionReleases() {
            // When
            UssdResponse response = ussdService.handleUssdRequest(turn(2, "1"));

            // Then
            assertThat(response.isRelease()).isTrue();
            assertThat(response.getMessage()).isEqualTo(UssdResponseBuilder.SESSION_EXPIRED);
        }

        @Test
        @DisplayName("Contact us releases and removes the session")
        void releaseRemovesSession() {
            // Given
            ussdService.handleUssdRequest(initiation());

            // When
            UssdResponse response = ussdService.handleUssdRequest(turn(2, "0"));

            // Then
            assertThat(response.isRelease()).isTrue();
            assertThat(response.getLabel()).isEqualTo("Contact Us");
            assertThat(sessionStore.exists(SESSION_ID)).isFalse();
        }

        @Test
        @DisplayName("Validation error releases, removes the session and marks the log failed")
        void errorReleaseMarksLogFailed() {
            // Given
            ussdService.handleUssdRequest(initiation());
            ussdService.handleUssdRequest(turn(2, "1"));

            // When
            UssdResponse response = ussdService.handleUssdRequest(turn(3, "7"));

            // Then
            assertThat(response.isRelease()).isTrue();
            assertThat(response.getLabel()).isEqualTo("Error");
            assertThat(sessionStore.exists(SESSION_ID)).isFalse();
            verify(loggingService).markFailed(SESSION_ID, "Please select 1, 2, or 3");
        }

        @Test
        @DisplayName("Turn with no matching step releases")
        void unmatchedSequenceReleases() {
            // Given
            ussdService.handleUssdRequest(initiation());
            ussdService.handleUssdRequest(turn(2, "6"));

            // When
            UssdResponse response = ussdService.handleUssdRequest(turn(9, "1"));

            // Then
            assertThat(response.isRelease()).isTrue();
            assertThat(sessionStore.exists(SESSION_ID)).isFalse();
        }

        @Test
        @DisplayName("Gateway timeout releases the session")
        void otherRequestTypeReleases() {
            // Given
            ussdService.handleUssdRequest(initiation());
            UssdRequest timeout = turn(3, "");
            timeout.setType("Timeout");

            // When
            UssdResponse response = ussdService.handleUssdRequest(timeout);

            // Then
            assertThat(response.isRelease()).isTrue();
            assertThat(sessionStore.exists(SESSION_ID)).isFalse();
        }

        @Test
        @DisplayName("Handler exception releases with the generic error and marks the log failed")
        void handlerExceptionIsContained() {
            // Given
            ussdService.handleUssdRequest(initiation());
            ussdService.handleUssdRequest(turn(2, "1"));
            ussdService.handleUssdRequest(turn(3, "1"));
            ussdService.handleUssdRequest(turn(4, "1"));
            ussdService.handleUssdRequest(turn(5, "10"));
            when(paymentRequestService.requestPayment(anyString(), anyString(), any(), any(), anyString()))
                    .thenThrow(new IllegalStateException("database down"));

            // When
            UssdResponse response = ussdService.handleUssdRequest(turn(6, "1"));

            // Then
            assertThat(response.isRelease()).isTrue();
            assertThat(response.getMessage()).isEqualTo(UssdResponseBuilder.GENERIC_ERROR);
            assertThat(sessionStore.exists(SESSION_ID)).isFalse();
            verify(loggingService).markFailed(SESSION_ID, "database down");
        }
    }

    @Nested
    @DisplayName("Routing")
    class Routing {

        @Test
        @DisplayName("Main menu option 3 selects pay bills and shows the TV providers")
        void payBillsShowsTvProviders() {
            // Given
            ussdService.handleUssdRequest(initiation());

            // When
            UssdResponse response = ussdService.handleUssdRequest(turn(2, "3"));

            // Then
            assertThat(sessionStore.get(SESSION_ID)).get()
                    .extracting(SessionState::getServiceType).isEqualTo(UssdServiceType.PAY_BILLS);
            assertThat(response.getMessage()).contains("DSTV", "GoTV", "StarTimes");
            assertThat(response.isRelease()).isFalse();
        }

        @Test
        @DisplayName("Invalid main menu choice re-prompts and keeps the session")
        void invalidMainMenuChoiceReprompts() {
            // Given
            ussdService.handleUssdRequest(initiation());

            // When
            UssdResponse first = ussdService.handleUssdRequest(turn(2, "9"));
            UssdResponse second = ussdService.handleUssdRequest(turn(3, "1"));

            // Then
            assertThat(first.isRelease()).isFalse();
            assertThat(first.getMessage()).contains(UssdResponseBuilder.MAIN_MENU);
            assertThat(second.getMessage()).contains("MTN");
            assertThat(sessionStore.get(SESSION_ID)).get()
                    .extracting(SessionState::getServiceType).isEqualTo(UssdServiceType.AIRTIME_TOPUP);
        }

        @Test
        @DisplayName("Airtime for self walks to checkout and keeps the session for the callback")
        void airtimeSelfFlowReachesCheckout() {
            // Given
            UssdResponse checkout = responses.addToCart(SESSION_ID, "Airtime Top-Up", new BigDecimal("10"));
            when(paymentRequestService.requestPayment(SESSION_ID, MOBILE, UssdServiceType.AIRTIME_TOPUP,
                    new BigDecimal("10"), "Airtime Top-Up")).thenReturn(checkout);

            // When
            ussdService.handleUssdRequest(initiation());
            ussdService.handleUssdRequest(turn(2, "1"));
            ussdService.handleUssdRequest(turn(3, "1"));
            ussdService.handleUssdRequest(turn(4, "1"));
            UssdResponse summary = ussdService.handleUssdRequest(turn(5, "10"));
            UssdResponse response = ussdService.handleUssdRequest(turn(6, "1"));

            // Then
            assertThat(summary.getMessage()).contains("Network: MTN", "Recipient: Self", "Amount: GH10.00");
            assertThat(response.isAddToCart()).isTrue();
            SessionState state = sessionStore.get(SESSION_ID).orElseThrow();
            assertThat(state.getNetwork()).isEqualTo(NetworkProvider.MTN);
            assertThat(state.getFlow()).isEqualTo(BuyerFlow.SELF);
            assertThat(state.getMobile()).isEqualTo(MOBILE);
            assertThat(state.getTotalAmount()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("Cancelling the order releases without requesting payment")
        void cancelConfirmationReleases() {
            // Given
            ussdService.handleUssdRequest(initiation());
            ussdService.handleUssdRequest(turn(2, "1"));
            ussdService.handleUssdRequest(turn(3, "2"));
            ussdService.handleUssdRequest(turn(4, "2"));
            ussdService.handleUssdRequest(turn(5, "0244123456"));
            ussdService.handleUssdRequest(turn(6, "5"));

            // When
            UssdResponse response = ussdService.handleUssdRequest(turn(7, "2"));

            // Then
            assertThat(response.isRelease()).isTrue();
            assertThat(sessionStore.exists(SESSION_ID)).isFalse();
            verify(paymentRequestService, never()).requestPayment(anyString(), anyString(), any(), any(), anyString());
        }
    }
}
