package com.ewale.ewale.service.ussd;

import com.ewale.ewale.dto.ServiceQueryItem;
import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.entity.BuyerFlow;
import com.ewale.ewale.entity.UssdServiceType;
import com.ewale.ewale.entity.UtilityProvider;
import com.ewale.ewale.service.ussd.handler.AirtimeHandler;
import com.ewale.ewale.service.ussd.handler.BundleHandler;
import com.ewale.ewale.service.ussd.handler.EarningsHandler;
import com.ewale.ewale.service.ussd.handler.MainMenuHandler;
import com.ewale.ewale.service.ussd.handler.ResultCheckerHandler;
import com.ewale.ewale.service.ussd.handler.TvBillsHandler;
import com.ewale.ewale.service.ussd.handler.UtilityHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("UssdRoutingTable Unit Tests")
class UssdRoutingTableTest {

    @Mock
    private MainMenuHandler mainMenu;
    @Mock
    private AirtimeHandler airtime;
    @Mock
    private BundleHandler bundle;
    @Mock
    private TvBillsHandler tvBills;
    @Mock
    private UtilityHandler utility;
    @Mock
    private ResultCheckerHandler resultChecker;
    @Mock
    private EarningsHandler earnings;

    private UssdRoutingTable routingTable;
    private final UssdRequest request = new UssdRequest();

    @BeforeEach
    void setUp() {
        routingTable = new UssdRoutingTable(mainMenu, airtime, bundle, tvBills, utility, resultChecker, earnings);
    }

    private void dispatch(int sequence, SessionState state) {
        routingTable.resolve(sequence, state).orElseThrow().handle(request, state);
    }

    private static SessionState state(UssdServiceType serviceType) {
        SessionState state = new SessionState("S1");
        state.setServiceType(serviceType);
        return state;
    }

    @Test
    @DisplayName("Session without a service goes to the main menu at any sequence")
    void mainMenuWithoutService() {
        SessionState state = new SessionState("S1");

        dispatch(2, state);
        dispatch(5, state);

        verify(mainMenu, times(2)).selectService(request, state);
    }

    @Test
    @DisplayName("Airtime branches on buyer flow at sequences 5 and 6")
    void airtimeBranchesOnFlow() {
        // Given
        SessionState self = state(UssdServiceType.AIRTIME_TOPUP);
        self.setFlow(BuyerFlow.SELF);
        SessionState other = state(UssdServiceType.AIRTIME_TOPUP);
        other.setFlow(BuyerFlow.OTHER);

        // When
        dispatch(5, self);
        dispatch(6, self);
        dispatch(5, other);
        dispatch(6, other);
        dispatch(7, other);

        // Then
        verify(airtime).enterAmount(request, self);
        verify(airtime).confirm(request, self);
        verify(airtime).enterRecipientMobile(request, other);
        verify(airtime).enterAmount(request, other);
        verify(airtime).confirm(request, other);
    }

    @Test
    @DisplayName("Bundle paging stays on the bundle list until a bundle is chosen")
    void bundlePagingRoutes() {
        // Given
        SessionState state = state(UssdServiceType.DATA_BUNDLE);
        state.setFlow(BuyerFlow.SELF);
        state.setBundleGroups(new ArrayList<>(List.of(new BundleGroup("Data Bundles", new ArrayList<>()))));
        state.setCategorySelectionMode(true);

        // When
        dispatch(5, state);
        state.setCategorySelectionMode(false);
        dispatch(6, state);
        dispatch(9, state);
        state.setSelectedBundle(new ServiceQueryItem("1GB", "DATA1GB", null));
        dispatch(10, state);

        // Then
        verify(bundle).selectCategory(request, state);
        verify(bundle, times(2)).selectBundle(request, state);
        verify(bundle).confirm(request, state);
    }

    @Test
    @DisplayName("Bundle for another number asks for the recipient before loading bundles")
    void bundleOtherAsksRecipient() {
        SessionState state = state(UssdServiceType.DATA_BUNDLE);
        state.setFlow(BuyerFlow.OTHER);

        dispatch(5, state);

        verify(bundle).enterRecipientMobile(request, state);
    }

    @Test
    @DisplayName("TV renew confirms at 6, other amount asks for the amount first")
    void tvSubscriptionOptions() {
        // Given
        SessionState renew = state(UssdServiceType.PAY_BILLS);
        renew.setSubscriptionType(SessionState.SUBSCRIPTION_RENEW);
        SessionState change = state(UssdServiceType.PAY_BILLS);
        change.setSubscriptionType(SessionState.SUBSCRIPTION_CHANGE);

        // When
        dispatch(6, renew);
        dispatch(6, change);
        dispatch(7, change);

        // Then
        verify(tvBills).confirm(request, renew);
        verify(tvBills).enterAmount(request, change);
        verify(tvBills).confirm(request, change);
    }

    @Test
    @DisplayName("ECG top-up and Ghana Water take separate utility paths")
    void utilityProviders() {
        // Given
        SessionState ecg = state(UssdServiceType.UTILITY_SERVICE);
        ecg.setUtilityProvider(UtilityProvider.ECG);
        ecg.setUtilitySubOption(SessionState.OPTION_TOPUP);
        SessionState water = state(UssdServiceType.UTILITY_SERVICE);
        water.setUtilityProvider(UtilityProvider.GHANA_WATER);

        // When
        dispatch(7, ecg);
        dispatch(9, ecg);
        dispatch(5, water);
        dispatch(6, water);

        // Then
        verify(utility).selectMeter(request, ecg);
        verify(utility).confirm(request, ecg);
        verify(utility).enterGhanaWaterMeter(request, water);
        verify(utility).confirm(request, water);
    }

    @Test
    @DisplayName("ECG without the top-up option has no step after the option menu")
    void ecgAddMeterHasNoFurtherSteps() {
        SessionState state = state(UssdServiceType.UTILITY_SERVICE);
        state.setUtilityProvider(UtilityProvider.ECG);
        state.setUtilitySubOption(SessionState.OPTION_ADD_METER);

        assertThat(routingTable.resolve(6, state)).isEmpty();
    }

    @Test
    @DisplayName("Result checker for another person collects name and quantity")
    void resultCheckerOther() {
        // Given
        SessionState state = state(UssdServiceType.RESULT_CHECKER);
        state.setFlow(BuyerFlow.OTHER);

        // When
        dispatch(5, state);
        dispatch(6, state);
        dispatch(7, state);
        dispatch(8, state);

        // Then
        verify(resultChecker).enterRecipientMobile(request, state);
        verify(resultChecker).enterRecipientName(request, state);
        verify(resultChecker).enterQuantity(request, state);
        verify(resultChecker).confirm(request, state);
    }

    @Test
    @DisplayName("Earnings withdrawal confirmation only exists after the withdraw option")
    void earningsWithdrawal() {
        // Given
        SessionState state = state(UssdServiceType.EARNING);

        // When / Then
        assertThat(routingTable.resolve(4, state)).isEmpty();
        state.setEarningFlow(SessionState.EARNING_WITHDRAWAL);
        dispatch(4, state);
        verify(earnings).confirmWithdrawal(request, state);
    }

    @Test
    @DisplayName("Unknown sequence resolves to nothing")
    void unknownSequence() {
        assertThat(routingTable.resolve(12, state(UssdServiceType.AIRTIME_TOPUP))).isEmpty();
        assertThat(routingTable.getRoutes()).isNotEmpty();
    }
}
