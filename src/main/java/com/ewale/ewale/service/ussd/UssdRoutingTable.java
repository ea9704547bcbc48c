package com.ewale.ewale.service.ussd;

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
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Maps (sequence, service type, session flags) to the step that handles the turn.
 * Routes are checked in declaration order and the first match wins.
 */
@Component
public class UssdRoutingTable {

    private static final Predicate<SessionState> ALWAYS = state -> true;

    private final List<Route> routes = new ArrayList<>();

    public UssdRoutingTable(MainMenuHandler mainMenu,
                            AirtimeHandler airtime,
                            BundleHandler bundle,
                            TvBillsHandler tvBills,
                            UtilityHandler utility,
                            ResultCheckerHandler resultChecker,
                            EarningsHandler earnings) {
        // A bad main menu choice re-prompts, so the menu can be answered at any later sequence
        routeFrom(2, null, ALWAYS, mainMenu::selectService);

        // Airtime
        route(3, UssdServiceType.AIRTIME_TOPUP, ALWAYS, airtime::selectNetwork);
        route(4, UssdServiceType.AIRTIME_TOPUP, ALWAYS, airtime::selectBuyerFlow);
        route(5, UssdServiceType.AIRTIME_TOPUP, flow(BuyerFlow.SELF), airtime::enterAmount);
        route(5, UssdServiceType.AIRTIME_TOPUP, flow(BuyerFlow.OTHER), airtime::enterRecipientMobile);
        route(6, UssdServiceType.AIRTIME_TOPUP, flow(BuyerFlow.SELF), airtime::confirm);
        route(6, UssdServiceType.AIRTIME_TOPUP, flow(BuyerFlow.OTHER), airtime::enterAmount);
        route(7, UssdServiceType.AIRTIME_TOPUP, flow(BuyerFlow.OTHER), airtime::confirm);

        // Data bundles; paging keeps the session on the bundle menu for any number of turns
        route(3, UssdServiceType.DATA_BUNDLE, ALWAYS, bundle::selectNetwork);
        route(4, UssdServiceType.DATA_BUNDLE, ALWAYS, bundle::selectBuyerFlow);
        route(5, UssdServiceType.DATA_BUNDLE,
                flow(BuyerFlow.OTHER).and(state -> state.getBundleGroups() == null), bundle::enterRecipientMobile);
        routeFrom(5, UssdServiceType.DATA_BUNDLE,
                state -> state.getSelectedBundle() == null && state.isCategorySelectionMode(), bundle::selectCategory);
        routeFrom(5, UssdServiceType.DATA_BUNDLE,
                state -> state.getSelectedBundle() == null && state.getBundleGroups() != null, bundle::selectBundle);
        routeFrom(6, UssdServiceType.DATA_BUNDLE, state -> state.getSelectedBundle() != null, bundle::confirm);

        // TV bills
        route(3, UssdServiceType.PAY_BILLS, ALWAYS, tvBills::selectProvider);
        route(4, UssdServiceType.PAY_BILLS, ALWAYS, tvBills::enterAccountNumber);
        route(5, UssdServiceType.PAY_BILLS, ALWAYS, tvBills::selectSubscriptionOption);
        route(6, UssdServiceType.PAY_BILLS, subscription(SessionState.SUBSCRIPTION_RENEW), tvBills::confirm);
        route(6, UssdServiceType.PAY_BILLS, subscription(SessionState.SUBSCRIPTION_CHANGE), tvBills::enterAmount);
        route(7, UssdServiceType.PAY_BILLS, subscription(SessionState.SUBSCRIPTION_CHANGE), tvBills::confirm);

        // Utilities
        route(3, UssdServiceType.UTILITY_SERVICE, ALWAYS, utility::selectProvider);
        route(4, UssdServiceType.UTILITY_SERVICE, provider(UtilityProvider.ECG), utility::selectMeterType);
        route(5, UssdServiceType.UTILITY_SERVICE, provider(UtilityProvider.ECG), utility::selectEcgOption);
        route(6, UssdServiceType.UTILITY_SERVICE, ecgTopUp(), utility::enterEcgMobile);
        route(7, UssdServiceType.UTILITY_SERVICE, ecgTopUp(), utility::selectMeter);
        route(8, UssdServiceType.UTILITY_SERVICE, ecgTopUp(), utility::enterEcgAmount);
        route(9, UssdServiceType.UTILITY_SERVICE, ecgTopUp(), utility::confirm);
        route(4, UssdServiceType.UTILITY_SERVICE, provider(UtilityProvider.GHANA_WATER), utility::enterGhanaWaterMobile);
        route(5, UssdServiceType.UTILITY_SERVICE, provider(UtilityProvider.GHANA_WATER), utility::enterGhanaWaterMeter);
        route(6, UssdServiceType.UTILITY_SERVICE, provider(UtilityProvider.GHANA_WATER), utility::confirm);

        // Result checker vouchers
        route(3, UssdServiceType.RESULT_CHECKER, ALWAYS, resultChecker::selectVoucherType);
        route(4, UssdServiceType.RESULT_CHECKER, ALWAYS, resultChecker::selectBuyerFlow);
        route(5, UssdServiceType.RESULT_CHECKER, flow(BuyerFlow.SELF), resultChecker::enterQuantity);
        route(6, UssdServiceType.RESULT_CHECKER, flow(BuyerFlow.SELF), resultChecker::confirm);
        route(5, UssdServiceType.RESULT_CHECKER, flow(BuyerFlow.OTHER), resultChecker::enterRecipientMobile);
        route(6, UssdServiceType.RESULT_CHECKER, flow(BuyerFlow.OTHER), resultChecker::enterRecipientName);
        route(7, UssdServiceType.RESULT_CHECKER, flow(BuyerFlow.OTHER), resultChecker::enterQuantity);
        route(8, UssdServiceType.RESULT_CHECKER, flow(BuyerFlow.OTHER), resultChecker::confirm);

        // Earnings
        route(3, UssdServiceType.EARNING, ALWAYS, earnings::selectOption);
        // Invalid confirmation re-prompts
        routeFrom(4, UssdServiceType.EARNING,
                state -> SessionState.EARNING_WITHDRAWAL.equals(state.getEarningFlow()), earnings::confirmWithdrawal);
    }

    public Optional<UssdStepHandler> resolve(int sequence, SessionState state) {
        for (Route route : routes) {
            if (route.matches(sequence, state)) {
                return Optional.of(route.handler);
            }
        }
        return Optional.empty();
    }

    List<Route> getRoutes() {
        return Collections.unmodifiableList(routes);
    }

    private void route(int sequence, UssdServiceType serviceType, Predicate<SessionState> condition,
                       UssdStepHandler handler) {
        routes.add(new Route(sequence, sequence, serviceType, condition, handler));
    }

    private void routeFrom(int sequence, UssdServiceType serviceType, Predicate<SessionState> condition,
                           UssdStepHandler handler) {
        routes.add(new Route(sequence, Integer.MAX_VALUE, serviceType, condition, handler));
    }

    private static Predicate<SessionState> flow(BuyerFlow flow) {
        return state -> state.getFlow() == flow;
    }

    private static Predicate<SessionState> subscription(String subscriptionType) {
        return state -> subscriptionType.equals(state.getSubscriptionType());
    }

    private static Predicate<SessionState> provider(UtilityProvider provider) {
        return state -> state.getUtilityProvider() == provider;
    }

    private static Predicate<SessionState> ecgTopUp() {
        return provider(UtilityProvider.ECG).and(state -> SessionState.OPTION_TOPUP.equals(state.getUtilitySubOption()));
    }

    static final class Route {
        private final int fromSequence;
        private final int toSequence;
        private final UssdServiceType serviceType; // null matches a session with no service chosen yet
        private final Predicate<SessionState> condition;
        private final UssdStepHandler handler;

        Route(int fromSequence, int toSequence, UssdServiceType serviceType, Predicate<SessionState> condition,
              UssdStepHandler handler) {
            this.fromSequence = fromSequence;
            this.toSequence = toSequence;
            this.serviceType = serviceType;
            this.condition = condition;
            this.handler = handler;
        }

        boolean matches(int sequence, SessionState state) {
            return sequence >= fromSequence
                    && sequence <= toSequence
                    && serviceType == state.getServiceType()
                    && condition.test(state);
        }
    }
}
