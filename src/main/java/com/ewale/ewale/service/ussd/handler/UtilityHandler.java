package com.ewale.ewale.service.ussd.handler;

import com.ewale.ewale.dto.ServiceQueryItem;
import com.ewale.ewale.dto.ServiceQueryResponse;
import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.dto.UssdResponse;
import com.ewale.ewale.entity.UtilityProvider;
import com.ewale.ewale.service.HubtelCatalogService;
import com.ewale.ewale.service.PaymentRequestService;
import com.ewale.ewale.service.ussd.SessionState;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * ECG prepaid top-up and Ghana Water bill payment. Postpaid ECG and meter registration
 * are announced as coming soon.
 */
@Component
public class UtilityHandler extends ProductHandlerSupport {

    private static final Logger logger = LoggerFactory.getLogger(UtilityHandler.class);

    private static final BigDecimal MINIMUM_TOPUP = BigDecimal.ONE;

    private final HubtelCatalogService catalogService;

    @Value("${ussd.ghana-water.email:guglextechnologies@gmail.com}")
    private String ghanaWaterEmail = "guglextechnologies@gmail.com";

    public UtilityHandler(UssdResponseBuilder responses, PaymentRequestService paymentRequestService,
                          HubtelCatalogService catalogService) {
        super(responses, paymentRequestService);
        this.catalogService = catalogService;
    }

    public UssdResponse selectProvider(UssdRequest request, SessionState state) {
        switch (request.getMessageOrEmpty()) {
            case "1":
                state.setUtilityProvider(UtilityProvider.ECG);
                return responses.numberInput(request.getSessionId(), "Select Meter Type",
                        "Select Meter Type:\n1. Prepaid\n2. Postpaid");
            case "2":
                state.setUtilityProvider(UtilityProvider.GHANA_WATER);
                return responses.phoneInput(request.getSessionId(), "Enter Mobile Number",
                        "Enter mobile number linked to Ghana Water meter:");
            default:
                return responses.error(request.getSessionId(), "Please select 1 or 2");
        }
    }

    // ECG

    public UssdResponse selectMeterType(UssdRequest request, SessionState state) {
        switch (request.getMessageOrEmpty()) {
            case "1":
                state.setMeterType(SessionState.METER_PREPAID);
                return responses.numberInput(request.getSessionId(), "Prepaid Options",
                        "Select Prepaid Option:\n1. Top-up prepaid\n2. Add Prepaid meter");
            case "2":
                state.setMeterType(SessionState.METER_POSTPAID);
                return responses.numberInput(request.getSessionId(), "Postpaid Options",
                        "Select Postpaid Option:\n1. Pay Bill\n2. Add postpaid meter");
            default:
                return responses.error(request.getSessionId(), "Please select 1 or 2");
        }
    }

    public UssdResponse selectEcgOption(UssdRequest request, SessionState state) {
        String choice = request.getMessageOrEmpty();
        if (!"1".equals(choice) && !"2".equals(choice)) {
            return responses.error(request.getSessionId(), "Please select 1 or 2");
        }
        boolean prepaid = SessionState.METER_PREPAID.equals(state.getMeterType());
        if ("1".equals(choice)) {
            state.setUtilitySubOption(prepaid ? SessionState.OPTION_TOPUP : SessionState.OPTION_PAY_BILL);
        } else {
            state.setUtilitySubOption(SessionState.OPTION_ADD_METER);
        }
        if (!SessionState.OPTION_TOPUP.equals(state.getUtilitySubOption())) {
            return responses.comingSoon(request.getSessionId());
        }
        return responses.phoneInput(request.getSessionId(), "Enter Mobile Number",
                "Enter mobile number linked to ECG meter:");
    }

    public UssdResponse enterEcgMobile(UssdRequest request, SessionState state) {
        String mobile = parseMobile(request.getMessageOrEmpty());
        if (mobile == null) {
            return responses.error(request.getSessionId(), INVALID_MOBILE);
        }
        ServiceQueryResponse meters;
        try {
            meters = catalogService.queryEcgMeters(mobile);
        } catch (RuntimeException e) {
            logger.error("ECG meter query failed for {}: {}", mobile, e.getMessage());
            return responses.error(request.getSessionId(), "Unable to verify account. Please try again.");
        }
        if (!meters.isSuccess()) {
            return responses.error(request.getSessionId(), "No meters found: " + meters.getMessage());
        }
        if (meters.getData() == null || meters.getData().isEmpty()) {
            return responses.error(request.getSessionId(), "No meters found for this mobile number");
        }
        state.setMobile(mobile);
        state.setMeterInfo(meters.getData());

        StringBuilder menu = new StringBuilder("Select Meter:\n");
        List<ServiceQueryItem> data = meters.getData();
        for (int i = 0; i < data.size(); i++) {
            menu.append(i + 1).append(". ").append(data.get(i).getDisplay()).append("\n");
        }
        return responses.numberInput(request.getSessionId(), "Select Meter", menu.toString());
    }

    public UssdResponse selectMeter(UssdRequest request, SessionState state) {
        List<ServiceQueryItem> meters = state.getMeterInfo();
        Integer choice = parseChoice(request.getMessageOrEmpty());
        if (choice == null || choice < 1 || choice > meters.size()) {
            return responses.error(request.getSessionId(), "Please select a valid meter option");
        }
        ServiceQueryItem meter = meters.get(choice - 1);
        state.setSelectedMeter(meter);
        state.setMeterNumber(meter.getValue());
        return responses.decimalInput(request.getSessionId(), "Enter Amount", "Enter top-up amount:");
    }

    public UssdResponse enterEcgAmount(UssdRequest request, SessionState state) {
        BigDecimal amount = parseAmount(request.getMessageOrEmpty());
        if (amount == null) {
            return responses.error(request.getSessionId(), "Please enter a valid amount greater than 0");
        }
        if (amount.compareTo(MINIMUM_TOPUP) < 0) {
            return responses.error(request.getSessionId(), "Minimum top-up amount is GH₵1.00");
        }
        state.setAmount(amount);
        state.setTotalAmount(amount);
        return responses.display(request.getSessionId(), "Utility Top-Up", ecgSummary(state));
    }

    // Ghana Water

    public UssdResponse enterGhanaWaterMobile(UssdRequest request, SessionState state) {
        String mobile = parseMobile(request.getMessageOrEmpty());
        if (mobile == null) {
            return responses.error(request.getSessionId(), INVALID_MOBILE);
        }
        state.setMobile(mobile);
        return responses.numberInput(request.getSessionId(), "Enter Meter Number", "Enter meter number:");
    }

    public UssdResponse enterGhanaWaterMeter(UssdRequest request, SessionState state) {
        String meterNumber = request.getMessageOrEmpty().replaceAll("\\s", "");
        if (!meterNumber.matches("\\d{8,15}")) {
            return responses.error(request.getSessionId(), "Please enter a valid meter number");
        }
        ServiceQueryResponse account;
        try {
            account = catalogService.queryGhanaWaterAccount(meterNumber, state.getMobile());
        } catch (RuntimeException e) {
            logger.error("Ghana Water query failed for meter {}: {}", meterNumber, e.getMessage());
            return responses.error(request.getSessionId(), "Unable to verify account. Please try again.");
        }
        if (!account.isSuccess()) {
            return responses.error(request.getSessionId(), "Account not found");
        }

        BigDecimal due = TvBillsHandler.amountDue(account.getData());
        if (due == null) {
            return responses.error(request.getSessionId(), "Unable to retrieve bill amount. Please try again.");
        }
        if (due.signum() == 0) {
            return responses.error(request.getSessionId(), "Invalid bill amount. Please try again.");
        }
        BigDecimal amount = due.abs();
        state.setMeterNumber(meterNumber);
        state.setMeterInfo(account.getData());
        state.setAmount(amount);
        state.setTotalAmount(amount);
        state.setEmail(ghanaWaterEmail);

        String details = "Bill Details:\n"
                + "Customer: " + catalogValue(account.getData(), "name", "N/A") + "\n"
                + "Amount Due: GHS" + UssdResponseBuilder.formatAmount(amount) + "\n";
        return responses.textInput(request.getSessionId(), "Bill Summary", details + "\n\n1. Pay Bill\n2. Cancel");
    }

    static String ecgSummary(SessionState state) {
        String meterType = SessionState.METER_PREPAID.equals(state.getMeterType()) ? "Prepaid" : "Postpaid";
        return "ECG " + meterType + " Top-up:\n\n"
                + "Provider: " + state.getUtilityProvider().getDisplayName() + "\n"
                + "Meter Type: " + meterType + "\n"
                + "Meter: " + (state.getSelectedMeter() != null ? state.getSelectedMeter().getDisplay() : "N/A") + "\n"
                + "Amount: GHS" + UssdResponseBuilder.formatAmount(state.getTotalAmount()) + "\n\n"
                + CONFIRM_OPTIONS;
    }
}
