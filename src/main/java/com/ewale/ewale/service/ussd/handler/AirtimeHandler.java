package com.ewale.ewale.service.ussd.handler;

import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.dto.UssdResponse;
import com.ewale.ewale.entity.BuyerFlow;
import com.ewale.ewale.entity.NetworkProvider;
import com.ewale.ewale.service.PaymentRequestService;
import com.ewale.ewale.service.ussd.SessionState;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
public class AirtimeHandler extends ProductHandlerSupport {

    @Value("${ussd.airtime.minimum-amount:0.50}")
    private BigDecimal minimumAmount = new BigDecimal("0.50");

    public AirtimeHandler(UssdResponseBuilder responses, PaymentRequestService paymentRequestService) {
        super(responses, paymentRequestService);
    }

    public UssdResponse selectNetwork(UssdRequest request, SessionState state) {
        NetworkProvider network = network(request.getMessageOrEmpty());
        if (network == null) {
            return responses.error(request.getSessionId(), "Please select 1, 2, or 3");
        }
        state.setNetwork(network);
        return responses.numberInput(request.getSessionId(), "Who are you buying for?", "Buy for:\n1. Self\n2. Other");
    }

    public UssdResponse selectBuyerFlow(UssdRequest request, SessionState state) {
        switch (request.getMessageOrEmpty()) {
            case "1":
                state.setFlow(BuyerFlow.SELF);
                state.setMobile(request.getMobile());
                return responses.decimalInput(request.getSessionId(), "Enter Amount", "Enter amount");
            case "2":
                state.setFlow(BuyerFlow.OTHER);
                return responses.phoneInput(request.getSessionId(), "Enter Mobile Number", "Enter recipient mobile number:");
            default:
                return responses.error(request.getSessionId(), "Please select 1 or 2");
        }
    }

    public UssdResponse enterRecipientMobile(UssdRequest request, SessionState state) {
        String mobile = parseMobile(request.getMessageOrEmpty());
        if (mobile == null) {
            return responses.error(request.getSessionId(), INVALID_MOBILE);
        }
        state.setMobile(mobile);
        return responses.decimalInput(request.getSessionId(), "Enter Amount", "Enter amount");
    }

    public UssdResponse enterAmount(UssdRequest request, SessionState state) {
        BigDecimal amount = parseAmount(request.getMessageOrEmpty());
        if (amount == null) {
            return responses.error(request.getSessionId(), "Please enter a valid amount greater than 0");
        }
        if (amount.compareTo(minimumAmount) < 0) {
            return responses.error(request.getSessionId(),
                    "Minimum airtime amount is " + UssdResponseBuilder.formatAmount(minimumAmount));
        }
        state.setAmount(amount);
        state.setTotalAmount(amount);
        return responses.numberInput(request.getSessionId(), "Airtime Top-Up", summary(state));
    }

    static String summary(SessionState state) {
        return "Airtime top-Up 100% bonus on exclusive networks:\n"
                + "Network: " + state.getNetwork().getDisplayName() + "\n"
                + "Recipient: " + (state.getFlow() == BuyerFlow.SELF ? "Self" : "Other") + "\n"
                + "Mobile: " + state.getMobile() + "\n"
                + amountLine(state.getAmount()) + "\n\n"
                + CONFIRM_OPTIONS;
    }

    static NetworkProvider network(String choice) {
        switch (choice) {
            case "1":
                return NetworkProvider.MTN;
            case "2":
                return NetworkProvider.TELECEL;
            case "3":
                return NetworkProvider.AT;
            default:
                return null;
        }
    }
}
