package com.ewale.ewale.service.ussd.handler;

import com.ewale.ewale.dto.ServiceQueryItem;
import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.dto.UssdResponse;
import com.ewale.ewale.service.PaymentRequestService;
import com.ewale.ewale.service.ussd.SessionState;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import com.ewale.ewale.util.MobileNumberUtil;

import java.math.BigDecimal;
import java.util.List;

/**
 * Shared plumbing for the product menus: input parsing and the final checkout confirmation.
 */
public abstract class ProductHandlerSupport {

    protected static final String CONFIRM_OPTIONS = "1. Confirm\n2. Cancel";
    protected static final String INVALID_MOBILE = "Must be a valid mobile number (e.g. 0550982043)";

    protected final UssdResponseBuilder responses;
    protected final PaymentRequestService paymentRequestService;

    protected ProductHandlerSupport(UssdResponseBuilder responses, PaymentRequestService paymentRequestService) {
        this.responses = responses;
        this.paymentRequestService = paymentRequestService;
    }

    /**
     * "1" turns the order into a checkout; anything else ends the session.
     */
    public UssdResponse confirm(UssdRequest request, SessionState state) {
        if (!"1".equals(request.getMessageOrEmpty())) {
            return responses.thankYou(request.getSessionId());
        }
        return paymentRequestService.requestPayment(request.getSessionId(), request.getMobile(),
                state.getServiceType(), state.getTotalAmount(), productName(state));
    }

    /**
     * Checkout item name: explicit service name, then bundle, then provider, then airtime.
     */
    public static String productName(SessionState state) {
        if (state.getService() != null) {
            return state.getService();
        }
        if (state.getSelectedBundle() != null && state.getSelectedBundle().getDisplay() != null) {
            return state.getSelectedBundle().getDisplay();
        }
        if (state.getTvProvider() != null) {
            return state.getTvProvider().getDisplayName();
        }
        if (state.getUtilityProvider() != null) {
            return state.getUtilityProvider().getDisplayName() + " Top-Up";
        }
        return "Airtime Top-Up";
    }

    /**
     * @return the amount, or null when the input is not a positive number with at most two decimals
     */
    protected static BigDecimal parseAmount(String input) {
        try {
            BigDecimal amount = new BigDecimal(input.trim());
            if (amount.signum() <= 0 || amount.stripTrailingZeros().scale() > 2) {
                return null;
            }
            return amount;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * @return the 233-prefixed number, or null when the input is not a Ghanaian mobile number
     */
    protected static String parseMobile(String input) {
        return MobileNumberUtil.normalize(input);
    }

    protected static Integer parseChoice(String input) {
        try {
            return Integer.valueOf(input.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Value of the catalogue entry whose Display is {@code key}.
     */
    protected static String catalogValue(List<ServiceQueryItem> data, String key, String fallback) {
        if (data == null) {
            return fallback;
        }
        for (ServiceQueryItem item : data) {
            if (key.equals(item.getDisplay()) && item.getValue() != null) {
                return item.getValue();
            }
        }
        return fallback;
    }

    protected static String amountLine(BigDecimal amount) {
        return "Amount: GH" + UssdResponseBuilder.formatAmount(amount);
    }
}
