package com.ewale.ewale.service.ussd;

import com.ewale.ewale.dto.CheckoutItem;
import com.ewale.ewale.dto.UssdResponse;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Stateless formatter for outbound USSD turns.
 */
@Component
public class UssdResponseBuilder {

    public static final String MAIN_MENU =
            "Welcome to E-Wale\n" +
            "1. Buy Airtime\n" +
            "2. Data Bundle\n" +
            "3. Pay Bills\n" +
            "4. Utilities\n" +
            "5. Results Vouchers\n" +
            "6. Earnings\n" +
            "0. Contact us";

    public static final String GENERIC_ERROR = "An error occurred. Please try again.";
    public static final String SESSION_EXPIRED = "Session expired or invalid. Please restart.";

    public UssdResponse response(String sessionId, String label, String message, String dataType,
                                 String fieldType, String type) {
        UssdResponse response = new UssdResponse();
        response.setSessionId(sessionId);
        response.setType(type);
        response.setLabel(label);
        response.setMessage(message);
        response.setDataType(dataType);
        response.setFieldType(fieldType);
        return response;
    }

    public UssdResponse mainMenu(String sessionId) {
        return numberInput(sessionId, "Main Menu", MAIN_MENU);
    }

    public UssdResponse display(String sessionId, String label, String message) {
        return response(sessionId, label, message, UssdResponse.DATA_TYPE_DISPLAY,
                UssdResponse.FIELD_TYPE_TEXT, UssdResponse.TYPE_RESPONSE);
    }

    public UssdResponse textInput(String sessionId, String label, String message) {
        return response(sessionId, label, message, UssdResponse.DATA_TYPE_INPUT,
                UssdResponse.FIELD_TYPE_TEXT, UssdResponse.TYPE_RESPONSE);
    }

    public UssdResponse numberInput(String sessionId, String label, String message) {
        return response(sessionId, label, message, UssdResponse.DATA_TYPE_INPUT,
                UssdResponse.FIELD_TYPE_NUMBER, UssdResponse.TYPE_RESPONSE);
    }

    public UssdResponse phoneInput(String sessionId, String label, String message) {
        return response(sessionId, label, message, UssdResponse.DATA_TYPE_INPUT,
                UssdResponse.FIELD_TYPE_PHONE, UssdResponse.TYPE_RESPONSE);
    }

    public UssdResponse decimalInput(String sessionId, String label, String message) {
        return response(sessionId, label, message, UssdResponse.DATA_TYPE_INPUT,
                UssdResponse.FIELD_TYPE_DECIMAL, UssdResponse.TYPE_RESPONSE);
    }

    /**
     * Re-prompt after a bad choice; the session stays open.
     */
    public UssdResponse invalidSelection(String sessionId, String message) {
        return numberInput(sessionId, "Invalid Selection", message);
    }

    public UssdResponse release(String sessionId, String label, String message) {
        return response(sessionId, label, message, UssdResponse.DATA_TYPE_DISPLAY,
                UssdResponse.FIELD_TYPE_TEXT, UssdResponse.TYPE_RELEASE);
    }

    public UssdResponse error(String sessionId, String message) {
        return release(sessionId, "Error", message);
    }

    public UssdResponse thankYou(String sessionId) {
        return release(sessionId, "Thank you", "Love from Guglex Technologies");
    }

    public UssdResponse contactUs(String sessionId) {
        return release(sessionId, "Contact Us", "Phone: +233262195121\nEmail: guglextechnologies@gmail.com");
    }

    public UssdResponse comingSoon(String sessionId) {
        return release(sessionId, "Coming Soon", "This service is coming soon. Thank you for your patience.");
    }

    public UssdResponse addToCart(String sessionId, String productName, BigDecimal amount) {
        UssdResponse response = response(sessionId, "Payment",
                "Kindly approve the Momo prompt for GHS " + formatAmount(amount)
                        + ". If no prompt, Dial *170# select 6) My Wallet 3) My Approvals. Instant delivery.",
                UssdResponse.DATA_TYPE_DISPLAY, UssdResponse.FIELD_TYPE_TEXT, UssdResponse.TYPE_ADD_TO_CART);
        response.setItem(new CheckoutItem(productName, 1, amount));
        return response;
    }

    public static String formatAmount(BigDecimal amount) {
        if (amount == null) {
            return "0.00";
        }
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
