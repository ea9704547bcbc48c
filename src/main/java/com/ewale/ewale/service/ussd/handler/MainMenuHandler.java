package com.ewale.ewale.service.ussd.handler;

import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.dto.UssdResponse;
import com.ewale.ewale.entity.UssdServiceType;
import com.ewale.ewale.service.ussd.SessionState;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import org.springframework.stereotype.Component;

/**
 * Main menu choice: picks the product line and shows its first prompt.
 */
@Component
public class MainMenuHandler {

    static final String NETWORK_MENU = "Select Network:\n1. MTN\n2. Telecel Ghana\n3. AT";
    static final String TV_PROVIDER_MENU = "Select TV Provider:\n1. DSTV\n2. GoTV\n3. StarTimes TV";
    static final String UTILITY_MENU = "Select Utility Service:\n1. ECG Prepaid\n2. Ghana Water";
    static final String VOUCHER_MENU = "Select Result Checker:\n1. BECE\n2. WASSCE/NovDec\n3. School Placement Checker";
    static final String EARNINGS_MENU = "Earnings:\n1. My Balance\n2. Withdraw Money\n3. Terms & Conditions";

    private final UssdResponseBuilder responses;

    public MainMenuHandler(UssdResponseBuilder responses) {
        this.responses = responses;
    }

    public UssdResponse selectService(UssdRequest request, SessionState state) {
        String sessionId = request.getSessionId();
        switch (request.getMessageOrEmpty()) {
            case "0":
                return responses.contactUs(sessionId);
            case "1":
                return select(state, UssdServiceType.AIRTIME_TOPUP, sessionId, "Select Network", NETWORK_MENU);
            case "2":
                return select(state, UssdServiceType.DATA_BUNDLE, sessionId, "Select Network", NETWORK_MENU);
            case "3":
                return select(state, UssdServiceType.PAY_BILLS, sessionId, "Select TV Provider", TV_PROVIDER_MENU);
            case "4":
                return select(state, UssdServiceType.UTILITY_SERVICE, sessionId, "Select Utility Service", UTILITY_MENU);
            case "5":
                return select(state, UssdServiceType.RESULT_CHECKER, sessionId, "Result E-Checkers", VOUCHER_MENU);
            case "6":
                return select(state, UssdServiceType.EARNING, sessionId, "Earnings", EARNINGS_MENU);
            default:
                return responses.invalidSelection(sessionId,
                        "Please select a valid option (1-6 or 0)\n\n" + UssdResponseBuilder.MAIN_MENU);
        }
    }

    private UssdResponse select(SessionState state, UssdServiceType serviceType, String sessionId,
                                String label, String menu) {
        state.setServiceType(serviceType);
        return responses.numberInput(sessionId, label, menu);
    }
}
