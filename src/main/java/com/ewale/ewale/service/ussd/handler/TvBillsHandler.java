package com.ewale.ewale.service.ussd.handler;

import com.ewale.ewale.dto.ServiceQueryItem;
import com.ewale.ewale.dto.ServiceQueryResponse;
import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.dto.UssdResponse;
import com.ewale.ewale.entity.TvProvider;
import com.ewale.ewale.service.HubtelCatalogService;
import com.ewale.ewale.service.PaymentRequestService;
import com.ewale.ewale.service.ussd.SessionState;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * TV subscription payment (DSTV, GoTV, StarTimes).
 */
@Component
public class TvBillsHandler extends ProductHandlerSupport {

    private static final Logger logger = LoggerFactory.getLogger(TvBillsHandler.class);

    private static final BigDecimal MINIMUM_PAYMENT = BigDecimal.ONE;

    private final HubtelCatalogService catalogService;

    public TvBillsHandler(UssdResponseBuilder responses, PaymentRequestService paymentRequestService,
                          HubtelCatalogService catalogService) {
        super(responses, paymentRequestService);
        this.catalogService = catalogService;
    }

    public UssdResponse selectProvider(UssdRequest request, SessionState state) {
        TvProvider provider;
        switch (request.getMessageOrEmpty()) {
            case "1":
                provider = TvProvider.DSTV;
                break;
            case "2":
                provider = TvProvider.GOTV;
                break;
            case "3":
                provider = TvProvider.STARTIMES;
                break;
            default:
                return responses.error(request.getSessionId(), "Please select 1, 2, or 3");
        }
        state.setTvProvider(provider);
        return responses.numberInput(request.getSessionId(), "Enter Account Number", "Enter TV account number:");
    }

    public UssdResponse enterAccountNumber(UssdRequest request, SessionState state) {
        String accountNumber = request.getMessageOrEmpty().replaceAll("\\s", "");
        if (!accountNumber.matches("\\d{10,12}")) {
            return responses.error(request.getSessionId(), "Please enter a valid account number");
        }
        try {
            ServiceQueryResponse account = catalogService.queryTvAccount(state.getTvProvider(), accountNumber);
            state.setAccountNumber(accountNumber);
            state.setAccountInfo(account.getData());
            return responses.numberInput(request.getSessionId(), "Account Found",
                    accountDetails(account.getData()) + "\n1. Renew\n2. Other amount");
        } catch (RuntimeException e) {
            logger.error("Error querying TV account {}: {}", accountNumber, e.getMessage());
            return responses.error(request.getSessionId(), "Unable to verify account. Please try again.");
        }
    }

    public UssdResponse selectSubscriptionOption(UssdRequest request, SessionState state) {
        switch (request.getMessageOrEmpty()) {
            case "1":
                BigDecimal due = amountDue(state.getAccountInfo());
                if (due == null || due.signum() <= 0) {
                    return responses.error(request.getSessionId(), "No amount due on this account. Choose Other amount.");
                }
                state.setSubscriptionType(SessionState.SUBSCRIPTION_RENEW);
                state.setAmount(due);
                state.setTotalAmount(due);
                return responses.display(request.getSessionId(), "Order Summary", summary(state));
            case "2":
                state.setSubscriptionType(SessionState.SUBSCRIPTION_CHANGE);
                return responses.decimalInput(request.getSessionId(), "Enter Amount", "Enter subscription amount:");
            default:
                return responses.error(request.getSessionId(), "Please select 1 or 2");
        }
    }

    public UssdResponse enterAmount(UssdRequest request, SessionState state) {
        BigDecimal amount = parseAmount(request.getMessageOrEmpty());
        if (amount == null) {
            return responses.error(request.getSessionId(), "Please enter a valid amount greater than 0");
        }
        if (amount.compareTo(MINIMUM_PAYMENT) < 0) {
            return responses.error(request.getSessionId(), "Minimum payment amount is GH₵1.00");
        }
        state.setAmount(amount);
        state.setTotalAmount(amount);
        return responses.display(request.getSessionId(), "Order Summary", summary(state));
    }

    static String accountDetails(List<ServiceQueryItem> data) {
        StringBuilder info = new StringBuilder("Account Details:\n");
        info.append("Customer: ").append(catalogValue(data, "name", "N/A")).append("\n");
        info.append("Account: ").append(catalogValue(data, "account", "N/A")).append("\n");
        BigDecimal due = amountDue(data);
        if (due != null) {
            if (due.signum() > 0) {
                info.append("Amount Due: GHS").append(UssdResponseBuilder.formatAmount(due)).append("\n");
            } else if (due.signum() < 0) {
                info.append("Credit Balance: GHS").append(UssdResponseBuilder.formatAmount(due.abs())).append("\n");
            } else {
                info.append("Balance: GHS0.00\n");
            }
        }
        return info.toString();
    }

    static BigDecimal amountDue(List<ServiceQueryItem> data) {
        String value = catalogValue(data, "amountDue", null);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Unparseable amountDue '{}'", value);
            return null;
        }
    }

    static String summary(SessionState state) {
        return "Bill Payment Summary:\n\n"
                + "Provider: " + state.getTvProvider().getDisplayName() + "\n"
                + "Account: " + state.getAccountNumber() + "\n"
                + "Customer: " + catalogValue(state.getAccountInfo(), "name", "N/A") + "\n"
                + amountLine(state.getTotalAmount()) + "\n\n"
                + CONFIRM_OPTIONS;
    }
}
