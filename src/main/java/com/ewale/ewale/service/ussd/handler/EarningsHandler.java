package com.ewale.ewale.service.ussd.handler;

import com.ewale.ewale.dto.UserEarningsResponse;
import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.dto.UssdResponse;
import com.ewale.ewale.dto.WithdrawalResult;
import com.ewale.ewale.service.EarningsService;
import com.ewale.ewale.service.WithdrawalService;
import com.ewale.ewale.service.ussd.SessionState;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

import static com.ewale.ewale.service.ussd.UssdResponseBuilder.formatAmount;

/**
 * Earnings menu: balance, withdrawal of the whole available balance, terms.
 */
@Component
public class EarningsHandler {

    private static final Logger logger = LoggerFactory.getLogger(EarningsHandler.class);

    static final String TERMS = "Terms & Conditions applies to:\nData Bundle\nAirtime\nECG Prepaid\n"
            + "Utility payments\nCommission rates vary by service type.";

    private final UssdResponseBuilder responses;
    private final EarningsService earningsService;
    private final WithdrawalService withdrawalService;

    public EarningsHandler(UssdResponseBuilder responses, EarningsService earningsService,
                           WithdrawalService withdrawalService) {
        this.responses = responses;
        this.earningsService = earningsService;
        this.withdrawalService = withdrawalService;
    }

    public UssdResponse selectOption(UssdRequest request, SessionState state) {
        switch (request.getMessageOrEmpty()) {
            case "1":
                return myBalance(request);
            case "2":
                return withdrawMoney(request, state);
            case "3":
                return responses.release(request.getSessionId(), "Terms & Conditions", TERMS);
            default:
                return responses.error(request.getSessionId(), "Please select 1, 2, or 3");
        }
    }

    public UssdResponse confirmWithdrawal(UssdRequest request, SessionState state) {
        switch (request.getMessageOrEmpty()) {
            case "1":
                return submitWithdrawal(request, state);
            case "2":
                return responses.release(request.getSessionId(), "Cancelled", "Withdrawal request cancelled.");
            default:
                return responses.invalidSelection(request.getSessionId(), "Please select 1 to confirm or 2 to cancel");
        }
    }

    private UssdResponse myBalance(UssdRequest request) {
        try {
            UserEarningsResponse earnings = earningsService.getUserEarnings(request.getMobile());
            String message = "My Balance\n\n"
                    + "Total Earnings: GH " + formatAmount(earnings.getTotalEarnings()) + "\n"
                    + "Available Balance: GH " + formatAmount(earnings.getAvailableBalance()) + "\n"
                    + "Total Withdrawn: GH " + formatAmount(earnings.getTotalWithdrawn()) + "\n"
                    + "Pending Withdrawals: GH " + formatAmount(earnings.getPendingWithdrawals()) + "\n\n"
                    + "Minimum withdrawal: GH " + formatAmount(earningsService.getMinimumWithdrawal());
            return responses.release(request.getSessionId(), "My Balance", message);
        } catch (RuntimeException e) {
            logger.error("Unable to fetch earnings for {}: {}", request.getMobile(), e.getMessage());
            return responses.error(request.getSessionId(), "Unable to fetch earnings. Please try again.");
        }
    }

    private UssdResponse withdrawMoney(UssdRequest request, SessionState state) {
        UserEarningsResponse earnings = earningsService.getUserEarnings(request.getMobile());
        BigDecimal minimum = earningsService.getMinimumWithdrawal();
        BigDecimal available = earnings.getAvailableBalance();

        if (available.compareTo(minimum) < 0) {
            return responses.release(request.getSessionId(), "Withdrawal Failed",
                    "Insufficient balance. You need GH " + formatAmount(minimum) + " minimum to withdraw.\n"
                            + "Available Balance: GH " + formatAmount(available));
        }

        state.setEarningFlow(SessionState.EARNING_WITHDRAWAL);
        state.setWithdrawalAmount(available);
        return responses.numberInput(request.getSessionId(), "Withdrawal Request",
                "Withdraw Money\n\n"
                        + "Available Balance: GH " + formatAmount(available) + "\n"
                        + "Minimum Withdrawal: GH " + formatAmount(minimum) + "\n\n"
                        + "1. Confirm withdrawal\n2. Cancel");
    }

    private UssdResponse submitWithdrawal(UssdRequest request, SessionState state) {
        BigDecimal amount = state.getWithdrawalAmount();
        WithdrawalResult result = withdrawalService.processWithdrawalRequest(request.getMobile(), amount, null);
        if (!result.isSuccess()) {
            return responses.error(request.getSessionId(), result.getMessage());
        }
        BigDecimal newBalance = earningsService.getUserEarnings(request.getMobile()).getAvailableBalance();
        return responses.release(request.getSessionId(), "Withdrawal Confirmed",
                "Withdrawal request submitted successfully!\n"
                        + "Amount: GH " + formatAmount(amount) + "\n"
                        + "New Balance: GH " + formatAmount(newBalance) + "\n"
                        + "You will receive payment within 24 hours.");
    }
}
