package com.ewale.ewale.service.ussd.handler;

import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.dto.UssdResponse;
import com.ewale.ewale.entity.BuyerFlow;
import com.ewale.ewale.entity.VoucherType;
import com.ewale.ewale.service.PaymentRequestService;
import com.ewale.ewale.service.ussd.SessionState;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import com.ewale.ewale.util.MobileNumberUtil;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Exam result checker vouchers. Serials are delivered by SMS once payment succeeds.
 */
@Component
public class ResultCheckerHandler extends ProductHandlerSupport {

    static final int MAX_QUANTITY = 80;

    @Value("${ussd.voucher.price.bece:20}")
    private BigDecimal becePrice = BigDecimal.valueOf(20);

    // WASSCE and school placement
    @Value("${ussd.voucher.price.default:21}")
    private BigDecimal otherVoucherPrice = BigDecimal.valueOf(21);

    public ResultCheckerHandler(UssdResponseBuilder responses, PaymentRequestService paymentRequestService) {
        super(responses, paymentRequestService);
    }

    public UssdResponse selectVoucherType(UssdRequest request, SessionState state) {
        VoucherType type;
        switch (request.getMessageOrEmpty()) {
            case "1":
                type = VoucherType.BECE;
                break;
            case "2":
                type = VoucherType.WASSCE;
                break;
            case "3":
                type = VoucherType.PLACEMENT;
                break;
            default:
                return responses.error(request.getSessionId(), "Please select 1, 2, or 3");
        }
        state.setVoucherType(type);
        state.setService(type.getDisplayName());
        return responses.numberInput(request.getSessionId(), "Buy For", "Buy for:\n1. Buy for me\n2. For other");
    }

    public UssdResponse selectBuyerFlow(UssdRequest request, SessionState state) {
        switch (request.getMessageOrEmpty()) {
            case "1":
                state.setFlow(BuyerFlow.SELF);
                state.setMobile(request.getMobile());
                return quantityPrompt(request.getSessionId());
            case "2":
                state.setFlow(BuyerFlow.OTHER);
                return responses.phoneInput(request.getSessionId(), "Enter Mobile Number",
                        "Enter other mobile number (e.g., 0550982043):");
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
        return responses.textInput(request.getSessionId(), "Enter Name", "Enter recipient's name:");
    }

    public UssdResponse enterRecipientName(UssdRequest request, SessionState state) {
        String name = request.getMessageOrEmpty();
        if (name.length() < 2) {
            return responses.error(request.getSessionId(), "Please enter a valid name (minimum 2 characters)");
        }
        state.setName(name);
        return quantityPrompt(request.getSessionId());
    }

    public UssdResponse enterQuantity(UssdRequest request, SessionState state) {
        Integer quantity = parseChoice(request.getMessageOrEmpty());
        if (quantity == null || quantity < 1 || quantity > MAX_QUANTITY) {
            return responses.error(request.getSessionId(), "Please enter a valid quantity (1-" + MAX_QUANTITY + "):");
        }
        BigDecimal total = unitPrice(state.getVoucherType()).multiply(BigDecimal.valueOf(quantity));
        state.setQuantity(quantity);
        state.setAmount(unitPrice(state.getVoucherType()));
        state.setTotalAmount(total);

        String boughtFor = state.getFlow() == BuyerFlow.OTHER
                ? MobileNumberUtil.toLocal(state.getMobile())
                : "Self";
        return responses.display(request.getSessionId(), "Order Details",
                "Service: " + state.getService() + "\n"
                        + "Bought For: " + boughtFor + "\n"
                        + "Quantity: " + quantity + "\n"
                        + "Amount: GHS " + UssdResponseBuilder.formatAmount(total) + "\n\n"
                        + CONFIRM_OPTIONS);
    }

    BigDecimal unitPrice(VoucherType type) {
        return type == VoucherType.BECE ? becePrice : otherVoucherPrice;
    }

    private UssdResponse quantityPrompt(String sessionId) {
        return responses.numberInput(sessionId, "Enter Quantity", "How many vouchers do you want to buy?");
    }
}
