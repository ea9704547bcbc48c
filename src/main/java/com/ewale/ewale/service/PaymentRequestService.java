package com.ewale.ewale.service;

import com.ewale.ewale.dto.UssdResponse;
import com.ewale.ewale.entity.UssdServiceType;
import com.ewale.ewale.exception.UssdValidationException;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Turns a confirmed order into a Hubtel checkout (AddToCart) response.
 */
@Service
public class PaymentRequestService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentRequestService.class);

    private final TransactionLedgerService ledgerService;
    private final UssdResponseBuilder responseBuilder;

    public PaymentRequestService(TransactionLedgerService ledgerService, UssdResponseBuilder responseBuilder) {
        this.ledgerService = ledgerService;
        this.responseBuilder = responseBuilder;
    }

    public UssdResponse requestPayment(String sessionId, String mobile, UssdServiceType serviceType,
                                       BigDecimal amount, String productName) {
        try {
            validateAmount(amount);
        } catch (UssdValidationException e) {
            logger.warn("Rejected payment request for session {}: {}", sessionId, e.getMessage());
            return responseBuilder.error(sessionId, e.getMessage());
        }

        ledgerService.recordPending(sessionId, mobile, serviceType, productName, amount);
        logger.info("Issuing checkout for session {} - {} GHS {}", sessionId, productName, amount);
        return responseBuilder.addToCart(sessionId, productName, amount);
    }

    static void validateAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new UssdValidationException("Amount must be greater than zero");
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            throw new UssdValidationException("Amount cannot have more than two decimal places");
        }
    }
}
