package com.ewale.ewale.service;

import com.ewale.ewale.dto.CommissionServiceRequest;
import com.ewale.ewale.dto.FulfillmentAcknowledgement;
import com.ewale.ewale.dto.PaymentCallbackRequest;
import com.ewale.ewale.dto.ServiceQueryItem;
import com.ewale.ewale.dto.TransactionStatusSummary;
import com.ewale.ewale.entity.CommissionServiceType;
import com.ewale.ewale.entity.UssdServiceType;
import com.ewale.ewale.entity.UtilityProvider;
import com.ewale.ewale.service.ussd.SessionState;
import com.ewale.ewale.service.ussd.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Handles the Hubtel checkout callback. Every step is guarded so that a failure in one does
 * not stop the others, and the gateway is always told the final status.
 */
@Service
public class PaymentCallbackService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentCallbackService.class);

    private final SessionStore sessionStore;
    private final TransactionLedgerService ledgerService;
    private final UssdLoggingService ussdLoggingService;
    private final CommissionTransactionLogService commissionLogService;
    private final CommissionService commissionService;
    private final VoucherService voucherService;
    private final WithdrawalService withdrawalService;
    private final HubtelGatewayClient gatewayClient;

    @Value("${hubtel.commission.callback-url:}")
    private String commissionCallbackUrl;

    public PaymentCallbackService(SessionStore sessionStore,
                                  TransactionLedgerService ledgerService,
                                  UssdLoggingService ussdLoggingService,
                                  CommissionTransactionLogService commissionLogService,
                                  CommissionService commissionService,
                                  VoucherService voucherService,
                                  WithdrawalService withdrawalService,
                                  HubtelGatewayClient gatewayClient) {
        this.sessionStore = sessionStore;
        this.ledgerService = ledgerService;
        this.ussdLoggingService = ussdLoggingService;
        this.commissionLogService = commissionLogService;
        this.commissionService = commissionService;
        this.voucherService = voucherService;
        this.withdrawalService = withdrawalService;
        this.gatewayClient = gatewayClient;
    }

    public void handlePaymentCallback(PaymentCallbackRequest callback) {
        String sessionId = callback.getSessionId();
        String orderId = callback.getOrderId();
        boolean successful = callback.isSuccessful();
        logger.info("Payment callback received - Session: {}, Order: {}, Successful: {}", sessionId, orderId, successful);

        Optional<SessionState> session = sessionStore.get(sessionId);

        try {
            try {
                ledgerService.upsertFromCallback(callback);
            } catch (Exception e) {
                logger.error("Failed to record transaction for order {}: ", orderId, e);
            }

            String paymentDescription = paymentDescription(callback);
            try {
                if (successful) {
                    ussdLoggingService.markCompleted(sessionId, callback);
                } else {
                    ussdLoggingService.markFailed(sessionId, callback, paymentDescription);
                }
            } catch (Exception e) {
                logger.error("Failed to update USSD log for session {}: ", sessionId, e);
            }

            try {
                TransactionStatusSummary classification = HubtelResponseCode.classify(
                        successful ? HubtelResponseCode.SUCCESS.getCode() : HubtelResponseCode.GENERAL_FAILURE.getCode(),
                        null, paymentDescription);
                commissionLogService.recordPayment(callback, session.orElse(null), classification);
            } catch (Exception e) {
                logger.error("Failed to record commission log for order {}: ", orderId, e);
            }

            if (successful) {
                try {
                    fulfil(callback, session);
                } catch (Exception e) {
                    logger.error("Fulfilment failed for order {}: ", orderId, e);
                }
            } else {
                try {
                    if (withdrawalService.refundIfWithdrawal(orderId)) {
                        logger.info("Refunded withdrawal linked to failed order {}", orderId);
                    }
                } catch (Exception e) {
                    logger.error("Failed to refund withdrawal for order {}: ", orderId, e);
                }
            }
        } finally {
            // Checkout sessions end with their payment callback.
            if (session.isPresent()) {
                sessionStore.delete(sessionId);
            }
            gatewayClient.sendFulfillmentAcknowledgement(new FulfillmentAcknowledgement(sessionId, orderId, null,
                    successful ? FulfillmentAcknowledgement.SERVICE_STATUS_SUCCESS
                            : FulfillmentAcknowledgement.SERVICE_STATUS_FAILED));
        }
    }

    private void fulfil(PaymentCallbackRequest callback, Optional<SessionState> session) {
        String orderId = callback.getOrderId();
        if (session.isEmpty()) {
            logger.warn("Session {} is gone, order {} was paid but cannot be fulfilled; needs reconciliation",
                    callback.getSessionId(), orderId);
            return;
        }
        if (!ledgerService.markFulfillmentTriggered(orderId)) {
            logger.info("Fulfilment already triggered or not recorded for order {}, skipping", orderId);
            return;
        }

        SessionState state = session.get();
        if (state.getServiceType() == UssdServiceType.RESULT_CHECKER) {
            voucherService.deliverVouchers(orderId, state, callback.getOrderInfo().getCustomerMobileNumber());
            return;
        }
        CommissionServiceRequest request = buildCommissionServiceRequest(state, orderId);
        if (request == null) {
            logger.warn("Nothing to fulfil for order {} with service type {}", orderId, state.getServiceType());
        } else {
            commissionService.processCommissionService(request);
        }
    }

    private static String paymentDescription(PaymentCallbackRequest callback) {
        if (callback.getOrderInfo() == null || callback.getOrderInfo().getPayment() == null) {
            return null;
        }
        return callback.getOrderInfo().getPayment().getPaymentDescription();
    }

    /**
     * @return the delivery order for the session's product line, or null when it has none
     */
    CommissionServiceRequest buildCommissionServiceRequest(SessionState state, String clientReference) {
        if (state.getServiceType() == null) {
            return null;
        }
        CommissionServiceRequest request = new CommissionServiceRequest();
        request.setClientReference(clientReference);
        request.setAmount(state.getTotalAmount() != null ? state.getTotalAmount() : state.getAmount());
        request.setCallbackUrl(commissionCallbackUrl);

        Map<String, Object> extraData = new HashMap<>();
        switch (state.getServiceType()) {
            case AIRTIME_TOPUP:
                request.setServiceType(CommissionServiceType.AIRTIME);
                request.setNetwork(state.getNetwork());
                request.setDestination(state.getMobile());
                break;
            case DATA_BUNDLE:
                request.setServiceType(CommissionServiceType.BUNDLE);
                request.setNetwork(state.getNetwork());
                request.setDestination(state.getMobile());
                extraData.put("bundleType", "data");
                extraData.put("bundleValue", state.getBundleValue());
                break;
            case PAY_BILLS:
                request.setServiceType(CommissionServiceType.TV_BILL);
                request.setTvProvider(state.getTvProvider());
                request.setDestination(state.getAccountNumber());
                extraData.put("accountNumber", state.getAccountNumber());
                break;
            case UTILITY_SERVICE:
                request.setServiceType(CommissionServiceType.UTILITY);
                request.setUtilityProvider(state.getUtilityProvider());
                if (state.getUtilityProvider() == UtilityProvider.ECG) {
                    request.setDestination(state.getMobile());
                    extraData.put("meterNumber", state.getSelectedMeter() != null
                            ? state.getSelectedMeter().getValue() : state.getMeterNumber());
                } else if (state.getUtilityProvider() == UtilityProvider.GHANA_WATER) {
                    request.setDestination(state.getMeterNumber());
                    extraData.put("meterNumber", state.getMeterNumber());
                    extraData.put("email", state.getEmail());
                    extraData.put("sessionId", queryValue(state.getMeterInfo(), "sessionId", state.getSessionId()));
                } else {
                    return null;
                }
                break;
            default:
                return null;
        }
        request.setExtraData(extraData);
        return request;
    }

    private static String queryValue(List<ServiceQueryItem> items, String display, String fallback) {
        if (items != null) {
            for (ServiceQueryItem item : items) {
                if (display.equalsIgnoreCase(item.getDisplay()) && item.getValue() != null) {
                    return item.getValue();
                }
            }
        }
        return fallback;
    }
}
