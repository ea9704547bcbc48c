package com.ewale.ewale.controller;

import com.ewale.ewale.dto.ApiResponse;
import com.ewale.ewale.dto.PaymentCallbackRequest;
import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.dto.UssdResponse;
import com.ewale.ewale.service.PaymentCallbackService;
import com.ewale.ewale.service.UssdService;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ussd")
public class UssdController {

    private static final Logger logger = LoggerFactory.getLogger(UssdController.class);

    private final UssdService ussdService;
    private final PaymentCallbackService paymentCallbackService;
    private final UssdResponseBuilder responses;

    public UssdController(UssdService ussdService, PaymentCallbackService paymentCallbackService,
                          UssdResponseBuilder responses) {
        this.ussdService = ussdService;
        this.paymentCallbackService = paymentCallbackService;
        this.responses = responses;
    }

    /**
     * Hubtel programmable services turn. Always answered with a USSD payload, never an HTTP error.
     */
    @PostMapping
    public ResponseEntity<UssdResponse> handleUssd(@Valid @RequestBody UssdRequest request) {
        logger.info("USSD {} turn {} for session {}: '{}'", request.getType(), request.getSequence(),
                request.getSessionId(), request.getMessage());
        try {
            return ResponseEntity.ok(ussdService.handleUssdRequest(request));
        } catch (RuntimeException e) {
            logger.error("Unhandled error for USSD session {}", request.getSessionId(), e);
            return ResponseEntity.ok(responses.error(request.getSessionId(), UssdResponseBuilder.GENERIC_ERROR));
        }
    }

    /**
     * Hubtel checkout result for a session that ended in AddToCart.
     */
    @PostMapping("/callback")
    public ResponseEntity<ApiResponse<Void>> handlePaymentCallback(@Valid @RequestBody PaymentCallbackRequest callback) {
        try {
            logger.info("Received payment callback for session {} order {}", callback.getSessionId(),
                    callback.getOrderId());
            paymentCallbackService.handlePaymentCallback(callback);
            return ResponseEntity.ok(ApiResponse.success("Callback processed", null));
        } catch (RuntimeException e) {
            logger.error("Error processing payment callback for session {}: ", callback.getSessionId(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiResponse.error(e.getMessage()));
        }
    }
}
