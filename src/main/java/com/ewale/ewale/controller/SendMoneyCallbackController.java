package com.ewale.ewale.controller;

import com.ewale.ewale.dto.ApiResponse;
import com.ewale.ewale.dto.SendMoneyCallbackRequest;
import com.ewale.ewale.service.WithdrawalService;
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
@RequestMapping("/api/send-money")
public class SendMoneyCallbackController {

    private static final Logger logger = LoggerFactory.getLogger(SendMoneyCallbackController.class);

    private final WithdrawalService withdrawalService;

    public SendMoneyCallbackController(WithdrawalService withdrawalService) {
        this.withdrawalService = withdrawalService;
    }

    @PostMapping("/callback")
    public ResponseEntity<ApiResponse<Void>> handleSendMoneyCallback(
            @Valid @RequestBody SendMoneyCallbackRequest callback) {
        try {
            logger.info("Received send money callback {} for {}", callback.getResponseCode(), callback.getReference());
            withdrawalService.handleSendMoneyCallback(callback);
            return ResponseEntity.ok(ApiResponse.success("Callback processed", null));
        } catch (RuntimeException e) {
            logger.error("Error processing send money callback: ", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiResponse.error(e.getMessage()));
        }
    }
}
