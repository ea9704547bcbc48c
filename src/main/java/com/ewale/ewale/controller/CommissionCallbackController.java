package com.ewale.ewale.controller;

import com.ewale.ewale.dto.ApiResponse;
import com.ewale.ewale.dto.CommissionCallbackRequest;
import com.ewale.ewale.service.CommissionTransactionLogService;
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
@RequestMapping("/api/commission")
public class CommissionCallbackController {

    private static final Logger logger = LoggerFactory.getLogger(CommissionCallbackController.class);

    private final CommissionTransactionLogService commissionLogService;

    public CommissionCallbackController(CommissionTransactionLogService commissionLogService) {
        this.commissionLogService = commissionLogService;
    }

    /**
     * Commission Services delivery result
     * POST /api/commission/callback
     */
    @PostMapping("/callback")
    public ResponseEntity<ApiResponse<Void>> handleCommissionCallback(
            @Valid @RequestBody CommissionCallbackRequest callback) {
        try {
            logger.info("Received commission callback {} for {}", callback.getResponseCode(), callback.getReference());
            commissionLogService.handleCommissionCallback(callback);
            return ResponseEntity.ok(ApiResponse.success("Callback processed", null));
        } catch (RuntimeException e) {
            logger.error("Error processing commission callback: ", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiResponse.error(e.getMessage()));
        }
    }
}
