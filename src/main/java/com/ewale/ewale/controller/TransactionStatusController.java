package com.ewale.ewale.controller;

import com.ewale.ewale.dto.ApiResponse;
import com.ewale.ewale.dto.TransactionStatusSummary;
import com.ewale.ewale.exception.HubtelApiException;
import com.ewale.ewale.service.TransactionStatusService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/transaction-status")
public class TransactionStatusController {

    private final TransactionStatusService transactionStatusService;

    public TransactionStatusController(TransactionStatusService transactionStatusService) {
        this.transactionStatusService = transactionStatusService;
    }

    /**
     * Live status lookup; at least one identifier is required.
     */
    @GetMapping
    public ResponseEntity<ApiResponse<TransactionStatusSummary>> checkStatus(
            @RequestParam(required = false) String clientReference,
            @RequestParam(required = false) String hubtelTransactionId,
            @RequestParam(required = false) String networkTransactionId) {
        try {
            TransactionStatusSummary summary = transactionStatusService.checkTransactionStatus(
                    clientReference, hubtelTransactionId, networkTransactionId);
            return ResponseEntity.ok(ApiResponse.success(summary.getMessage(), summary));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(ApiResponse.error(e.getMessage()));
        } catch (HubtelApiException e) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(ApiResponse.error(e.getMessage()));
        }
    }

    @PostMapping("/check-pending")
    public ResponseEntity<ApiResponse<Integer>> checkPending() {
        try {
            int resolved = transactionStatusService.checkPendingTransactions();
            return ResponseEntity.ok(ApiResponse.success("Pending transactions checked", resolved));
        } catch (RuntimeException e) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiResponse.error(e.getMessage()));
        }
    }
}
