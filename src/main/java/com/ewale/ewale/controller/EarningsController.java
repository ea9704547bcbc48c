package com.ewale.ewale.controller;

import com.ewale.ewale.dto.ApiResponse;
import com.ewale.ewale.dto.UserEarningsResponse;
import com.ewale.ewale.dto.WithdrawalRequest;
import com.ewale.ewale.dto.WithdrawalResponse;
import com.ewale.ewale.dto.WithdrawalResult;
import com.ewale.ewale.service.EarningsService;
import com.ewale.ewale.service.WithdrawalService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/earnings")
public class EarningsController {

    private final EarningsService earningsService;
    private final WithdrawalService withdrawalService;

    public EarningsController(EarningsService earningsService, WithdrawalService withdrawalService) {
        this.earningsService = earningsService;
        this.withdrawalService = withdrawalService;
    }

    @GetMapping("/{mobile}")
    public ResponseEntity<ApiResponse<UserEarningsResponse>> getEarnings(@PathVariable String mobile) {
        try {
            UserEarningsResponse earnings = earningsService.getUserEarnings(mobile);
            return ResponseEntity.ok(ApiResponse.success("Earnings retrieved successfully", earnings));
        } catch (RuntimeException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(ApiResponse.error(e.getMessage()));
        }
    }

    @GetMapping("/{mobile}/withdrawals")
    public ResponseEntity<ApiResponse<List<WithdrawalResponse>>> getWithdrawals(@PathVariable String mobile) {
        try {
            List<WithdrawalResponse> history = withdrawalService.getWithdrawalHistory(mobile);
            return ResponseEntity.ok(ApiResponse.success("Withdrawal history retrieved successfully", history));
        } catch (RuntimeException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(ApiResponse.error(e.getMessage()));
        }
    }

    @PostMapping("/withdraw")
    public ResponseEntity<ApiResponse<WithdrawalResult>> withdraw(@Valid @RequestBody WithdrawalRequest request) {
        WithdrawalResult result = withdrawalService.processWithdrawalRequest(
                request.getMobileNumber(), request.getAmount(), null);
        if (!result.isSuccess()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(new ApiResponse<>(false, result.getMessage(), result));
        }
        return ResponseEntity.ok(ApiResponse.success(result.getMessage(), result));
    }
}
