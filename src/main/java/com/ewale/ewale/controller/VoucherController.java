package com.ewale.ewale.controller;

import com.ewale.ewale.dto.ApiResponse;
import com.ewale.ewale.dto.VoucherBulkRequest;
import com.ewale.ewale.dto.VoucherBulkResponse;
import com.ewale.ewale.entity.VoucherType;
import com.ewale.ewale.service.VoucherService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/vouchers")
public class VoucherController {

    private final VoucherService voucherService;

    public VoucherController(VoucherService voucherService) {
        this.voucherService = voucherService;
    }

    @PostMapping("/bulk")
    public ResponseEntity<ApiResponse<VoucherBulkResponse>> importVouchers(
            @Valid @RequestBody VoucherBulkRequest request) {
        try {
            VoucherBulkResponse response = voucherService.importVouchers(request);
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(ApiResponse.success("Vouchers imported successfully", response));
        } catch (RuntimeException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(ApiResponse.error(e.getMessage()));
        }
    }

    @GetMapping("/available")
    public ResponseEntity<ApiResponse<Map<VoucherType, Long>>> getAvailable() {
        try {
            return ResponseEntity.ok(ApiResponse.success("Available vouchers retrieved successfully",
                    voucherService.getAvailableCounts()));
        } catch (RuntimeException e) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiResponse.error(e.getMessage()));
        }
    }
}
