package com.ewale.ewale.controller;

import com.ewale.ewale.dto.ApiResponse;
import com.ewale.ewale.dto.UssdStatisticsResponse;
import com.ewale.ewale.entity.UssdLog;
import com.ewale.ewale.exception.ResourceNotFoundException;
import com.ewale.ewale.service.UssdLoggingService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/ussd-logs")
public class UssdLogController {

    private final UssdLoggingService loggingService;

    public UssdLogController(UssdLoggingService loggingService) {
        this.loggingService = loggingService;
    }

    @GetMapping("/mobile/{mobile}")
    public ResponseEntity<ApiResponse<List<UssdLog>>> getLogsByMobile(@PathVariable String mobile) {
        try {
            List<UssdLog> logs = loggingService.getLogsByMobile(mobile);
            return ResponseEntity.ok(ApiResponse.success("USSD logs retrieved successfully", logs));
        } catch (RuntimeException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(ApiResponse.error(e.getMessage()));
        }
    }

    @GetMapping("/session/{sessionId}")
    public ResponseEntity<ApiResponse<UssdLog>> getLogBySession(@PathVariable String sessionId) {
        UssdLog log = loggingService.getLogBySession(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("No USSD log for session " + sessionId));
        return ResponseEntity.ok(ApiResponse.success("USSD log retrieved successfully", log));
    }

    @GetMapping("/statistics")
    public ResponseEntity<ApiResponse<UssdStatisticsResponse>> getStatistics() {
        try {
            UssdStatisticsResponse statistics = loggingService.getStatistics();
            return ResponseEntity.ok(ApiResponse.success("USSD statistics retrieved successfully", statistics));
        } catch (RuntimeException e) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiResponse.error(e.getMessage()));
        }
    }
}
