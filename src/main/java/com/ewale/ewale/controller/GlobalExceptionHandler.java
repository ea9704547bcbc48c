package com.ewale.ewale.controller;

import com.ewale.ewale.dto.ApiResponse;
import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.exception.ResourceNotFoundException;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final UssdResponseBuilder responses;

    public GlobalExceptionHandler(UssdResponseBuilder responses) {
        this.responses = responses;
    }

    /**
     * An invalid USSD turn is still answered with a USSD release; anything else gets a 400.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errorMessage = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        if (errorMessage.isEmpty()) {
            errorMessage = "Validation failed: " + ex.getMessage();
        }

        Object target = ex.getBindingResult().getTarget();
        if (target instanceof UssdRequest) {
            UssdRequest turn = (UssdRequest) target;
            logger.warn("Rejected USSD turn for session {}: {}", turn.getSessionId(), errorMessage);
            return ResponseEntity.ok(responses.error(turn.getSessionId(), UssdResponseBuilder.GENERIC_ERROR));
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.error(errorMessage));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        logger.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.error("Malformed request body"));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNotFound(ResourceNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error(ex.getMessage()));
    }
}
