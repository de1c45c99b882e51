package com.onextel.CampaignDialerApplication.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(CampaignValidationException.class)
    public ResponseEntity<ErrorResponse> handleCampaignValidation(CampaignValidationException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("errors", ex.getResult().getErrors());
        details.put("warnings", ex.getResult().getWarnings());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("VALIDATION_FAILED", "Campaign validation failed", details));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("VALIDATION_FAILED", e.getMessage()));
    }

    // Missing X-User-Id header or request parameter
    @ExceptionHandler(ServletRequestBindingException.class)
    public ResponseEntity<ErrorResponse> handleRequestBinding(ServletRequestBindingException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("VALIDATION_FAILED", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("VALIDATION_FAILED", "Malformed request body"));
    }

    @ExceptionHandler(CampaignNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleCampaignNotFound(CampaignNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("CAMPAIGN_NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(CallNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleCallNotFoundException(CallNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("CALL_NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(InvalidCampaignStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(InvalidCampaignStateException ex) {
        Map<String, Object> details = ex.getCurrentStatus() == null
                ? null : Map.of("currentStatus", ex.getCurrentStatus().dbValue());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("INVALID_STATE", ex.getMessage(), details));
    }

    @ExceptionHandler(PhoneNumberConflictException.class)
    public ResponseEntity<ErrorResponse> handlePhoneNumberConflict(PhoneNumberConflictException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("conflictType", ex.getConflictType());
        details.put("conflictingId", ex.getConflictingId());
        if (ex.getConflictingName() != null) {
            details.put("conflictingName", ex.getConflictingName());
        }
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("PHONE_NUMBER_CONFLICT", ex.getMessage(), details));
    }

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientBalance(InsufficientBalanceException ex) {
        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED)
                .body(new ErrorResponse("INSUFFICIENT_BALANCE", ex.getMessage(),
                        Map.of("required", ex.getRequired(), "available", ex.getAvailable())));
    }

    @ExceptionHandler(RemoteGatewayException.class)
    public ResponseEntity<ErrorResponse> handleRemoteGateway(RemoteGatewayException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", ex.getOperation());
        if (ex.getStatusCode() != null) {
            details.put("remoteStatusCode", ex.getStatusCode());
        }
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse("GATEWAY_ERROR", ex.getMessage(), details));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitExceededException ex) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(new ErrorResponse("RATE_LIMITED", ex.getMessage(),
                        Map.of("retryAfterSeconds", ex.getRetryAfterSeconds())));
    }

    @ExceptionHandler(ServiceShuttingDownException.class)
    public ResponseEntity<ErrorResponse> handleServiceShutdown(ServiceShuttingDownException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("SERVICE_UNAVAILABLE", ex.getMessage()));
    }

    // Handle other general exceptions globally
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(Exception e) {
        log.error("Unhandled request error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred: " + e.getMessage()));
    }
}
