package com.stakeledger.backend.exception;

import com.stakeledger.backend.dto.ApiError;
import com.stakeledger.backend.dto.ApiErrorDetail;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toDetail)
                .toList();
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", false, "Validation failed", details, request, ex);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraint(ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getConstraintViolations().stream()
                .map(violation -> ApiErrorDetail.builder()
                        .field(violation.getPropertyPath().toString())
                        .issue(violation.getMessage())
                        .build())
                .toList();
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", false, "Validation failed", details, request, ex);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", false,
                "Missing required header " + ex.getHeaderName(), List.of(), request, ex);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, "BAD_REQUEST", false, ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ApiError> handleLedger(LedgerException ex, HttpServletRequest request) {
        LedgerErrorCode code = ex.getErrorCode();
        return buildError(statusFor(code), code.name(), code.isRetryable(), ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", false, "Unexpected error", List.of(), request, ex);
    }

    static HttpStatus statusFor(LedgerErrorCode code) {
        return switch (code) {
            case NOT_AUTHORIZED, LAST_ADMIN -> HttpStatus.FORBIDDEN;
            case ALREADY_REGISTERED, COOLDOWN_NOT_ELAPSED, ALREADY_INITIALIZED, REENTRANT_CALL -> HttpStatus.CONFLICT;
            case NOT_REGISTERED -> HttpStatus.NOT_FOUND;
            case INSUFFICIENT_DEPOSIT, INSUFFICIENT_STAKE, INSUFFICIENT_FUNDS, ZERO_AMOUNT -> HttpStatus.UNPROCESSABLE_ENTITY;
            case NOT_INITIALIZED -> HttpStatus.SERVICE_UNAVAILABLE;
            case TRANSFER_FAILED -> HttpStatus.BAD_GATEWAY;
        };
    }

    private ApiErrorDetail toDetail(FieldError error) {
        return ApiErrorDetail.builder()
                .field(error.getField())
                .issue(error.getDefaultMessage())
                .build();
    }

    private ResponseEntity<ApiError> buildError(HttpStatus status, String errorCode, boolean retryable, String message,
                                                List<ApiErrorDetail> details, HttpServletRequest request, Exception ex) {
        ApiError error = ApiError.builder()
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .status(status.value())
                .error(status.getReasonPhrase())
                .errorCode(errorCode)
                .retryable(retryable)
                .message(message)
                .requestId(MDC.get("requestId"))
                .correlationId(MDC.get("correlationId"))
                .details(details)
                .build();
        log.warn("{} {} -> {} {} {}", request.getMethod(), request.getRequestURI(), status.value(), errorCode, message);
        return ResponseEntity.status(status).body(error);
    }
}
