package com.al.graphsubscriptions.exception;

import com.al.graphsubscriptions.dto.ErrorResponse;
import com.al.graphsubscriptions.interceptor.MdcInterceptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MissingCredentialException.class)
    public ResponseEntity<ErrorResponse> handleMissingCredential(MissingCredentialException e,
            HttpServletRequest request) {
        log.warn("Missing credential: {}", e.getMessage());
        return buildResponse(HttpStatus.UNAUTHORIZED, "Unauthorized", e.getMessage(), request);
    }

    @ExceptionHandler(PrincipalMismatchException.class)
    public ResponseEntity<ErrorResponse> handlePrincipalMismatch(PrincipalMismatchException e,
            HttpServletRequest request) {
        log.warn("Principal mismatch: {}", e.getMessage());
        return buildResponse(HttpStatus.FORBIDDEN, "Forbidden", e.getMessage(), request);
    }

    @ExceptionHandler(TokenAcquisitionException.class)
    public ResponseEntity<ErrorResponse> handleTokenFailure(TokenAcquisitionException e,
            HttpServletRequest request) {
        log.error("Token acquisition failed: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_GATEWAY, "Token Acquisition Failed", e.getMessage(), request);
    }

    @ExceptionHandler(GraphApiException.class)
    public ResponseEntity<ErrorResponse> handleGraphError(GraphApiException e, HttpServletRequest request) {
        if (e.isAuthorizationFailure()) {
            log.warn("Graph refused the caller's credential: {}", e.getMessage());
            return buildResponse(HttpStatus.UNAUTHORIZED, "Graph Authorization Failed", e.getMessage(), request);
        }
        log.error("Graph call failed ({}): {}", e.getFailureKind(), e.getMessage());
        return buildResponse(HttpStatus.BAD_GATEWAY, "Graph Request Failed", e.getMessage(), request);
    }

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<ErrorResponse> handleRegistryError(RegistryException e, HttpServletRequest request) {
        log.error("Registry unavailable: {}", e.getMessage(), e);
        return buildResponse(HttpStatus.SERVICE_UNAVAILABLE, "Registry Unavailable", e.getMessage(), request);
    }

    @ExceptionHandler(JsonProcessingException.class)
    public ResponseEntity<ErrorResponse> handleJsonError(JsonProcessingException e, HttpServletRequest request) {
        log.error("JSON Processing Error: {}", e.getOriginalMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "JSON Processing Error", e.getOriginalMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(IllegalArgumentException e, HttpServletRequest request) {
        log.warn("Invalid Input: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Input Error", e.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e,
            HttpServletRequest request) {
        log.warn("Invalid parameter {}: {}", e.getName(), e.getValue());
        return buildResponse(HttpStatus.BAD_REQUEST, "Input Error",
                "Invalid value for parameter '" + e.getName() + "'", request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException e,
            HttpServletRequest request) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        log.warn("Validation Error: {}", details);
        return buildResponse(HttpStatus.BAD_REQUEST, "Validation Error", details, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralError(Exception e, HttpServletRequest request) {
        log.error("Internal Server Error: ", e);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred",
                request);
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String error, String message,
            HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse(
                LocalDateTime.now(),
                status.value(),
                error,
                message,
                request.getRequestURI(),
                MDC.get(MdcInterceptor.MDC_KEY));
        return new ResponseEntity<>(response, status);
    }
}
