package tech.noetzold.results_gateway.controller;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import tech.noetzold.results_gateway.RequestLoggingFilter;
import tech.noetzold.results_gateway.exception.AuthenticationException;
import tech.noetzold.results_gateway.exception.BadRequestException;
import tech.noetzold.results_gateway.exception.ContentServiceTimeoutException;
import tech.noetzold.results_gateway.exception.IdentityServiceUnavailableException;
import tech.noetzold.results_gateway.exception.NotFoundException;
import tech.noetzold.results_gateway.exception.PermissionDeniedException;
import tech.noetzold.results_gateway.exception.ServiceUnavailableException;
import tech.noetzold.results_gateway.exception.UpstreamResponseException;
import tech.noetzold.results_gateway.model.ApiResponse;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@Slf4j
@RestControllerAdvice
public class ErrorHandler {

    @ExceptionHandler(ServiceUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleServiceUnavailable(ServiceUnavailableException ex) {
        log.error("{}: {}", ex.getMessage(), ex.getCause() != null ? ex.getCause().getMessage() : "");
        return ApiResponse.status(ex.getMessage());
    }

    @ExceptionHandler(IdentityServiceUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleIdentityServiceUnavailable(IdentityServiceUnavailableException ex) {
        log.error("Identity service unavailable: {}", ex.getMessage());
        return ApiResponse.status(ex.getMessage());
    }

    @ExceptionHandler(ContentServiceTimeoutException.class)
    @ResponseStatus(HttpStatus.GATEWAY_TIMEOUT)
    public Map<String, Object> handleContentTimeout(ContentServiceTimeoutException ex) {
        log.error("Content lookup timed out: {}", ex.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", "UPSTREAM_TIMEOUT");
        body.put("status", ex.getMessage());
        body.put("request_id", MDC.get(RequestLoggingFilter.REQUEST_ID_KEY));
        return body;
    }

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NotFoundException ex) {
        return ApiResponse.status(ex.getMessage());
    }

    @ExceptionHandler(PermissionDeniedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handlePermissionDenied(PermissionDeniedException ex) {
        log.info("Access denied: {}", ex.getMessage());
        return ApiResponse.status(ex.getMessage());
    }

    @ExceptionHandler(AuthenticationException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public Map<String, Object> handleAuthentication(AuthenticationException ex) {
        log.warn("Authentication failed: {}", ex.getMessage());
        return ApiResponse.status(ex.getMessage());
    }

    @ExceptionHandler(BadRequestException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(BadRequestException ex) {
        return ApiResponse.status(ex.getMessage());
    }

    @ExceptionHandler(UpstreamResponseException.class)
    public ResponseEntity<byte[]> handleUpstreamResponse(UpstreamResponseException ex) {
        log.warn("Forwarding upstream error with status {}", ex.getStatusCode().value());
        HttpHeaders headers = new HttpHeaders();
        if (ex.getContentType() != null) {
            headers.setContentType(ex.getContentType());
        }
        return new ResponseEntity<>(ex.getBody(), headers, ex.getStatusCode());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            String message = Objects.requireNonNullElse(ex.getMessage(), "Request failed");
            return ResponseEntity.status(errorResponse.getStatusCode()).body(ApiResponse.status(message));
        }
        log.error("Unexpected error while serving request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.status("Internal Server Error"));
    }
}
