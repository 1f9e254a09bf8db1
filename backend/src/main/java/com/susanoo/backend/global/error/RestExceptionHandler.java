package com.susanoo.backend.global.error;

import jakarta.servlet.http.HttpServletRequest;

import com.susanoo.backend.modules.auth.application.session.SessionConflictException;
import com.susanoo.backend.modules.auth.presentation.dto.RefreshTokenFormat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.transaction.TransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;

@ControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    static final int STORE_RETRY_AFTER_SECONDS = 1;

    @ExceptionHandler(RetryableProblemException.class)
    public ResponseEntity<ProblemResponse> handleRetryableProblem(RetryableProblemException ex, HttpServletRequest request) {
        return ResponseEntity.status(ex.getStatusCode())
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(ProblemResponse.of(ex, request.getRequestURI()));
    }

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<ProblemResponse> handleProblem(ProblemException ex, HttpServletRequest request) {
        return ResponseEntity.status(ex.getStatusCode()).body(ProblemResponse.of(ex, request.getRequestURI()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemResponse> handleResponseStatusException(ResponseStatusException ex) {
        HttpStatusCode statusCode = ex.getStatusCode();
        HttpStatus status = statusCode instanceof HttpStatus httpStatus
                ? httpStatus
                : HttpStatus.valueOf(statusCode.value());
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        ProblemResponse body = ProblemResponse.of(status, message, message, null);
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemResponse> handleValidationException(MethodArgumentNotValidException ex) {
        FieldError tokenError = ex.getBindingResult().getFieldError(RefreshTokenFormat.FIELD);
        if (tokenError != null) {
            HttpStatus status = HttpStatus.BAD_REQUEST;
            ProblemResponse body = ProblemResponse.of(status, "INVALID_REFRESH_TOKEN", tokenError.getDefaultMessage(), null);
            return ResponseEntity.status(status).body(body);
        }
        HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;
        StringBuilder sb = new StringBuilder();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            sb.append(fieldError.getField()).append(": ").append(fieldError.getDefaultMessage()).append("; ");
        }
        String detail = sb.length() > 0 ? sb.substring(0, sb.length() - 2) : "Validation failed";
        ProblemResponse body = ProblemResponse.of(status, "validation_error", detail, null);
        return ResponseEntity.status(status).body(body);
    }

    // unknown JSON properties end up here as well
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemResponse body = ProblemResponse.of(status, "malformed_request", "Request body is malformed or has unrecognized fields", null);
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(SessionConflictException.class)
    public ResponseEntity<ProblemResponse> handleSessionConflict(SessionConflictException ex) {
        log.error("Session store rejected a new session: {}", ex.getMessage());
        HttpStatus status = HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(ProblemResponse.of(status, "SESSION_CONFLICT", "Session could not be created", null));
    }

    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<ProblemResponse> handleStoreUnavailable(RuntimeException ex) {
        log.error("Session store unavailable", ex);
        HttpStatus status = HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(STORE_RETRY_AFTER_SECONDS))
                .body(ProblemResponse.of(status, "STORE_UNAVAILABLE", "Temporarily unavailable, retry the request", null));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemResponse> handleAccessDenied(AccessDeniedException ex) {
        HttpStatus status = HttpStatus.FORBIDDEN;
        return ResponseEntity.status(status).body(ProblemResponse.of(status, "forbidden", "Access denied", null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleGenericException(Exception ex) {
        log.error("Unhandled exception", ex);
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ProblemResponse body = ProblemResponse.of(status, "internal_error", "Unexpected error", null);
        return ResponseEntity.status(status).body(body);
    }
}
