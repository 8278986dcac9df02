package com.billsync.web;

import com.billsync.protocol.BillSyncException;
import com.billsync.protocol.ErrorResponse;
import com.billsync.protocol.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps {@link BillSyncException} kinds onto HTTP statuses. Anything unexpected becomes a 500
 * with a generic message; the detail goes to the log, never to the caller.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(BillSyncException.class)
    public ResponseEntity<ErrorResponse> billSync(BillSyncException ex) {
        HttpStatus status = statusOf(ex.kind());
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", ex.kind(), ex.getMessage(), ex.getCause());
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(ex));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> badInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(FailureKind.VALIDATION_FAILURE.name(), "Request body or parameters are malformed.", ex.getReason()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> status(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        String code = status == null ? "HTTP_" + ex.getStatusCode().value() : status.name();
        return ResponseEntity.status(ex.getStatusCode())
                .body(ErrorResponse.of(code, ex.getReason() == null ? code : ex.getReason()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unknown(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("SERVER_ERROR", "Something went wrong, please try again.", ex.getClass().getName()));
    }

    static HttpStatus statusOf(FailureKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case VALIDATION_FAILURE -> HttpStatus.BAD_REQUEST;
            case TRANSPORT_FAILURE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
