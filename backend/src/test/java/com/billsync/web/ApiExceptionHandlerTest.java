package com.billsync.web;

import com.billsync.protocol.BillSyncException;
import com.billsync.protocol.ErrorResponse;
import com.billsync.protocol.FailureKind;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    void everyFailureKindShouldMapToItsStatus() {
        assertEquals(HttpStatus.NOT_FOUND, ApiExceptionHandler.statusOf(FailureKind.NOT_FOUND));
        assertEquals(HttpStatus.CONFLICT, ApiExceptionHandler.statusOf(FailureKind.CONFLICT));
        assertEquals(HttpStatus.BAD_REQUEST, ApiExceptionHandler.statusOf(FailureKind.VALIDATION_FAILURE));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, ApiExceptionHandler.statusOf(FailureKind.TRANSPORT_FAILURE));
    }

    @Test
    void transportFailureShouldKeepUserMessage() {
        ResponseEntity<ErrorResponse> response = handler.billSync(
                BillSyncException.transport("Storage backend 'b' is unavailable", new RuntimeException("boom")));

        assertEquals(503, response.getStatusCode().value());
        assertEquals("TRANSPORT_FAILURE", response.getBody().code());
        assertEquals("Storage backend 'b' is unavailable", response.getBody().message());
    }

    @Test
    void unknownErrorShouldNotLeakItsMessage() {
        ResponseEntity<ErrorResponse> response = handler.unknown(new IllegalStateException("secret detail"));

        assertEquals(500, response.getStatusCode().value());
        assertEquals("SERVER_ERROR", response.getBody().code());
        assertFalse(response.getBody().message().contains("secret detail"));
    }
}
