package com.billsync.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON body of every non-2xx response. {@code code} is a {@link FailureKind} name or a generic
 * HTTP code such as {@code SERVER_ERROR}; {@code message} is safe to show to a user.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorResponse(String code, String message, String debug) {

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(code, message, null);
    }

    public static ErrorResponse of(String code, String message, String debug) {
        return new ErrorResponse(code, message, debug);
    }

    public static ErrorResponse of(BillSyncException exception) {
        return new ErrorResponse(exception.kind().name(), exception.getMessage(), null);
    }
}
