package com.billsync.protocol;

/**
 * Unchecked failure carrying its {@link FailureKind}.
 * Every crypto and network error is mapped to one of these before it reaches a UI or an HTTP response.
 */
public class BillSyncException extends RuntimeException {

    private final FailureKind kind;

    public BillSyncException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BillSyncException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }

    public static BillSyncException notFound(String message) {
        return new BillSyncException(FailureKind.NOT_FOUND, message);
    }

    public static BillSyncException conflict(String message) {
        return new BillSyncException(FailureKind.CONFLICT, message);
    }

    public static BillSyncException transport(String message, Throwable cause) {
        return new BillSyncException(FailureKind.TRANSPORT_FAILURE, message, cause);
    }

    public static BillSyncException invalid(String message) {
        return new BillSyncException(FailureKind.VALIDATION_FAILURE, message);
    }

    public static BillSyncException invalid(String message, Throwable cause) {
        return new BillSyncException(FailureKind.VALIDATION_FAILURE, message, cause);
    }
}
