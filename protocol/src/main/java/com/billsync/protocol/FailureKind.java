package com.billsync.protocol;

/**
 * The four ways a share or sync operation can fail, as seen by a caller.
 *
 * NOT_FOUND         : session or secret absent, expired, or already consumed.
 *                     Safe to show verbatim ("link expired or invalid").
 * CONFLICT          : update race on a share session; the owner recreates.
 * TRANSPORT_FAILURE : relay or storage unreachable, connection dropped.
 *                     Recoverable by retrying from idle.
 * VALIDATION_FAILURE: malformed code, payload, key or signature.
 */
public enum FailureKind {
    NOT_FOUND,
    CONFLICT,
    TRANSPORT_FAILURE,
    VALIDATION_FAILURE
}
