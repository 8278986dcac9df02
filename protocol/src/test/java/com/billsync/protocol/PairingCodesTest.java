package com.billsync.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PairingCodesTest {

    @Test
    void acceptsExactlySixDigits() {
        assertTrue(PairingCodes.isWellFormed("482913"));
        assertFalse(PairingCodes.isWellFormed("48291"));
        assertFalse(PairingCodes.isWellFormed("4829130"));
        assertFalse(PairingCodes.isWellFormed("48a913"));
        assertFalse(PairingCodes.isWellFormed(null));
    }

    @Test
    void normalizeStripsWhitespaceFromTypedInput() {
        assertEquals("482913", PairingCodes.normalize(" 482 913\n"));
    }

    @Test
    void normalizeRejectsMalformedCodeAsValidationFailure() {
        BillSyncException ex = assertThrows(BillSyncException.class, () -> PairingCodes.normalize("12-34"));
        assertEquals(FailureKind.VALIDATION_FAILURE, ex.kind());
    }
}
