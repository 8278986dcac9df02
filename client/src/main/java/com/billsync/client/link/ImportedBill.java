package com.billsync.client.link;

import com.billsync.protocol.JsonWebKey;

/**
 * A recipient's verified copy of a shared bill, with what it needs to poll for updates.
 */
public record ImportedBill(
        String shareId,
        JsonWebKey contentKey,
        long version,
        String participantId,       // whose slice of the bill this link addressed
        SharedBillPayload payload
) {

    public ImportedBill withUpdate(SharedBillPayload newPayload, long newVersion) {
        return new ImportedBill(shareId, contentKey, newVersion, participantId, newPayload);
    }
}
