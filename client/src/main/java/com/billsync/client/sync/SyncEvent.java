package com.billsync.client.sync;

public enum SyncEvent {
    START_SENDING,
    START_RECEIVING,
    SESSION_CREATED,    // relay assigned a code
    PEER_JOINED,        // relay paired both sides
    TRANSFER_STARTED,   // sender began pushing key and data
    DATA_RECEIVED,      // receiver got the encrypted dataset
    DECRYPTED,          // receiver holds plaintext, awaiting the user
    IMPORT_APPLIED,     // receiver committed the import
    PEER_COMPLETED,     // sender got sync_complete
    CANCEL,
    FAIL,
    RESET
}
