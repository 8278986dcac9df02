package com.billsync.client.sync;

public enum SyncRole {
    SENDER,
    RECEIVER
}
