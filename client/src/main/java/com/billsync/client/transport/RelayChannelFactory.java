package com.billsync.client.transport;

@FunctionalInterface
public interface RelayChannelFactory {

    RelayChannel create();
}
