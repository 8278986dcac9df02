package com.billsync.kv;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * billsync.kv: the backends the sharded store federates, in shard order.
 * Changing the order or count re-homes keys, so do it only while nothing live is stored.
 */
@ConfigurationProperties(prefix = "billsync.kv")
public record KeyValueProperties(
        List<Backend> backends,
        @DefaultValue("PT1M") Duration sweepInterval
) {

    public record Backend(String name, BackendType type) {}

    public enum BackendType {
        MEMORY,
        CASSANDRA
    }
}
