package com.billsync.share;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * billsync.share: the sliding window a session survives without an update.
 * The owner's client re-publishes well inside it to keep a link alive.
 */
@ConfigurationProperties(prefix = "billsync.share")
public record ShareSessionProperties(
        @DefaultValue("P30D") Duration ttl,
        @DefaultValue("100") int maxBatchSize
) {}
