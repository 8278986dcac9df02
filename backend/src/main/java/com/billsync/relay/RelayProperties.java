package com.billsync.relay;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * billsync.relay: where the relay listens and the largest frame it accepts.
 * A data frame carries a whole encrypted dataset, so the frame limit is generous.
 */
@ConfigurationProperties(prefix = "billsync.relay")
public record RelayProperties(
        @DefaultValue("/sync") String path,
        @DefaultValue("16777216") int maxFrameBytes
) {}
