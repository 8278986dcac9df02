package com.billsync.onetime;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "billsync.onetime")
public record OneTimeSecretProperties(@DefaultValue("PT24H") Duration ttl) {}
