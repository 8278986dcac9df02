package com.billsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Blind relay and ephemeral storage for end-to-end encrypted bill sharing and device sync.
 * Nothing stored here is readable by the server: it holds opaque ciphertext with a TTL and
 * forwards relay frames without persisting them.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class BillSyncBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(BillSyncBackendApplication.class, args);
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
