package com.billsync.kv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Configuration
public class KeyValueStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(KeyValueStoreConfig.class);

    @Bean
    public ShardedKeyValueStore ephemeralKeyValueStore(KeyValueProperties properties,
                                                       Clock clock,
                                                       ObjectProvider<ReactiveCassandraOperations> cassandra) {
        if (properties.backends() == null || properties.backends().isEmpty()) {
            throw new IllegalStateException("billsync.kv.backends must list at least one backend");
        }
        List<EphemeralKeyValueStore> backends = new ArrayList<>();
        for (KeyValueProperties.Backend backend : properties.backends()) {
            backends.add(switch (backend.type()) {
                case MEMORY -> new InMemoryKeyValueStore(backend.name(), clock);
                case CASSANDRA -> new CassandraKeyValueStore(backend.name(), cassandra.getIfAvailable(() -> {
                    throw new IllegalStateException("Backend '" + backend.name()
                            + "' needs Cassandra; run with the 'cassandra' profile");
                }));
            });
        }
        log.info("Ephemeral store federating {} backends: {}", backends.size(),
                backends.stream().map(EphemeralKeyValueStore::name).toList());
        return new ShardedKeyValueStore(backends);
    }
}
