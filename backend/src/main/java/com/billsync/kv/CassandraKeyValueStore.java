package com.billsync.kv;

import org.springframework.data.cassandra.core.DeleteOptions;
import org.springframework.data.cassandra.core.InsertOptions;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.data.cassandra.core.WriteResult;
import reactor.core.publisher.Mono;

import java.nio.ByteBuffer;
import java.time.Duration;

/**
 * Cassandra (or ScyllaDB) backend. TTLs map onto Cassandra's native per-row TTL, which has
 * one-second granularity, so sub-second TTLs are rounded up to one second.
 */
public class CassandraKeyValueStore implements EphemeralKeyValueStore {

    private final String name;
    private final ReactiveCassandraOperations operations;

    public CassandraKeyValueStore(String name, ReactiveCassandraOperations operations) {
        this.name = name;
        this.operations = operations;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Mono<byte[]> get(String key) {
        return operations.selectOneById(key, EphemeralRecordEntity.class)
                .map(EphemeralRecordEntity::valueBytes);
    }

    @Override
    public Mono<Void> set(String key, byte[] value, Duration ttl) {
        InsertOptions options = InsertOptions.builder()
                .ttl(Duration.ofSeconds(Math.max(1, ttl.toSeconds())))
                .build();
        return operations.insert(new EphemeralRecordEntity(key, ByteBuffer.wrap(value.clone())), options)
                .then();
    }

    @Override
    public Mono<Void> del(String key) {
        return operations.deleteById(key, EphemeralRecordEntity.class).then();
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return operations.exists(key, EphemeralRecordEntity.class);
    }

    /**
     * Read, then a lightweight-transaction DELETE ... IF EXISTS. Only the caller whose delete was
     * applied gets the value; a concurrent taker sees wasApplied() == false and comes back empty.
     */
    @Override
    public Mono<byte[]> take(String key) {
        DeleteOptions ifExists = DeleteOptions.builder().withIfExists().build();
        return operations.selectOneById(key, EphemeralRecordEntity.class)
                .flatMap(entity -> operations.delete(entity, ifExists)
                        .filter(WriteResult::wasApplied)
                        .map(applied -> entity.valueBytes()));
    }
}
