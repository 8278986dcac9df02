package com.billsync.kv;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

import java.nio.ByteBuffer;

/**
 * Row of the Cassandra backend. Expiry is Cassandra's own: every insert is written USING TTL,
 * so an expired row is simply not returned.
 */
@Table("ephemeral_records")
public class EphemeralRecordEntity {

    @PrimaryKey
    private String key;

    @Column("value")
    private ByteBuffer value;

    public EphemeralRecordEntity() {}

    public EphemeralRecordEntity(String key, ByteBuffer value) {
        this.key = key;
        this.value = value;
    }

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }
    public ByteBuffer getValue() { return value; }
    public void setValue(ByteBuffer value) { this.value = value; }

    byte[] valueBytes() {
        ByteBuffer copy = value.duplicate();
        byte[] bytes = new byte[copy.remaining()];
        copy.get(bytes);
        return bytes;
    }
}
