package com.cgraph.e2ee.directory.prekey;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

import java.time.Instant;

/**
 * A published one-time prekey. The row is deleted the moment the key is handed
 * to a sender, so it can never be handed out twice.
 */
@Table("one_time_prekeys")
public class OneTimePrekeyEntity {

    @PrimaryKey
    private OneTimePrekeyKey key;

    /** X25519 public key, Base64. */
    @Column("public_key")
    private String publicKey;

    @Column("created_at")
    private Instant createdAt;

    public OneTimePrekeyEntity() {}

    public OneTimePrekeyEntity(OneTimePrekeyKey key, String publicKey, Instant createdAt) {
        this.key = key;
        this.publicKey = publicKey;
        this.createdAt = createdAt;
    }

    public OneTimePrekeyKey getKey() { return key; }
    public void setKey(OneTimePrekeyKey key) { this.key = key; }
    public String getPublicKey() { return publicKey; }
    public void setPublicKey(String publicKey) { this.publicKey = publicKey; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
