package com.cgraph.e2ee.directory.device;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

import java.time.Instant;

/**
 * The public keys one device registered. All key columns are Base64 of the raw
 * public encodings; the directory never sees a private key.
 */
@Table("device_keys")
public class DeviceKeysEntity {

    @PrimaryKey
    private DeviceKeysKey key;

    /** X25519 identity key. */
    @Column("identity_key")
    private String identityKey;

    @Column("identity_key_id")
    private String identityKeyId;

    /** Ed25519 key the signed prekey signature verifies under. */
    @Column("signing_key")
    private String signingKey;

    @Column("signed_prekey")
    private String signedPrekey;

    @Column("signed_prekey_id")
    private String signedPrekeyId;

    @Column("signed_prekey_signature")
    private String signedPrekeySignature;

    /**
     * Set once a contact confirmed the safety number. Cleared whenever the device
     * registers a different identity key.
     */
    @Column("verified")
    private boolean verified;

    @Column("created_at")
    private Instant createdAt;

    @Column("updated_at")
    private Instant updatedAt;

    public DeviceKeysEntity() {}

    // Getters & Setters
    public DeviceKeysKey getKey() { return key; }
    public void setKey(DeviceKeysKey key) { this.key = key; }
    public String getIdentityKey() { return identityKey; }
    public void setIdentityKey(String identityKey) { this.identityKey = identityKey; }
    public String getIdentityKeyId() { return identityKeyId; }
    public void setIdentityKeyId(String identityKeyId) { this.identityKeyId = identityKeyId; }
    public String getSigningKey() { return signingKey; }
    public void setSigningKey(String signingKey) { this.signingKey = signingKey; }
    public String getSignedPrekey() { return signedPrekey; }
    public void setSignedPrekey(String signedPrekey) { this.signedPrekey = signedPrekey; }
    public String getSignedPrekeyId() { return signedPrekeyId; }
    public void setSignedPrekeyId(String signedPrekeyId) { this.signedPrekeyId = signedPrekeyId; }
    public String getSignedPrekeySignature() { return signedPrekeySignature; }
    public void setSignedPrekeySignature(String signedPrekeySignature) { this.signedPrekeySignature = signedPrekeySignature; }
    public boolean isVerified() { return verified; }
    public void setVerified(boolean verified) { this.verified = verified; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
