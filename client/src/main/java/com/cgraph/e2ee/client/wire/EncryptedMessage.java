package com.cgraph.e2ee.client.wire;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One sealed message as handed to the transport. Every field is Base64 except
 * the key ids. The messaging layer carries the sender id and sender identity key
 * alongside it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EncryptedMessage(
    @JsonProperty("ciphertext") String ciphertext,                               // AES-GCM output, tag appended
    @JsonProperty("ephemeral_public_key") String ephemeralPublicKey,
    @JsonProperty("recipient_identity_key_id") String recipientIdentityKeyId,
    @JsonProperty("one_time_prekey_id") String oneTimePrekeyId,                  // null when DH4 was skipped
    @JsonProperty("nonce") String nonce
) {}
