package com.flplatform.common.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flplatform.common.codec.ParameterCodec;
import com.flplatform.common.codec.WireFormat;

import java.time.Instant;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Signed envelope for any protocol payload.
 *
 * <p>The signed input is the SHA-256 of the canonical (key-sorted) JSON of
 * {@code message_id, sender_id, message_type, payload, timestamp}; the signature fields
 * themselves are excluded. {@link #sign} returns a signed copy.
 *
 * <p>The verifier is the local backend ({@link SignatureBackends#detect()}), never the
 * {@code signature_scheme} the sender wrote. A message whose scheme differs from the
 * verifier's is rejected, so {@code sha256-fallback} messages are accepted only on a JVM
 * that itself runs in fallback mode.
 */
public record SignedMessage(
    @JsonProperty("message_id")       String messageId,
    @JsonProperty("sender_id")        String senderId,
    @JsonProperty("message_type")     FLMessageType messageType,
    @JsonProperty("payload")          Map<String, Object> payload,
    @JsonProperty("timestamp")        Instant timestamp,
    @JsonProperty("signature")        String signature,
    @JsonProperty("signature_scheme") String signatureScheme
) {

    private static final HexFormat HEX = HexFormat.of();

    public SignedMessage {
        Objects.requireNonNull(senderId, "senderId");
        Objects.requireNonNull(messageType, "messageType");
        messageId = messageId == null || messageId.isBlank() ? UUID.randomUUID().toString() : messageId;
        payload   = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        timestamp = timestamp == null ? Instant.now() : timestamp;
        signature = signature == null ? "" : signature;
        signatureScheme = signatureScheme == null ? "" : signatureScheme;
    }

    /** Unsigned message with a random id and the current time. */
    public static SignedMessage create(String senderId, FLMessageType type, Map<String, Object> payload) {
        return new SignedMessage(null, senderId, type, payload, null, null, null);
    }

    public static SignedMessage create(String messageId, String senderId, FLMessageType type,
                                       Map<String, Object> payload) {
        return new SignedMessage(messageId, senderId, type, payload, null, null, null);
    }

    /** SHA-256 over the canonical JSON of the signable fields. */
    public byte[] messageHash() {
        Map<String, Object> signable = new LinkedHashMap<>();
        signable.put("message_id", messageId);
        signable.put("sender_id", senderId);
        signable.put("message_type", messageType);
        signable.put("payload", payload);
        signable.put("timestamp", timestamp);
        return ParameterCodec.sha256(WireFormat.canonicalJson(signable));
    }

    public SignedMessage sign(SigningKeys keys) {
        SignatureBackend backend = SignatureBackends.forScheme(keys.scheme());
        byte[] sig = backend.sign(messageHash(), keys.privateKey());
        return new SignedMessage(messageId, senderId, messageType, payload, timestamp,
            HEX.formatHex(sig), backend.scheme());
    }

    public boolean signed() {
        return !signature.isEmpty();
    }

    /**
     * Verifies with the backend detected for this JVM.
     *
     * @param publicKey the sender's encoded public key; ignored in fallback mode
     * @return {@code false} when unsigned, malformed, signed under another scheme or not matching
     */
    public boolean verify(byte[] publicKey) {
        return verify(publicKey, SignatureBackends.detect());
    }

    public boolean verify(byte[] publicKey, SignatureBackend verifier) {
        Objects.requireNonNull(verifier, "verifier");
        if (!signed() || !verifier.scheme().equals(signatureScheme)) {
            return false;
        }
        byte[] sig;
        try {
            sig = HEX.parseHex(signature);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return verifier.verify(messageHash(), sig, publicKey);
    }

    public byte[] toBytes() {
        return WireFormat.toJsonBytes(this);
    }

    public static SignedMessage fromBytes(byte[] bytes) {
        return WireFormat.fromJsonBytes(bytes, SignedMessage.class);
    }
}
