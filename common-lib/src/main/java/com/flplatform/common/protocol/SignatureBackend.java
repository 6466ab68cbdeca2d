package com.flplatform.common.protocol;

/**
 * Signing primitive behind {@link SignedMessage}. Resolved once through
 * {@link SignatureBackends#detect()}.
 */
public interface SignatureBackend {

    /** Value written to {@code signature_scheme}. */
    String scheme();

    SigningKeys generateKeys();

    byte[] sign(byte[] messageHash, byte[] privateKey);

    /** @return {@code false} for a bad signature or unusable key, never throws for those */
    boolean verify(byte[] messageHash, byte[] signature, byte[] publicKey);
}
