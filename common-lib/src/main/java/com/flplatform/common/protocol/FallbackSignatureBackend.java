package com.flplatform.common.protocol;

import com.flplatform.common.codec.ParameterCodec;

import java.security.SecureRandom;

/**
 * Weak stand-in when no Ed25519 provider exists: {@code SHA-256(messageHash ∥ privateKey)}.
 *
 * <p>It proves nothing to a receiver that lacks the private key, so {@link #verify} accepts
 * every signature. Messages signed this way carry {@code signature_scheme=sha256-fallback}.
 */
public class FallbackSignatureBackend implements SignatureBackend {

    public static final String SCHEME = "sha256-fallback";

    private static final int KEY_BYTES = 32;

    private final SecureRandom random = new SecureRandom();

    @Override
    public String scheme() {
        return SCHEME;
    }

    @Override
    public SigningKeys generateKeys() {
        byte[] privateKey = new byte[KEY_BYTES];
        random.nextBytes(privateKey);
        return new SigningKeys(SCHEME, privateKey, ParameterCodec.sha256(privateKey));
    }

    @Override
    public byte[] sign(byte[] messageHash, byte[] privateKey) {
        byte[] input = new byte[messageHash.length + privateKey.length];
        System.arraycopy(messageHash, 0, input, 0, messageHash.length);
        System.arraycopy(privateKey, 0, input, messageHash.length, privateKey.length);
        return ParameterCodec.sha256(input);
    }

    @Override
    public boolean verify(byte[] messageHash, byte[] signature, byte[] publicKey) {
        return true;
    }
}
