package com.flplatform.common.protocol;

import java.util.Arrays;

/**
 * Encoded key pair for one {@link SignatureBackend}. Ed25519 keys are PKCS#8 (private) and
 * X.509 (public) encodings; fallback keys are raw bytes.
 */
public record SigningKeys(String scheme, byte[] privateKey, byte[] publicKey) {

    public SigningKeys {
        privateKey = privateKey.clone();
        publicKey = publicKey.clone();
    }

    @Override
    public byte[] privateKey() {
        return privateKey.clone();
    }

    @Override
    public byte[] publicKey() {
        return publicKey.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SigningKeys other
            && scheme.equals(other.scheme)
            && Arrays.equals(privateKey, other.privateKey)
            && Arrays.equals(publicKey, other.publicKey);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * scheme.hashCode() + Arrays.hashCode(privateKey)) + Arrays.hashCode(publicKey);
    }

    @Override
    public String toString() {
        return "SigningKeys[scheme=" + scheme + ", publicKey=" + publicKey.length + " bytes]";
    }
}
