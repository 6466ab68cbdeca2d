package com.flplatform.common.protocol;

import com.flplatform.common.exception.AggregationException;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;

/** Ed25519 through the JDK security provider. */
public class Ed25519SignatureBackend implements SignatureBackend {

    public static final String SCHEME = "ed25519";

    private static final String ALGORITHM = "Ed25519";
    private static final String COMPONENT = "Ed25519SignatureBackend";

    @Override
    public String scheme() {
        return SCHEME;
    }

    @Override
    public SigningKeys generateKeys() {
        try {
            KeyPair pair = KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
            return new SigningKeys(SCHEME, pair.getPrivate().getEncoded(), pair.getPublic().getEncoded());
        } catch (GeneralSecurityException e) {
            throw new AggregationException(COMPONENT, "key generation failed: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] sign(byte[] messageHash, byte[] privateKey) {
        try {
            PrivateKey key = KeyFactory.getInstance(ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(privateKey));
            Signature signer = Signature.getInstance(ALGORITHM);
            signer.initSign(key);
            signer.update(messageHash);
            return signer.sign();
        } catch (GeneralSecurityException e) {
            throw new AggregationException(COMPONENT, "signing failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean verify(byte[] messageHash, byte[] signature, byte[] publicKey) {
        try {
            PublicKey key = KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(publicKey));
            Signature verifier = Signature.getInstance(ALGORITHM);
            verifier.initVerify(key);
            verifier.update(messageHash);
            return verifier.verify(signature);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            return false;
        }
    }
}
