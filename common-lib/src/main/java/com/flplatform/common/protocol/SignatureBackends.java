package com.flplatform.common.protocol;

import com.flplatform.common.exception.AggregationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;

public final class SignatureBackends {

    private static final Logger log = LoggerFactory.getLogger(SignatureBackends.class);

    public static final SignatureBackend ED25519  = new Ed25519SignatureBackend();
    public static final SignatureBackend FALLBACK = new FallbackSignatureBackend();

    private static final SignatureBackend DETECTED = probe();

    private SignatureBackends() {}

    /** Ed25519 when the JDK provides it, otherwise the fallback. Probed once per JVM. */
    public static SignatureBackend detect() {
        return DETECTED;
    }

    public static SignatureBackend forScheme(String scheme) {
        if (Ed25519SignatureBackend.SCHEME.equals(scheme)) {
            return ED25519;
        }
        if (FallbackSignatureBackend.SCHEME.equals(scheme)) {
            return FALLBACK;
        }
        throw new AggregationException("SignatureBackends", "Unknown signature scheme: " + scheme);
    }

    private static SignatureBackend probe() {
        try {
            KeyPairGenerator.getInstance("Ed25519");
            return ED25519;
        } catch (NoSuchAlgorithmException e) {
            log.warn("[SignatureBackends] ED25519_UNAVAILABLE fallback={} reason={}",
                FallbackSignatureBackend.SCHEME, e.getMessage());
            return FALLBACK;
        }
    }
}
