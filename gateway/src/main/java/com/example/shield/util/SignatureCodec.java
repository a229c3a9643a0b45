package com.example.shield.util;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

/**
 * HMAC-SHA-256 signing with hex output, and a comparison whose running time
 * does not depend on where two equal-length inputs first differ.
 */
public class SignatureCodec {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public SignatureCodec(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Signing secret must not be empty");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public String sign(String payload) {
        try {
            // Mac instances are not thread-safe; one per call
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA-256 unavailable", e);
        }
    }

    public boolean verify(String payload, String signature) {
        if (signature == null) {
            return false;
        }
        return constantTimeEquals(sign(payload), signature);
    }

    /**
     * Length mismatch returns immediately; for equal lengths every position is
     * visited and differences are accumulated without branching.
     */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        byte[] left = a.getBytes(StandardCharsets.UTF_8);
        byte[] right = b.getBytes(StandardCharsets.UTF_8);
        if (left.length != right.length) {
            return false;
        }
        int diff = 0;
        for (int i = 0; i < left.length; i++) {
            diff |= left[i] ^ right[i];
        }
        return diff == 0;
    }
}
