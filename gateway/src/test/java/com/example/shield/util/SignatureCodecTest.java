package com.example.shield.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SignatureCodecTest {

    private final SignatureCodec codec = new SignatureCodec("unit-test-secret");

    @Test
    void testSignIsDeterministicHex() {
        String signature = codec.sign("abc:123");

        assertThat(signature).hasSize(64).matches("[0-9a-f]+");
        assertThat(codec.sign("abc:123")).isEqualTo(signature);
        assertThat(codec.sign("abc:124")).isNotEqualTo(signature);
    }

    @Test
    void testDifferentSecretsProduceDifferentSignatures() {
        SignatureCodec other = new SignatureCodec("another-secret");

        assertThat(other.sign("payload")).isNotEqualTo(codec.sign("payload"));
        assertThat(other.verify("payload", codec.sign("payload"))).isFalse();
    }

    @Test
    void testVerify() {
        String signature = codec.sign("payload");

        assertThat(codec.verify("payload", signature)).isTrue();
        assertThat(codec.verify("payload", signature.toUpperCase())).isFalse();
        assertThat(codec.verify("payload", null)).isFalse();
    }

    @Test
    void testConstantTimeEquals() {
        assertThat(SignatureCodec.constantTimeEquals("abcdef", "abcdef")).isTrue();
        assertThat(SignatureCodec.constantTimeEquals("abcdef", "abcdeg")).isFalse();
        assertThat(SignatureCodec.constantTimeEquals("abc", "abcdef")).isFalse();
        assertThat(SignatureCodec.constantTimeEquals(null, "abc")).isFalse();
        assertThat(SignatureCodec.constantTimeEquals("", "")).isTrue();
    }

    @Test
    void testEmptySecretRejected() {
        assertThatThrownBy(() -> new SignatureCodec(""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not be empty");
    }
}
