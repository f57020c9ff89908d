package com.yamdb.backend.modules.auth.infrastructure.jwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.junit.jupiter.api.Test;

class JwtTokenProviderTest {

    @Test
    void plainSecretIsUsedAsText() {
        String secret = "abcdefghijklmnopqrstuvwxyz012345";

        JwtTokenProvider provider = new JwtTokenProvider(secret);

        assertThat(provider.getSecretKey().getEncoded()).isEqualTo(secret.getBytes(StandardCharsets.UTF_8));
        assertThat(provider.getSecretKey().getAlgorithm()).isEqualTo("HmacSHA256");
    }

    @Test
    void prefixedSecretIsDecoded() {
        byte[] raw = new byte[48];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = (byte) i;
        }

        JwtTokenProvider provider = new JwtTokenProvider(
                JwtTokenProvider.BASE64_PREFIX + Base64.getEncoder().encodeToString(raw));

        assertThat(provider.getSecretKey().getEncoded()).isEqualTo(raw);
    }

    @Test
    void shortSecretFailsStartup() {
        assertThatThrownBy(() -> new JwtTokenProvider("too-short"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("JWT_SECRET")
                .hasMessageContaining("32 bytes");
    }

    @Test
    void missingOrMalformedSecretFailsStartup() {
        assertThatThrownBy(() -> new JwtTokenProvider(" "))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must be configured");
        assertThatThrownBy(() -> new JwtTokenProvider(JwtTokenProvider.BASE64_PREFIX + "%%%not-base64%%%"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not valid Base64");
    }
}
