package com.stablecore.auth;

import com.stablecore.config.AppProps;
import com.stablecore.error.ErrorCode;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessTokenVerifierTest {

    private static final String SECRET = "verifier-test-signing-key-0123456789abcdef";
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private static AccessTokenVerifier verifier(String secret, String issuer) {
        AppProps props = new AppProps();
        props.getAuth().setJwtSecret(secret);
        props.getAuth().setJwtIssuer(issuer);
        return new AccessTokenVerifier(props, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static String token(String secret, String subject, String issuer, Instant expiresAt) {
        return Jwts.builder()
                .subject(subject)
                .issuer(issuer)
                .issuedAt(Date.from(NOW.minusSeconds(60)))
                .expiration(Date.from(expiresAt))
                .signWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }

    @Test
    @DisplayName("a valid token yields its subject")
    void valid() {
        String subject = verifier(SECRET, null).verify(token(SECRET, "alice.test", null, NOW.plusSeconds(300)));

        assertThat(subject).isEqualTo("alice.test");
    }

    @Test
    @DisplayName("a token signed with another key is unauthorized")
    void wrongKey() {
        String forged = token("some-other-signing-key-0123456789abcdef", "owner.test", null, NOW.plusSeconds(300));

        assertThatThrownBy(() -> verifier(SECRET, null).verify(forged))
                .extracting("code").isEqualTo(ErrorCode.UNAUTHORIZED);
    }

    @Test
    @DisplayName("expiry is judged by the core clock")
    void expired() {
        String old = token(SECRET, "alice.test", null, NOW.minusSeconds(1));

        assertThatThrownBy(() -> verifier(SECRET, null).verify(old))
                .extracting("code").isEqualTo(ErrorCode.UNAUTHORIZED);
    }

    @Test
    @DisplayName("a configured issuer must match")
    void issuer() {
        AccessTokenVerifier v = verifier(SECRET, "auth.stable-core");

        assertThat(v.verify(token(SECRET, "alice.test", "auth.stable-core", NOW.plusSeconds(300)))).isEqualTo("alice.test");
        assertThatThrownBy(() -> v.verify(token(SECRET, "alice.test", "elsewhere", NOW.plusSeconds(300))))
                .extracting("code").isEqualTo(ErrorCode.UNAUTHORIZED);
    }

    @Test
    @DisplayName("garbage and tokens without a subject are unauthorized")
    void garbage() {
        AccessTokenVerifier v = verifier(SECRET, null);

        assertThatThrownBy(() -> v.verify("not.a.token"))
                .extracting("code").isEqualTo(ErrorCode.UNAUTHORIZED);
        assertThatThrownBy(() -> v.verify(""))
                .extracting("code").isEqualTo(ErrorCode.UNAUTHORIZED);
        String anonymous = Jwts.builder()
                .expiration(Date.from(NOW.plusSeconds(300)))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();
        assertThatThrownBy(() -> v.verify(anonymous))
                .extracting("code").isEqualTo(ErrorCode.UNAUTHORIZED);
    }

    @Test
    @DisplayName("a signing secret shorter than 32 bytes is a configuration error")
    void shortSecret() {
        assertThatThrownBy(() -> verifier("too-short", null))
                .extracting("code").isEqualTo(ErrorCode.INVALID_CONFIGURATION);
        assertThatThrownBy(() -> verifier(null, null))
                .extracting("code").isEqualTo(ErrorCode.INVALID_CONFIGURATION);
    }
}
