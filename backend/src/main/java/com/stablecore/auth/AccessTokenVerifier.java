package com.stablecore.auth;

import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;

/**
 * Verifies HMAC-signed access tokens issued outside the core. The token subject is the
 * caller's account id; expiry is checked against the core clock.
 */
@Component
@Slf4j
public class AccessTokenVerifier {

    private static final int MIN_KEY_BYTES = 32;

    private final JwtParser parser;

    public AccessTokenVerifier(AppProps props, Clock clock) {
        AppProps.Auth auth = props.getAuth();
        String secret = auth.getJwtSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_KEY_BYTES) {
            throw new CoreException(ErrorCode.INVALID_CONFIGURATION,
                    "app.auth.jwt-secret must be at least " + MIN_KEY_BYTES + " bytes");
        }
        SecretKey key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        JwtParserBuilder builder = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()));
        if (auth.getJwtIssuer() != null && !auth.getJwtIssuer().isBlank()) {
            builder.requireIssuer(auth.getJwtIssuer());
        }
        this.parser = builder.build();
    }

    /** Returns the subject of a valid token; anything else is UNAUTHORIZED. */
    public String verify(String token) {
        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                throw new CoreException(ErrorCode.UNAUTHORIZED, "token has no subject");
            }
            return subject;
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("[auth] rejected token: {}", e.getMessage());
            throw new CoreException(ErrorCode.UNAUTHORIZED, "invalid or expired token", e);
        }
    }
}
