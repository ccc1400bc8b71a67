package com.example.chat.realtime.service.auth;

import com.example.chat.shared.exception.AuthenticationException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.PrematureJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Date;

/**
 * Verifies HMAC-signed JWTs issued by the account service with the shared secret.
 * The user id is the {@code sub} claim; {@code exp} and {@code nbf} are enforced with the
 * configured clock skew.
 */
@Slf4j
public class HmacTokenVerifier implements TokenVerifier {

    private final JwtParser parser;

    public HmacTokenVerifier(String secret, Clock clock, Duration clockSkew) {
        this.parser = Jwts.parser()
                .verifyWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)))
                .clock(() -> Date.from(clock.instant()))
                .clockSkewSeconds(clockSkew.toSeconds())
                .build();
    }

    @Override
    public Mono<String> verify(String token) {
        return Mono.fromCallable(() -> verifySync(token));
    }

    private String verifySync(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationException("Missing credential");
        }
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token.trim()).getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthenticationException("Token expired", e);
        } catch (PrematureJwtException e) {
            throw new AuthenticationException("Token not yet valid", e);
        } catch (SignatureException e) {
            throw new AuthenticationException("Invalid token signature", e);
        } catch (UnsupportedJwtException e) {
            throw new AuthenticationException("Unsupported token algorithm", e);
        } catch (MalformedJwtException e) {
            throw new AuthenticationException("Malformed token", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getMessage());
            throw new AuthenticationException("Invalid token", e);
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new AuthenticationException("Token has no subject");
        }
        return subject;
    }
}
