package com.example.chat.realtime.service.auth;

import com.example.chat.realtime.support.MutableClock;
import com.example.chat.realtime.support.TestTokens;
import com.example.chat.shared.exception.AuthenticationException;
import io.jsonwebtoken.security.WeakKeyException;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HmacTokenVerifierTest {

    private static final String SECRET = "unit-test-secret-that-is-long-enough-for-hs256";

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
    private final HmacTokenVerifier verifier = new HmacTokenVerifier(SECRET, clock, Duration.ofSeconds(30));

    private void assertRejected(String token, String message) {
        StepVerifier.create(verifier.verify(token))
                .expectErrorMatches(e -> e instanceof AuthenticationException && e.getMessage().equals(message))
                .verify();
    }

    @Test
    void validTokenResolvesToSubject() {
        String token = TestTokens.token(SECRET, "user-42", clock.instant().plus(Duration.ofHours(1)));

        StepVerifier.create(verifier.verify(token))
                .expectNext("user-42")
                .verifyComplete();
    }

    @Test
    void tokenWithoutExpiryIsAccepted() {
        StepVerifier.create(verifier.verify(TestTokens.token(SECRET, "user-42", null)))
                .expectNext("user-42")
                .verifyComplete();
    }

    @Test
    void expiredTokenIsRejectedAfterClockSkew() {
        String token = TestTokens.token(SECRET, "user-42", clock.instant().minus(Duration.ofSeconds(10)));
        StepVerifier.create(verifier.verify(token)).expectNext("user-42").verifyComplete();

        clock.advance(Duration.ofMinutes(1));

        assertRejected(token, "Token expired");
    }

    @Test
    void expiryGivenAsTextIsStillEnforced() {
        String token = TestTokens.sign(SECRET, "{\"alg\":\"HS256\"}", "{\"sub\":\"u1\",\"exp\":\"1\"}");

        StepVerifier.create(verifier.verify(token)).expectError(AuthenticationException.class).verify();
    }

    @Test
    void tokenIsRejectedBeforeItsNotBeforeTime() {
        String token = TestTokens.token(SECRET, "user-42", null, clock.instant().plus(Duration.ofMinutes(5)));
        assertRejected(token, "Token not yet valid");

        clock.advance(Duration.ofMinutes(5));

        StepVerifier.create(verifier.verify(token)).expectNext("user-42").verifyComplete();
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        String token = TestTokens.token("some-other-secret-of-sufficient-length-0123", "user-42", null);

        assertRejected(token, "Invalid token signature");
    }

    @Test
    void missingAndMalformedTokensAreRejected() {
        assertRejected(null, "Missing credential");
        assertRejected("  ", "Missing credential");
        StepVerifier.create(verifier.verify("abc.def")).expectError(AuthenticationException.class).verify();
        StepVerifier.create(verifier.verify("!!!.###.$$$")).expectError(AuthenticationException.class).verify();
    }

    @Test
    void otherAlgorithmsAndBlankSubjectsAreRejected() {
        String none = TestTokens.sign(SECRET, "{\"alg\":\"none\"}", "{\"sub\":\"user-42\"}");
        String blank = TestTokens.sign(SECRET, "{\"alg\":\"HS256\"}", "{\"sub\":\"\"}");

        StepVerifier.create(verifier.verify(none)).expectError(AuthenticationException.class).verify();
        StepVerifier.create(verifier.verify(blank)).expectError(AuthenticationException.class).verify();
    }

    @Test
    void shortSecretsAreRefusedAtStartup() {
        assertThatThrownBy(() -> new HmacTokenVerifier("too-short", clock, Duration.ZERO))
                .isInstanceOf(WeakKeyException.class);
    }
}
