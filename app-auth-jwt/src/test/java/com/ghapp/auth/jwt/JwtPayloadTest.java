package com.ghapp.auth.jwt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtPayloadTest {

    private static final Instant NEW_YEAR_2020 = Instant.parse("2020-01-01T00:00:00Z");

    private final Rs256JwtSigner signer = new Rs256JwtSigner();

    @Test
    @DisplayName("setting issuedAt derives expiry and renewal deadline")
    void derivesExpiryFromIssuedAt() {
        JwtPayload payload = new JwtPayload(TestKeys.APP_ID, JwtLifetime.DEFAULT);

        payload.setIssuedAt(NEW_YEAR_2020);

        assertThat(payload.getExpiresAt()).isEqualTo(Instant.parse("2020-01-01T00:10:00Z"));
        assertThat(payload.getRenewalDeadline()).isEqualTo(Instant.parse("2020-01-01T00:08:00Z"));
    }

    @Test
    @DisplayName("negative renewal margin or clock drift is rejected")
    void rejectsNegativeDurations() {
        assertThatThrownBy(() -> new JwtLifetime(Duration.ofMinutes(10), Duration.ofMinutes(-1), Duration.ofSeconds(60)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("renewalMargin");
        assertThatThrownBy(() -> new JwtLifetime(Duration.ofMinutes(10), Duration.ofMinutes(2), Duration.ofSeconds(-60)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("clockDrift");
    }

    @Test
    @DisplayName("lifetimes no longer than the renewal margin renew at expiry")
    void shortLifetimeRenewsAtExpiry() {
        JwtLifetime shortLived = new JwtLifetime(Duration.ofMinutes(2), Duration.ofMinutes(2), Duration.ofSeconds(60));
        JwtPayload payload = new JwtPayload(TestKeys.APP_ID, shortLived);

        payload.setIssuedAt(NEW_YEAR_2020);

        assertThat(payload.getRenewalDeadline()).isEqualTo(payload.getExpiresAt());
    }

    @Test
    @DisplayName("string issuer serializes in iat, exp, iss, alg order")
    void serializesStringIssuer() {
        JwtPayload payload = new JwtPayload(TestKeys.APP_ID, JwtLifetime.DEFAULT);
        payload.setIssuedAt(NEW_YEAR_2020);

        assertThat(signer.toJson(payload.claims()))
            .isEqualTo("{\"iat\":1577836800,\"exp\":1577837400,\"iss\":\"123456\",\"alg\":\"RS256\"}");
    }

    @Test
    @DisplayName("numeric issuer is kept as a number")
    void serializesNumericIssuer() {
        JwtPayload payload = new JwtPayload(123456L, JwtLifetime.DEFAULT);
        payload.setIssuedAt(Instant.parse("2022-05-01T00:00:00Z"));

        assertThat(signer.toJson(payload.claims()))
            .isEqualTo("{\"iat\":1651363200,\"exp\":1651363800,\"iss\":123456,\"alg\":\"RS256\"}");
    }

    @Test
    @DisplayName("header serializes typ before alg")
    void serializesHeader() {
        assertThat(signer.toJson(JwtHeader.DEFAULT)).isEqualTo("{\"typ\":\"JWT\",\"alg\":\"RS256\"}");
    }

    @Test
    @DisplayName("every mutation notifies the listener")
    void notifiesOnMutation() {
        JwtPayload payload = new JwtPayload(TestKeys.APP_ID, JwtLifetime.DEFAULT);
        AtomicInteger changes = new AtomicInteger();
        payload.onChange(changes::incrementAndGet);

        payload.setIssuedAt(NEW_YEAR_2020);
        payload.setIssuer("654321");
        payload.setIssuer(654321L);

        assertThat(changes).hasValue(3);
        assertThat(payload.getIssuer()).isEqualTo(654321L);
    }

    @Test
    @DisplayName("sub-second precision is truncated on the wire")
    void truncatesToSeconds() {
        JwtPayload payload = new JwtPayload(TestKeys.APP_ID, JwtLifetime.DEFAULT);
        payload.setIssuedAt(NEW_YEAR_2020.plusMillis(999));

        assertThat(payload.claims().issuedAt()).isEqualTo(1577836800L);
        assertThat(payload.claims().expiresAt()).isEqualTo(1577837400L);
    }
}
