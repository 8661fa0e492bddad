package com.ghapp.auth.jwt;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing rules for App JWTs.
 *
 * @param tokenLifetime distance between {@code iat} and {@code exp}; GitHub rejects anything above ten minutes
 * @param renewalMargin how long before {@code exp} a cached token stops being reused
 * @param clockDrift    how far {@code iat} is backdated when a token is regenerated
 */
public record JwtLifetime(Duration tokenLifetime, Duration renewalMargin, Duration clockDrift) {

    public static final JwtLifetime DEFAULT =
        new JwtLifetime(Duration.ofMinutes(10), Duration.ofMinutes(2), Duration.ofSeconds(60));

    public JwtLifetime {
        Objects.requireNonNull(tokenLifetime, "tokenLifetime");
        Objects.requireNonNull(renewalMargin, "renewalMargin");
        Objects.requireNonNull(clockDrift, "clockDrift");
        if (tokenLifetime.isNegative() || tokenLifetime.isZero()) {
            throw new IllegalArgumentException("tokenLifetime must be positive");
        }
        if (renewalMargin.isNegative()) {
            throw new IllegalArgumentException("renewalMargin must not be negative");
        }
        if (clockDrift.isNegative()) {
            throw new IllegalArgumentException("clockDrift must not be negative");
        }
    }

    /**
     * Tokens that live no longer than the margin are reused right up to their expiry.
     */
    public Duration effectiveRenewalMargin() {
        return tokenLifetime.compareTo(renewalMargin) > 0 ? renewalMargin : Duration.ZERO;
    }
}
