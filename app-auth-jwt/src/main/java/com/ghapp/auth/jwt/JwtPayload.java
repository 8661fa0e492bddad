package com.ghapp.auth.jwt;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Objects;

/**
 * Claims of an App JWT.
 * <p>
 * Only {@code issuedAt} and {@code issuer} can be set. Expiry and renewal deadline are always derived
 * from {@code issuedAt}, and every mutation notifies the registered listener so that whoever holds a
 * token signed from the old values can drop it.
 */
public final class JwtPayload {

    /**
     * Immutable view of the payload in wire order {@code iat, exp, iss, alg}.
     */
    @JsonPropertyOrder({"iat", "exp", "iss", "alg"})
    public record Claims(
        @JsonProperty("iat") long issuedAt,
        @JsonProperty("exp") long expiresAt,
        @JsonProperty("iss") Object issuer,
        @JsonProperty("alg") String algorithm
    ) {}

    private final JwtLifetime lifetime;
    private final String algorithm = JwtHeader.RS256;

    private Instant issuedAt;
    private Instant expiresAt;
    private Instant renewalDeadline;
    private Object issuer;
    private Runnable changeListener = () -> {};

    public JwtPayload(String issuer, JwtLifetime lifetime) {
        this((Object) issuer, lifetime);
    }

    public JwtPayload(long issuer, JwtLifetime lifetime) {
        this((Object) issuer, lifetime);
    }

    private JwtPayload(Object issuer, JwtLifetime lifetime) {
        this.issuer = Objects.requireNonNull(issuer, "issuer");
        this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
        applyIssuedAt(Instant.EPOCH);
    }

    public synchronized void setIssuedAt(Instant issuedAt) {
        applyIssuedAt(Objects.requireNonNull(issuedAt, "issuedAt"));
        changeListener.run();
    }

    public synchronized void setIssuer(String issuer) {
        this.issuer = Objects.requireNonNull(issuer, "issuer");
        changeListener.run();
    }

    public synchronized void setIssuer(long issuer) {
        this.issuer = issuer;
        changeListener.run();
    }

    public synchronized Instant getIssuedAt() {
        return issuedAt;
    }

    public synchronized Instant getExpiresAt() {
        return expiresAt;
    }

    public synchronized Instant getRenewalDeadline() {
        return renewalDeadline;
    }

    public synchronized Object getIssuer() {
        return issuer;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public JwtLifetime getLifetime() {
        return lifetime;
    }

    public synchronized Claims claims() {
        return new Claims(issuedAt.getEpochSecond(), expiresAt.getEpochSecond(), issuer, algorithm);
    }

    synchronized void onChange(Runnable listener) {
        this.changeListener = Objects.requireNonNull(listener, "listener");
    }

    private void applyIssuedAt(Instant value) {
        issuedAt = value;
        expiresAt = value.plus(lifetime.tokenLifetime());
        renewalDeadline = expiresAt.minus(lifetime.effectiveRenewalMargin());
    }
}
