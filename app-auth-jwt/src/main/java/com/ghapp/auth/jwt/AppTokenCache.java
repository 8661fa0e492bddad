package com.ghapp.auth.jwt;

import com.ghapp.auth.jwt.key.PemKeyReader;
import com.ghapp.auth.jwt.key.PrivateKeyMaterial;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import lombok.extern.slf4j.Slf4j;

/**
 * Holds the signed App JWT and regenerates it once the renewal deadline has passed.
 */
@Slf4j
public class AppTokenCache {

    private record Cached(String token, Instant renewalDeadline) {}

    private final JwtHeader header = JwtHeader.DEFAULT;
    private final JwtPayload payload;
    private final PrivateKeyMaterial key;
    private final JwtSigner signer;
    private final Clock clock;
    private final AtomicReference<Cached> cache = new AtomicReference<>();
    private final Object renewalLock = new Object();

    public AppTokenCache(Path privateKeyFile, String appId) {
        this(readKey(privateKeyFile), new JwtPayload(appId, JwtLifetime.DEFAULT), new Rs256JwtSigner(), Clock.systemUTC());
    }

    public AppTokenCache(Path privateKeyFile, String appId, JwtLifetime lifetime, Clock clock) {
        this(readKey(privateKeyFile), new JwtPayload(appId, lifetime), new Rs256JwtSigner(), clock);
    }

    public AppTokenCache(PrivateKeyMaterial key, JwtPayload payload, JwtSigner signer, Clock clock) {
        this.key = Objects.requireNonNull(key, "key");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.clock = Objects.requireNonNull(clock, "clock");
        payload.onChange(this::invalidate);
    }

    /**
     * Returns the cached App JWT, signing a new one first when none is cached or the renewal deadline
     * has passed. Empty when signing failed.
     */
    public Optional<String> currentToken() {
        Cached current = cache.get();
        if (current == null || isPastDeadline(current)) {
            synchronized (renewalLock) {
                current = cache.get();
                if (current == null || isPastDeadline(current)) {
                    current = regenerate();
                }
            }
        }
        return Optional.ofNullable(current).map(Cached::token);
    }

    /**
     * Drops the cached token so the next {@link #currentToken()} signs a fresh one.
     */
    public void invalidate() {
        cache.set(null);
    }

    public JwtPayload getPayload() {
        return payload;
    }

    public Object getAppId() {
        return payload.getIssuer();
    }

    private Cached regenerate() {
        payload.setIssuedAt(clock.instant().minus(payload.getLifetime().clockDrift()));
        JwtPayload.Claims claims = payload.claims();
        try {
            Cached fresh = new Cached(signer.sign(header, claims, key), payload.getRenewalDeadline());
            // payload setters invalidate under the payload monitor, so compare and publish under it too
            synchronized (payload) {
                if (claims.equals(payload.claims())) {
                    cache.set(fresh);
                }
            }
            log.debug("Signed new App JWT for issuer {} valid until {}", claims.issuer(), payload.getExpiresAt());
            return fresh;
        } catch (AppAuthException e) {
            log.warn("Failed to sign App JWT for issuer {}", claims.issuer(), e);
            cache.set(null);
            return null;
        }
    }

    private boolean isPastDeadline(Cached cached) {
        return clock.instant().isAfter(cached.renewalDeadline());
    }

    private static PrivateKeyMaterial readKey(Path privateKeyFile) {
        return PemKeyReader.read(privateKeyFile)
            .orElseThrow(() -> new AppAuthException(ErrorKind.INVALID_KEY_MATERIAL,
                "No PRIVATE KEY block found in " + privateKeyFile));
    }
}
