package com.ghapp.auth;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.ghapp.auth.jwt.AppAuthException;
import com.ghapp.auth.jwt.AppTokenCache;
import com.ghapp.auth.jwt.ErrorKind;

import lombok.extern.slf4j.Slf4j;

/**
 * Caches installation access tokens and exchanges the App JWT for a new one when an entry is missing
 * or about to expire.
 * <p>
 * Refreshes are serialized per installation: at most one exchange per id is in flight, while
 * different installations refresh independently. The set of known installations is refreshed at most
 * once per lookup of an unknown id.
 */
@Slf4j
public class InstallationTokenStore {

    public static final Duration DEFAULT_REFRESH_MARGIN = Duration.ofMinutes(2);

    private final AppTokenCache appTokens;
    private final Clock clock;
    private final Duration refreshMargin;
    private final Map<Long, AccessToken> tokens = new ConcurrentHashMap<>();
    private final Map<Long, Object> refreshLocks = new ConcurrentHashMap<>();
    private final Set<Long> installations = new HashSet<>();
    private final Object installationsLock = new Object();

    private volatile AppApiClient apiClient;

    public InstallationTokenStore(AppTokenCache appTokens, AppApiClient apiClient) {
        this(appTokens, apiClient, DEFAULT_REFRESH_MARGIN, Clock.systemUTC());
    }

    public InstallationTokenStore(AppTokenCache appTokens, AppApiClient apiClient, Duration refreshMargin, Clock clock) {
        this.appTokens = Objects.requireNonNull(appTokens, "appTokens");
        this.apiClient = apiClient;
        this.refreshMargin = Objects.requireNonNull(refreshMargin, "refreshMargin");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void setApiClient(AppApiClient apiClient) {
        this.apiClient = apiClient;
    }

    /**
     * Returns a token for the installation that stays valid for at least the refresh margin.
     *
     * @throws AppAuthException {@link ErrorKind#UNKNOWN_INSTALLATION} when the App is not installed there,
     *                          {@link ErrorKind#EXCHANGE_FAILED} when the API refuses to issue a token
     */
    public AccessToken tokenFor(long installationId) {
        AppApiClient client = requireApiClient();
        ensureKnownInstallation(client, installationId);

        Object lock = refreshLocks.computeIfAbsent(installationId, id -> new Object());
        synchronized (lock) {
            AccessToken current = tokens.get(installationId);
            if (current == null || current.expiresWithin(refreshMargin, clock.instant())) {
                log.debug("Requesting access token for installation {}", installationId);
                current = client.createAccessToken(installationId, requireAppJwt());
                tokens.put(installationId, current);
            }
            return current;
        }
    }

    public Set<Long> knownInstallations() {
        synchronized (installationsLock) {
            return Set.copyOf(installations);
        }
    }

    public Map<Long, AccessToken> cachedTokens() {
        return Map.copyOf(tokens);
    }

    private void ensureKnownInstallation(AppApiClient client, long installationId) {
        synchronized (installationsLock) {
            if (installations.contains(installationId)) {
                return;
            }
            refreshInstallations(client);
            if (!installations.contains(installationId)) {
                throw new AppAuthException(ErrorKind.UNKNOWN_INSTALLATION,
                    "Installation " + installationId + " is not valid for App " + appTokens.getAppId());
            }
        }
    }

    private void refreshInstallations(AppApiClient client) {
        Set<Long> fresh = new HashSet<>();
        for (AppInstallation installation : client.listInstallations(requireAppJwt())) {
            fresh.add(installation.id());
        }
        installations.clear();
        installations.addAll(fresh);
        log.info("App {} has {} installation(s)", appTokens.getAppId(), fresh.size());
    }

    private String requireAppJwt() {
        return appTokens.currentToken()
            .orElseThrow(() -> new AppAuthException(ErrorKind.INVALID_KEY_MATERIAL,
                "The App JWT could not be generated for App " + appTokens.getAppId()));
    }

    private AppApiClient requireApiClient() {
        AppApiClient client = apiClient;
        if (client == null) {
            throw new AppAuthException(ErrorKind.COLLABORATOR_NOT_CONFIGURED, "No AppApiClient has been configured");
        }
        return client;
    }
}
