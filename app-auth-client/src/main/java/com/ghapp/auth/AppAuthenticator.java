package com.ghapp.auth;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.Objects;

import com.ghapp.auth.jwt.AppAuthException;
import com.ghapp.auth.jwt.AppTokenCache;
import com.ghapp.auth.jwt.ErrorKind;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for authenticating as a GitHub App or as one of its installations.
 */
@Slf4j
@Getter
public class AppAuthenticator {

    private final AppTokenCache appTokens;
    private final InstallationTokenStore installationTokens;

    public AppAuthenticator(AppTokenCache appTokens, InstallationTokenStore installationTokens) {
        this.appTokens = Objects.requireNonNull(appTokens, "appTokens");
        this.installationTokens = Objects.requireNonNull(installationTokens, "installationTokens");
    }

    public static AppAuthenticator create(AppAuthConfig config) {
        HttpClient http = HttpClient.newBuilder()
            .connectTimeout(config.getRequestTimeout())
            .build();
        return create(config, new HttpAppApiClient(http, config.getApiUrl(), config.getRequestTimeout()));
    }

    public static AppAuthenticator create(AppAuthConfig config, AppApiClient apiClient) {
        config.validate();
        Clock clock = Clock.systemUTC();
        AppTokenCache appTokens = new AppTokenCache(config.getPrivateKeyFile(), config.getAppId(), config.jwtLifetime(), clock);
        InstallationTokenStore store =
            new InstallationTokenStore(appTokens, apiClient, config.getAccessTokenRefreshMargin(), clock);
        log.info("Configured GitHub App {} against {}", config.getAppId(), config.getApiUrl());
        return new AppAuthenticator(appTokens, store);
    }

    /**
     * The App JWT, for App-level endpoints.
     */
    public String appToken() {
        return appTokens.currentToken()
            .orElseThrow(() -> new AppAuthException(ErrorKind.INVALID_KEY_MATERIAL,
                "The system could not generate a valid JWT for App " + appTokens.getAppId()));
    }

    public String installationToken(long installationId) {
        return installationTokens.tokenFor(installationId).token();
    }

    public String installationToken(String installationId) {
        long id;
        try {
            id = Long.parseLong(installationId.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("The value \"" + installationId + "\" is not an installation id", e);
        }
        return installationToken(id);
    }

    public AccessToken accessToken(long installationId) {
        return installationTokens.tokenFor(installationId);
    }
}
