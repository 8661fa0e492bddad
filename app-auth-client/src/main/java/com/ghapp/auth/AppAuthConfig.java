package com.ghapp.auth;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import com.ghapp.auth.jwt.JwtLifetime;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class AppAuthConfig {

    public static final String PREFIX = "github.app.";

    private Path privateKeyFile;
    private String appId;
    private URI apiUrl = HttpAppApiClient.DEFAULT_API_URL;
    private Duration tokenLifetime = JwtLifetime.DEFAULT.tokenLifetime();
    private Duration renewalMargin = JwtLifetime.DEFAULT.renewalMargin();
    private Duration clockDrift = JwtLifetime.DEFAULT.clockDrift();
    private Duration accessTokenRefreshMargin = InstallationTokenStore.DEFAULT_REFRESH_MARGIN;
    private Duration requestTimeout = Duration.ofSeconds(10);
    private String headerName = AppAuthHeader.DEFAULT_HEADER_NAME;

    /**
     * Reads {@code github.app.*} keys; anything absent keeps its default. Durations use ISO-8601 ({@code PT10M}).
     */
    public static AppAuthConfig fromProperties(Properties props) {
        AppAuthConfig config = new AppAuthConfig();
        String keyFile = props.getProperty(PREFIX + "private-key-file");
        if (keyFile != null) {
            config.setPrivateKeyFile(Path.of(keyFile.trim()));
        }
        String appId = props.getProperty(PREFIX + "id");
        if (appId != null) {
            config.setAppId(appId.trim());
        }
        String apiUrl = props.getProperty(PREFIX + "api-url");
        if (apiUrl != null) {
            config.setApiUrl(URI.create(apiUrl.trim()));
        }
        config.setTokenLifetime(duration(props, "token-lifetime", config.getTokenLifetime()));
        config.setRenewalMargin(duration(props, "renewal-margin", config.getRenewalMargin()));
        config.setClockDrift(duration(props, "clock-drift", config.getClockDrift()));
        config.setAccessTokenRefreshMargin(duration(props, "access-token-refresh-margin", config.getAccessTokenRefreshMargin()));
        config.setRequestTimeout(duration(props, "request-timeout", config.getRequestTimeout()));
        config.setHeaderName(props.getProperty(PREFIX + "header-name", config.getHeaderName()));
        return config;
    }

    public JwtLifetime jwtLifetime() {
        return new JwtLifetime(tokenLifetime, renewalMargin, clockDrift);
    }

    public void validate() {
        if (privateKeyFile == null) {
            throw new IllegalArgumentException(PREFIX + "private-key-file is required");
        }
        if (appId == null || appId.isBlank()) {
            throw new IllegalArgumentException(PREFIX + "id is required");
        }
    }

    private static Duration duration(Properties props, String key, Duration fallback) {
        String value = props.getProperty(PREFIX + key);
        return (value == null || value.isBlank()) ? fallback : Duration.parse(value.trim());
    }
}
