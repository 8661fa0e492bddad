package com.ghapp.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Installation access token as returned by {@code POST app/installations/{id}/access_tokens}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccessToken(
    @JsonProperty("token") String token,
    @JsonProperty("expires_at") Instant expiresAt,
    @JsonProperty("permissions") Map<String, String> permissions,
    @JsonProperty("repository_selection") String repositorySelection
) {

    /**
     * A token without an expiry never needs refreshing.
     */
    public boolean expiresWithin(Duration margin, Instant now) {
        return expiresAt != null && expiresAt.isBefore(now.plus(margin));
    }

    @Override
    public String toString() {
        return "AccessToken[expiresAt=" + expiresAt + ", repositorySelection=" + repositorySelection + "]";
    }
}
