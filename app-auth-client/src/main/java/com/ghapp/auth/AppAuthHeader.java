package com.ghapp.auth;

import java.net.http.HttpRequest;
import java.util.function.Supplier;

/**
 * Adds a bearer credential to outgoing requests, fetching it fresh from its source on every call.
 */
public record AppAuthHeader(Supplier<String> tokenSource, String headerName) {

    public static final String DEFAULT_HEADER_NAME = "Authorization";

    public AppAuthHeader(Supplier<String> tokenSource, String headerName) {
        this.tokenSource = tokenSource;
        this.headerName = (headerName == null || headerName.isBlank())
            ? DEFAULT_HEADER_NAME
            : headerName;
    }

    public static AppAuthHeader forApp(AppAuthenticator authenticator, String headerName) {
        return new AppAuthHeader(authenticator::appToken, headerName);
    }

    public static AppAuthHeader forInstallation(AppAuthenticator authenticator, long installationId, String headerName) {
        return new AppAuthHeader(() -> authenticator.installationToken(installationId), headerName);
    }

    public HttpRequest.Builder add(HttpRequest.Builder builder) {
        return builder.header(headerName, "Bearer " + tokenSource.get());
    }
}
