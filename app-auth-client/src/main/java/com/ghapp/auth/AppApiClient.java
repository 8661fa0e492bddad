package com.ghapp.auth;

import java.util.List;

/**
 * The two App-level REST calls needed to obtain installation tokens. Both authenticate with the App JWT
 * as a bearer credential and fail hard on any non-success response.
 */
public interface AppApiClient {

    /**
     * {@code GET app/installations}
     */
    List<AppInstallation> listInstallations(String appJwt);

    /**
     * {@code POST app/installations/{id}/access_tokens}
     */
    AccessToken createAccessToken(long installationId, String appJwt);
}
