package com.ghapp.auth;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ghapp.auth.jwt.AppAuthException;
import com.ghapp.auth.jwt.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AppApiClient} on top of the JDK HTTP client. Failures are reported once, without retries.
 */
public record HttpAppApiClient(HttpClient http, URI apiUrl, Duration timeout, ObjectMapper mapper) implements AppApiClient {

    private static final Logger log = LoggerFactory.getLogger(HttpAppApiClient.class);

    public static final URI DEFAULT_API_URL = URI.create("https://api.github.com/");

    private static final TypeReference<List<AppInstallation>> INSTALLATIONS = new TypeReference<>() {};

    private static final int PAGE_SIZE = 100;

    private static final Pattern NEXT_LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"next\"");

    public HttpAppApiClient(HttpClient http, URI apiUrl, Duration timeout) {
        this(http, apiUrl, timeout, defaultMapper());
    }

    public HttpAppApiClient(HttpClient http, URI apiUrl, Duration timeout, ObjectMapper mapper) {
        this.http = Objects.requireNonNull(http, "http");
        this.apiUrl = withTrailingSlash(Objects.requireNonNull(apiUrl, "apiUrl"));
        this.timeout = (timeout == null) ? Duration.ofSeconds(10) : timeout;
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public List<AppInstallation> listInstallations(String appJwt) {
        List<AppInstallation> installations = new ArrayList<>();
        URI page = apiUrl.resolve("app/installations?per_page=" + PAGE_SIZE);
        while (page != null) {
            HttpResponse<String> resp = send(request(page, appJwt).GET().build(),
                ErrorKind.LIST_INSTALLATIONS_FAILED, "list installations");
            try {
                installations.addAll(mapper.readValue(resp.body(), INSTALLATIONS));
            } catch (IOException e) {
                throw new AppAuthException(ErrorKind.LIST_INSTALLATIONS_FAILED, "Invalid installations response", e);
            }
            page = resp.headers().firstValue("Link").map(HttpAppApiClient::nextPage).orElse(null);
        }
        return installations;
    }

    @Override
    public AccessToken createAccessToken(long installationId, String appJwt) {
        HttpRequest req = request(apiUrl.resolve("app/installations/" + installationId + "/access_tokens"), appJwt)
            .POST(HttpRequest.BodyPublishers.noBody())
            .build();
        String body = send(req, ErrorKind.EXCHANGE_FAILED, "create an access token for installation " + installationId).body();

        AccessToken token;
        try {
            token = mapper.readValue(body, AccessToken.class);
        } catch (IOException e) {
            throw new AppAuthException(ErrorKind.EXCHANGE_FAILED, "Invalid access token response", e);
        }
        if (token == null || token.token() == null) {
            throw new AppAuthException(ErrorKind.EXCHANGE_FAILED,
                "Access token response for installation " + installationId + " has no token");
        }
        return token;
    }

    private HttpRequest.Builder request(URI uri, String appJwt) {
        return HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("Authorization", "Bearer " + appJwt)
            .header("Accept", "application/vnd.github+json");
    }

    private HttpResponse<String> send(HttpRequest req, ErrorKind failure, String action) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            int sc = resp.statusCode();
            log.debug("{} {} -> HTTP {}", req.method(), req.uri(), sc);
            if (sc < 200 || sc >= 300) {
                throw new AppAuthException(failure, "Unable to " + action + ": HTTP " + sc + " - " + resp.body());
            }
            return resp;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AppAuthException(failure, "Interrupted while trying to " + action, ie);
        } catch (IOException e) {
            throw new AppAuthException(failure, "Unable to " + action, e);
        }
    }

    // Link: <https://api.github.com/app/installations?per_page=100&page=2>; rel="next", <...>; rel="last"
    static URI nextPage(String linkHeader) {
        Matcher m = NEXT_LINK.matcher(linkHeader);
        return m.find() ? URI.create(m.group(1)) : null;
    }

    private static URI withTrailingSlash(URI uri) {
        String s = uri.toString();
        return s.endsWith("/") ? uri : URI.create(s + "/");
    }
}
