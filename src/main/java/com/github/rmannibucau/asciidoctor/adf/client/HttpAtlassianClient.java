package com.github.rmannibucau.asciidoctor.adf.client;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.rmannibucau.asciidoctor.adf.extension.JiraCredentials;

/**
 * {@link AtlassianClient} over the JDK {@link HttpClient}, authenticating with an API token (basic auth).
 */
public class HttpAtlassianClient implements AtlassianClient {

    private static final Logger LOG = LoggerFactory.getLogger(HttpAtlassianClient.class);

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;

    private final ObjectMapper mapper;

    private final String jiraBaseUrl;

    private final String confluenceBaseUrl;

    private final String authorization;

    public HttpAtlassianClient(final JiraCredentials credentials) {
        this(credentials, HttpClient.newBuilder()
                .connectTimeout(TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), new ObjectMapper());
    }

    public HttpAtlassianClient(final JiraCredentials credentials, final HttpClient httpClient, final ObjectMapper mapper) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.jiraBaseUrl = stripTrailingSlash(credentials.getBaseUrl());
        this.confluenceBaseUrl = stripTrailingSlash(credentials.getConfluenceBaseUrl());
        this.authorization = "Basic " + Base64.getEncoder()
                .encodeToString((credentials.getUserEmail() + ':' + credentials.getApiToken()).getBytes(UTF_8));
    }

    @Override
    public ApiResult<JsonNode> queryIssues(final String jql, final List<String> fields) {
        final String uri = jiraBaseUrl + "/rest/api/3/search/jql?jql=" + encode(jql)
                + (fields == null ? "" : "&fields=" + encode(String.join(",", fields)));
        try {
            final HttpResponse<String> response = get(uri);
            if (response.statusCode() != 200) {
                return ApiResult.failure("Jira API query failed: " + uri + " -> " + response.statusCode() + " " + response.body());
            }
            return ApiResult.success(mapper.readTree(response.body()));
        } catch (final IOException | RuntimeException e) {
            return ApiResult.failure("Failed to query Jira: " + e.getMessage());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return ApiResult.failure("Interrupted while querying Jira");
        }
    }

    @Override
    public ApiResult<JsonNode> getFieldMetadata() {
        final String uri = jiraBaseUrl + "/rest/api/3/field";
        try {
            final HttpResponse<String> response = get(uri);
            if (response.statusCode() != 200) {
                return ApiResult.failure("Failed to get Jira fields: " + uri + " -> " + response.statusCode() + " " + response.body());
            }
            final JsonNode fields = mapper.readTree(response.body());
            if (!fields.isArray()) {
                return ApiResult.failure("Unexpected Jira fields payload from " + uri);
            }
            return ApiResult.success(fields);
        } catch (final IOException | RuntimeException e) {
            return ApiResult.failure("Error fetching Jira fields: " + e.getMessage());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return ApiResult.failure("Interrupted while fetching Jira fields");
        }
    }

    @Override
    public Optional<AtlassianUser> findUserByName(final String fullName) {
        final String uri = confluenceBaseUrl + "/wiki/rest/api/search/user?cql=" + encode("user.fullname~\"" + fullName + "\"");
        try {
            final HttpResponse<String> response = get(uri);
            if (response.statusCode() / 100 != 2) {
                LOG.warn("Failed to query Confluence user: {} -> {}", uri, response.statusCode());
                return Optional.empty();
            }
            final JsonNode results = mapper.readTree(response.body()).path("results");
            if (!results.isArray() || results.isEmpty()) {
                return Optional.empty();
            }
            final JsonNode user = results.get(0).path("user");
            return Optional.of(new AtlassianUser(user.path("accountId").asText(null), user.path("displayName").asText(null)));
        } catch (final IOException | RuntimeException e) {
            LOG.warn("Failed to query Confluence user: {}", e.getMessage());
            return Optional.empty();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    private HttpResponse<String> get(final String uri) throws IOException, InterruptedException {
        LOG.debug("GET {}", uri);
        return httpClient.send(HttpRequest.newBuilder(URI.create(uri))
                .timeout(TIMEOUT)
                .header("Authorization", authorization)
                .header("Accept", "application/json")
                .GET()
                .build(), HttpResponse.BodyHandlers.ofString());
    }

    private static String encode(final String value) {
        return URLEncoder.encode(value, UTF_8);
    }

    private static String stripTrailingSlash(final String url) {
        return url == null ? null : url.replaceFirst("/+$", "");
    }
}
