package com.phillippitts.sodam.service.backend;

import com.phillippitts.sodam.config.properties.BackendApiProperties;
import com.phillippitts.sodam.exception.NotificationException;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Minimal JSON client for the ops backend's internal endpoints.
 *
 * <p>Every request carries {@code Authorization: Bearer <token>} when an internal token is
 * configured. Transport errors, non-2xx responses and unparseable bodies are all raised as
 * {@link NotificationException}; callers decide whether that is fatal.
 */
public class BackendApiClient {

    private final RestTemplate restTemplate;
    private final String token;

    /**
     * Builds a client whose connect and read timeouts both equal {@code timeout}.
     */
    public static BackendApiClient create(RestTemplateBuilder builder, BackendApiProperties props, Duration timeout) {
        RestTemplate restTemplate = builder
                .rootUri(stripTrailingSlash(props.getBaseUrl()))
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
        return new BackendApiClient(restTemplate, props.getInternalToken());
    }

    public BackendApiClient(RestTemplate restTemplate, String token) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.token = token == null || token.isBlank() ? null : token;
    }

    /**
     * POSTs a JSON body (or no body when {@code body} is null).
     *
     * @param path URI template relative to the backend base URL, e.g. {@code /v1/calls/{id}/end}
     * @throws NotificationException on any failure
     */
    public void postJson(String path, JSONObject body, Object... uriVariables) {
        HttpEntity<String> entity = new HttpEntity<>(body == null ? null : body.toString(), headers());
        try {
            restTemplate.exchange(path, HttpMethod.POST, entity, String.class, uriVariables);
        } catch (RestClientException e) {
            throw new NotificationException(path, "Backend POST failed: " + e.getMessage(), e);
        }
    }

    /**
     * GETs a JSON object.
     *
     * @throws NotificationException on any failure, including an empty or non-object body
     */
    public JSONObject getJson(String path, Object... uriVariables) {
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(path, HttpMethod.GET, new HttpEntity<>(headers()), String.class,
                    uriVariables);
        } catch (RestClientException e) {
            throw new NotificationException(path, "Backend GET failed: " + e.getMessage(), e);
        }
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            throw new NotificationException(path, "Backend returned an empty body");
        }
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw new NotificationException(path, "Backend returned malformed JSON", e);
        }
    }

    public boolean hasToken() {
        return token != null;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (token != null) {
            headers.setBearerAuth(token);
        }
        return headers;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
