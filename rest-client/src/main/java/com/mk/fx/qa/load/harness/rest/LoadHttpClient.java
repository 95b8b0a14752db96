package com.mk.fx.qa.load.harness.rest;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@link RequestIssuer} backed by a single keep-alive {@link HttpClient}. Every request carries the
 * same short timeout; a request that times out yields {@code null} so that callers can record it as
 * a failed sample and keep going.
 */
@Slf4j
public class LoadHttpClient implements RequestIssuer, AutoCloseable {

    /** Default per-request timeout. */
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(1);

    /** Default connection timeout. */
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    /** The underlying Java HTTP client, shared by every request of this issuer. */
    private final HttpClient httpClient;

    /** Headers sent with every request. */
    private final Map<String, String> headers;

    /** Base URL for all requests, without a trailing slash. */
    private final String baseUrl;

    /** Timeout applied to each request. */
    private final Duration requestTimeout;

    /**
     * Constructs a client with default timeouts and no global headers.
     *
     * @param baseUrl the base URL for all requests
     */
    public LoadHttpClient(String baseUrl) {
        this(baseUrl, DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT, Map.of());
    }

    /**
     * Constructs a client.
     *
     * @param baseUrl the base URL for all requests
     * @param connectTimeout connection timeout
     * @param requestTimeout per-request timeout
     * @param headers global headers to include in all requests
     */
    public LoadHttpClient(
            String baseUrl,
            Duration connectTimeout,
            Duration requestTimeout,
            Map<String, String> headers) {

        this.baseUrl = validateAndNormalizeBaseUrl(baseUrl);
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "Request timeout cannot be null");

        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Objects.requireNonNull(connectTimeout, "Connect timeout cannot be null"))
                .build();

        this.headers = headers != null ? Map.copyOf(headers) : Map.of();

        log.info(
                "LoadHttpClient initialised - Base URL: {}, Connection timeout: {}ms, Request timeout: {}ms",
                this.baseUrl,
                connectTimeout.toMillis(),
                requestTimeout.toMillis());
    }

    @Override
    public RestResponseData issue(String path, RequestOptions options) {
        Objects.requireNonNull(path, "Path cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");

        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(path, options);
        } catch (IllegalArgumentException e) {
            log.debug("GET {}{} could not be built: {}", baseUrl, path, e.getMessage());
            throw new RequestExecutionException("Invalid request URI for path " + path + ": " + e.getMessage(), e);
        }
        var startTime = System.nanoTime();
        try {
            var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            var elapsed = Duration.ofNanos(System.nanoTime() - startTime);

            log.trace("GET {} completed in {} ms with status {}",
                    httpRequest.uri(), elapsed.toMillis(), response.statusCode());
            return buildResponseData(response, elapsed);

        } catch (HttpTimeoutException e) {
            log.debug("GET {} timed out after {} ms", httpRequest.uri(), requestTimeout.toMillis());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestExecutionException("Interrupted while requesting " + httpRequest.uri(), e);
        } catch (IOException e) {
            log.debug("GET {} failed: {}", httpRequest.uri(), e.toString());
            throw new RequestExecutionException(
                    "Error executing request to " + httpRequest.uri() + ": " + e.getMessage(), e);
        }
    }

    /** Base URL this client sends requests to. */
    public String baseUrl() {
        return baseUrl;
    }

    /**
     * Builds a GET request for the given path and options.
     *
     * @param path the relative path
     * @param options headers and query parameters
     * @return the constructed HttpRequest
     */
    private HttpRequest buildHttpRequest(String path, RequestOptions options) {
        var url = baseUrl + (path.startsWith("/") ? path : "/" + path);
        if (!options.getQuery().isEmpty()) {
            url += "?" + buildQueryString(options.getQuery());
        }

        var requestBuilder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .GET();

        // global headers
        headers.forEach(requestBuilder::header);

        // request-specific headers override
        options.getHeaders().forEach(requestBuilder::setHeader);

        return requestBuilder.build();
    }

    /**
     * Builds a RestResponseData object from the HTTP response.
     *
     * @param response the HTTP response
     * @param elapsed time from sending the request to receiving the full body
     * @return the constructed RestResponseData
     */
    private RestResponseData buildResponseData(HttpResponse<String> response, Duration elapsed) {
        var result = new RestResponseData();
        result.setUri(response.uri());
        result.setStatusCode(response.statusCode());
        result.setHeaders(
                response.headers().map().entrySet().stream()
                        .collect(Collectors.toMap(Map.Entry::getKey, e -> String.join(",", e.getValue()))));
        result.setBody(response.body());
        result.setElapsed(elapsed);
        return result;
    }

    private String buildQueryString(Map<String, String> query) {
        return query.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Validates and normalizes the base URL.
     *
     * @param baseUrl the base URL to validate
     * @return the normalized base URL
     * @throws IllegalArgumentException if the base URL is empty
     */
    private String validateAndNormalizeBaseUrl(String baseUrl) {
        Objects.requireNonNull(baseUrl, "Base URL cannot be null");
        var trimmed = baseUrl.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Base URL cannot be empty");
        }
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    /**
     * Ends the lifecycle of this issuer. On JDK 17 {@link HttpClient} has no close operation; its
     * pooled connections are released once the client becomes unreachable.
     */
    @Override
    public void close() {
        log.debug("LoadHttpClient for {} closed", baseUrl);
    }
}
