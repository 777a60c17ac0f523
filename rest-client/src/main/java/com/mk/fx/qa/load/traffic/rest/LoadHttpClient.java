package com.mk.fx.qa.load.traffic.rest;

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
 * Blocking HTTP client used by the workload clients. One instance is shared by every worker of a
 * run; the underlying {@link HttpClient} is thread-safe. This implementation does not include
 * retry logic: every failure surfaces to the caller as a {@link TransportException}.
 */
@Slf4j
public class LoadHttpClient implements AutoCloseable {

    /** Default connection timeout. */
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    /** Default request timeout. */
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    /** The underlying Java HTTP client. */
    private final HttpClient httpClient;

    /** Global headers to be included in all requests. */
    private final Map<String, String> headers;

    /** Base URL for all requests. */
    private final String baseUrl;

    /** Timeout duration for requests. */
    private final Duration requestTimeout;

    public LoadHttpClient(String baseUrl) {
        this(baseUrl, DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT, Map.of());
    }

    /**
     * Constructs a client with explicit timeouts.
     *
     * @param baseUrl the base URL for all requests, e.g. {@code http://127.0.0.1:8080}
     * @param connectTimeout connection timeout
     * @param requestTimeout request timeout, applied to every request
     * @param headers global headers to include in all requests
     */
    public LoadHttpClient(
            String baseUrl,
            Duration connectTimeout,
            Duration requestTimeout,
            Map<String, String> headers) {

        this.baseUrl = validateAndNormalizeBaseUrl(baseUrl);
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout"))
                .build();

        this.headers = headers != null ? Map.copyOf(headers) : Map.of();

        log.info(
                "LoadHttpClient initialised - Base URL: {}, Connection timeout: {}, Request timeout: {}",
                this.baseUrl,
                connectTimeout,
                requestTimeout);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Executes a synchronous request.
     *
     * @param request the request to execute
     * @return the response data; non-2xx statuses are returned, not thrown
     * @throws TransportException if the request could not be built, sent or answered
     */
    public RestResponseData execute(Request request) {
        Objects.requireNonNull(request, "Request cannot be null");

        var httpRequest = buildHttpRequest(request);
        try {
            var startTime = System.nanoTime();

            log.debug("Executing {} request to {}", request.getMethod(), httpRequest.uri());

            var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
            var duration = (System.nanoTime() - startTime) / 1_000_000;

            log.debug("Request completed in {} ms with status {}", duration, response.statusCode());
            return buildResponseData(response, duration);

        } catch (HttpTimeoutException e) {
            log.debug("Request timed out after {}: {}", requestTimeout, e.getMessage());
            throw new TransportException("request timed out after " + requestTimeout + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("request interrupted: " + httpRequest.uri(), e);
        } catch (IOException e) {
            log.debug("Error executing request to {}: {}", httpRequest.uri(), e.toString());
            throw new TransportException(describe(e), e);
        }
    }

    /**
     * Builds an HTTP request from the given Request.
     *
     * @throws TransportException if the URI is malformed or the body cannot be serialized
     */
    private HttpRequest buildHttpRequest(Request request) {
        Objects.requireNonNull(request.getMethod(), "Request method cannot be null");
        try {
            var path = request.getPath() != null ? request.getPath() : "";
            if (!path.isEmpty() && !path.startsWith("/")) {
                path = "/" + path;
            }
            var requestBuilder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(requestTimeout);

            // global headers
            headers.forEach(requestBuilder::header);

            var method = request.getMethod().name();
            if (request.getMultipart() != null) {
                requestBuilder
                        .method(method, HttpRequest.BodyPublishers.ofByteArray(request.getMultipart().toByteArray()))
                        .header("Content-Type", request.getMultipart().contentType());
            } else if (request.getForm() != null) {
                requestBuilder
                        .method(method, HttpRequest.BodyPublishers.ofString(encodeForm(request.getForm())))
                        .header("Content-Type", "application/x-www-form-urlencoded");
            } else {
                requestBuilder.method(method, HttpRequest.BodyPublishers.noBody());
            }

            // request-specific headers override
            if (request.getHeaders() != null) {
                request.getHeaders().forEach(requestBuilder::setHeader);
            }

            return requestBuilder.build();

        } catch (IllegalArgumentException e) {
            throw new TransportException("Error building HTTP request: " + e.getMessage(), e);
        }
    }

    private RestResponseData buildResponseData(HttpResponse<byte[]> response, long durationMs) {
        var result = new RestResponseData();
        result.setStatusCode(response.statusCode());
        result.setHeaders(
                response.headers().map().entrySet().stream()
                        .collect(Collectors.toMap(Map.Entry::getKey, e -> String.join(",", e.getValue()))));
        result.setBody(response.body());
        result.setResponseTimeMs(durationMs);
        return result;
    }

    private static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
                .filter(e -> e.getKey() != null)
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
        return value != null ? URLEncoder.encode(value, StandardCharsets.UTF_8) : "";
    }

    /** Connection failures from the JDK client often carry no message; fall back to the type. */
    private static String describe(IOException e) {
        var message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }

    private String validateAndNormalizeBaseUrl(String baseUrl) {
        Objects.requireNonNull(baseUrl, "Base URL cannot be null");
        var trimmed = baseUrl.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Base URL cannot be empty");
        }
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    @Override
    public void close() {
        // HttpClient only gained close() in JDK 21; connections are released with the client.
        log.debug("LoadHttpClient for {} closed", baseUrl);
    }
}
