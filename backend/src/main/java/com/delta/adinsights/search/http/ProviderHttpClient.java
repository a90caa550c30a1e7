package com.delta.adinsights.search.http;

import com.delta.adinsights.config.SearchProperties;
import com.delta.adinsights.search.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;

/**
 * Single-shot HTTP transport towards the ad provider. Each call performs exactly one exchange;
 * retries are left to whoever sits in front of the provider.
 */
@Service
public class ProviderHttpClient {
    private static final Logger log = LoggerFactory.getLogger(ProviderHttpClient.class);

    private final SearchProperties properties;
    private final HttpClient client;

    public ProviderHttpClient(
        SearchProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url, int timeoutSeconds) {
        return send(url, "GET", null, timeoutSeconds);
    }

    public HttpFetchResult postJson(String url, String jsonBody, int timeoutSeconds) {
        return send(url, "POST", jsonBody == null ? "" : jsonBody, timeoutSeconds);
    }

    private HttpFetchResult send(String url, String method, String body, int timeoutSeconds) {
        Instant startedAt = Instant.now();
        URI uri = uriFor(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
            .header("User-Agent", SearchProperties.normalizeUserAgent(properties.getUserAgent()))
            .header("Accept", "application/json");
        HttpRequest request;
        if ("POST".equalsIgnoreCase(method)) {
            request = builder
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        } else {
            request = builder.GET().build();
        }

        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            HttpFetchResult result = new HttpFetchResult(
                url,
                response.statusCode(),
                responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
            log.debug("{} {} -> {} in {} ms", method, url, result.statusCode(), result.duration().toMillis());
            return result;
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        log.debug("Provider call to {} failed: {} {}", url, code, message);
        return new HttpFetchResult(
            url,
            0,
            null,
            null,
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI uriFor(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
