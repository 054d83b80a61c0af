package com.schedulinglinks.aggregator.crawl.http;

import com.schedulinglinks.aggregator.config.CrawlerProperties;
import com.schedulinglinks.aggregator.crawl.model.HttpFetchResult;
import com.schedulinglinks.aggregator.crawl.util.UrlUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class PoliteHttpClient {
    public static final String TIMEOUT = "timeout";
    public static final String IO_ERROR = "io_error";
    public static final String INVALID_URL = "invalid_url";
    public static final String INTERRUPTED = "interrupted";
    public static final String HTTP_ERROR = "http_error";

    private final CrawlerProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, Semaphore> hostLimiters = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        CrawlerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(Math.max(1, properties.getGlobalConcurrency() * 2));
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, Map.of(), null);
    }

    public HttpFetchResult get(String url, String acceptHeader, Map<String, String> extraHeaders, String userAgent) {
        Instant startedAt = Instant.now();
        URI uri = UrlUtils.parseHttpUrl(url);
        if (uri == null) {
            return errorResult(url, startedAt, INVALID_URL, "URL missing host, scheme or malformed");
        }

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        boolean acquired = false;
        boolean hostAcquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            Semaphore hostLimiter = hostLimiters.computeIfAbsent(
                host,
                ignored -> new Semaphore(properties.getPerHostConcurrency())
            );
            hostLimiter.acquire();
            hostAcquired = true;

            String safeUserAgent = CrawlerProperties.normalizeUserAgent(
                userAgent == null || userAgent.isBlank() ? properties.getUserAgent() : userAgent
            );
            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", safeUserAgent)
                .header("Accept", safeAccept);
            if (extraHeaders != null) {
                extraHeaders.forEach((name, value) -> {
                    if (value != null && !value.isBlank()) {
                        builder.header(name, value);
                    }
                });
            }
            HttpRequest request = builder.GET().build();

            // HttpRequest.timeout only covers the response headers; the deadline must include the body.
            CompletableFuture<HttpResponse<byte[]>> pending =
                client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
            HttpResponse<byte[]> response;
            try {
                response = pending.get(properties.getRequestTimeoutSeconds(), TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                pending.cancel(true);
                return errorResult(url, startedAt, TIMEOUT, "No complete response within " + properties.getRequestTimeoutSeconds() + "s");
            } catch (InterruptedException e) {
                pending.cancel(true);
                throw e;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (cause instanceof HttpTimeoutException) {
                    return errorResult(url, startedAt, TIMEOUT, cause.getMessage());
                }
                if (cause instanceof IOException) {
                    return errorResult(url, startedAt, IO_ERROR, cause.getMessage());
                }
                return errorResult(url, startedAt, HTTP_ERROR, cause.getMessage());
            }
            byte[] responseBytes = response.body();
            String responseBody = responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8);
            HttpHeaders headers = response.headers();
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBody,
                headers.firstValue("ETag").orElse(null),
                headers.firstValue("Expires").orElse(null),
                joined(headers.allValues("Cache-Control")),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, INTERRUPTED, e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, HTTP_ERROR, e.getMessage());
        } finally {
            if (hostAcquired) {
                Semaphore hostLimiter = hostLimiters.get(host);
                if (hostLimiter != null) {
                    hostLimiter.release();
                }
            }
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private String joined(List<String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        return String.join(", ", values);
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }
}
