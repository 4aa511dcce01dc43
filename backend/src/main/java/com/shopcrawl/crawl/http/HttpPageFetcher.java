package com.shopcrawl.crawl.http;

import com.shopcrawl.config.CrawlerProperties;
import com.shopcrawl.crawl.model.HttpFetchResult;
import com.shopcrawl.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-shot GET. The request timeout bounds the whole exchange, body included; only 2xx
 * bodies are read, up to {@code maxBodyBytes}. Retries, spacing and concurrency are
 * the frontier's business, so none of that happens here.
 */
@Service
public class HttpPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpPageFetcher.class);
    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5";

    private final CrawlerProperties properties;
    private final HttpClient client;

    public HttpPageFetcher(CrawlerProperties properties, @Qualifier("fetchExecutor") ExecutorService fetchExecutor) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(fetchExecutor)
            .build();
    }

    @Override
    public HttpFetchResult fetch(String url) {
        Instant startedAt = Instant.now();
        URI uri = UrlNormalizer.safeUri(url);
        if (uri == null || uri.getHost() == null || !isHttp(uri)) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        int timeoutSeconds = properties.getRequestTimeoutSeconds();
        int maxBytes = properties.getMaxBodyBytes();
        CompletableFuture<HttpResponse<byte[]>> exchange = null;
        try {
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", ACCEPT_HTML)
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();
            HttpResponse.BodyHandler<byte[]> bodyHandler = info -> isSuccessStatus(info.statusCode())
                ? new CappedBodySubscriber(maxBytes)
                : HttpResponse.BodySubscribers.<byte[]>replacing(null);
            exchange = client.sendAsync(request, bodyHandler);
            // one deadline for headers and body
            HttpResponse<byte[]> response = exchange.get(timeoutSeconds, TimeUnit.SECONDS);
            String contentType = response.headers().firstValue("Content-Type").orElse(null);
            if (!isSuccessStatus(response.statusCode())) {
                return new HttpFetchResult(
                    url,
                    response.uri(),
                    response.statusCode(),
                    null,
                    contentType,
                    Instant.now(),
                    Duration.between(startedAt, Instant.now()),
                    null,
                    null
                );
            }
            byte[] bytes = response.body();
            if (bytes == null) {
                return new HttpFetchResult(
                    url,
                    response.uri(),
                    response.statusCode(),
                    null,
                    contentType,
                    Instant.now(),
                    Duration.between(startedAt, Instant.now()),
                    "body_too_large",
                    "Response exceeded " + maxBytes + " bytes"
                );
            }
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                new String(bytes, charsetOf(contentType)),
                contentType,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (TimeoutException e) {
            exchange.cancel(true);
            return errorResult(url, startedAt, "timeout", "No complete response within " + timeoutSeconds + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                return errorResult(url, startedAt, "timeout", cause.getMessage());
            }
            if (cause instanceof IOException) {
                return errorResult(url, startedAt, "io_error", describe(cause));
            }
            log.debug("Unexpected fetch failure for {}", url, cause);
            return errorResult(url, startedAt, "http_error", describe(cause));
        } catch (InterruptedException e) {
            if (exchange != null) {
                exchange.cancel(true);
            }
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_url", e.getMessage());
        } catch (RuntimeException e) {
            log.debug("Unexpected fetch failure for {}", url, e);
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    /**
     * Collects the body up to {@code maxBytes}. Completes with null and cancels the
     * subscription once the body grows past the cap.
     */
    static final class CappedBodySubscriber implements HttpResponse.BodySubscriber<byte[]> {
        private final int maxBytes;
        private final CompletableFuture<byte[]> body = new CompletableFuture<>();
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        private Flow.Subscription subscription;

        CappedBodySubscriber(int maxBytes) {
            this.maxBytes = maxBytes;
        }

        @Override
        public CompletionStage<byte[]> getBody() {
            return body;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(List<ByteBuffer> buffers) {
            if (body.isDone()) {
                return;
            }
            for (ByteBuffer buffer : buffers) {
                int size = buffer.remaining();
                if (out.size() + size > maxBytes) {
                    body.complete(null);
                    subscription.cancel();
                    return;
                }
                byte[] chunk = new byte[size];
                buffer.get(chunk);
                out.write(chunk, 0, size);
            }
        }

        @Override
        public void onError(Throwable throwable) {
            body.completeExceptionally(throwable);
        }

        @Override
        public void onComplete() {
            body.complete(out.toByteArray());
        }
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static boolean isHttp(URI uri) {
        String scheme = uri.getScheme();
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    private static boolean isSuccessStatus(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        String type = e.getClass().getName();
        return message == null ? type : type + ": " + message;
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }
}
