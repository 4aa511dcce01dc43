package com.shopcrawl.crawl.support;

import com.shopcrawl.crawl.http.PageFetcher;
import com.shopcrawl.crawl.model.HttpFetchResult;
import com.shopcrawl.crawl.util.UrlNormalizer;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory site. Pages are keyed by normalized URL; unknown URLs answer 404.
 */
public class FakePageFetcher implements PageFetcher {
    private final Map<String, Deque<HttpFetchResult>> scripted = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();

    public FakePageFetcher page(String url, String... links) {
        StringBuilder html = new StringBuilder("<html><body>");
        for (String link : links) {
            html.append("<a href=\"").append(link).append("\">link</a>");
        }
        html.append("</body></html>");
        return respond(url, ok(url, html.toString()));
    }

    public FakePageFetcher status(String url, int statusCode) {
        return respond(url, result(url, statusCode, "", "text/html", null, null));
    }

    /**
     * Responses are served in order; the last one repeats.
     */
    public FakePageFetcher respond(String url, HttpFetchResult... responses) {
        scripted.put(UrlNormalizer.normalize(url), new ArrayDeque<>(List.of(responses)));
        return this;
    }

    public int fetchCount(String url) {
        AtomicInteger count = fetchCounts.get(UrlNormalizer.normalize(url));
        return count == null ? 0 : count.get();
    }

    public Map<String, AtomicInteger> fetchCounts() {
        return fetchCounts;
    }

    @Override
    public HttpFetchResult fetch(String url) {
        String key = UrlNormalizer.normalize(url);
        fetchCounts.computeIfAbsent(key, ignored -> new AtomicInteger()).incrementAndGet();
        Deque<HttpFetchResult> responses = scripted.get(key);
        if (responses == null) {
            return result(url, 404, "", "text/html", null, null);
        }
        synchronized (responses) {
            return responses.size() > 1 ? responses.poll() : responses.peek();
        }
    }

    public static HttpFetchResult ok(String url, String html) {
        return result(url, 200, html, "text/html; charset=utf-8", null, null);
    }

    public static HttpFetchResult result(
        String url,
        int statusCode,
        String body,
        String contentType,
        String errorCode,
        String errorMessage
    ) {
        return new HttpFetchResult(
            url,
            URI.create(url),
            statusCode,
            body,
            contentType,
            Instant.now(),
            Duration.ofMillis(5),
            errorCode,
            errorMessage
        );
    }
}
