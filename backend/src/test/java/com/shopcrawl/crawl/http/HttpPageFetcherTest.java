package com.shopcrawl.crawl.http;

import static org.assertj.core.api.Assertions.assertThat;

import com.shopcrawl.config.CrawlerProperties;
import com.shopcrawl.crawl.model.HttpFetchResult;
import com.shopcrawl.crawl.util.FetchErrorClassifier;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpPageFetcherTest {
  private MockWebServer server;
  private ExecutorService executor;
  private CrawlerProperties properties;
  private HttpPageFetcher fetcher;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();

    properties = new CrawlerProperties();
    properties.setRequestTimeoutSeconds(5);
    properties.setMaxBodyBytes(2048);
    properties.setUserAgent("shop-crawler-test/1.0");

    executor = Executors.newFixedThreadPool(2);
    fetcher = new HttpPageFetcher(properties, executor);
  }

  @AfterEach
  void tearDown() throws Exception {
    if (server != null) {
      server.shutdown();
    }
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  @Test
  void returnsBodyAndContentTypeOnSuccess() throws Exception {
    server.enqueue(new MockResponse()
        .setResponseCode(200)
        .setHeader("Content-Type", "text/html; charset=utf-8")
        .setBody("<html><a href=\"/p/1\">one</a></html>"));

    HttpFetchResult result = fetcher.fetch(server.url("/catalog").toString());

    assertThat(result.isSuccessful()).isTrue();
    assertThat(result.statusCode()).isEqualTo(200);
    assertThat(result.body()).contains("/p/1");
    assertThat(result.contentType()).startsWith("text/html");
    assertThat(result.errorCode()).isNull();

    RecordedRequest request = server.takeRequest();
    assertThat(request.getHeader("User-Agent")).isEqualTo("shop-crawler-test/1.0");
  }

  @Test
  void serverErrorIsNotSuccessfulAndKeepsStatus() {
    server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));

    HttpFetchResult result = fetcher.fetch(server.url("/busy").toString());

    assertThat(result.isSuccessful()).isFalse();
    assertThat(result.statusCode()).isEqualTo(503);
    assertThat(result.httpStatusOrNull()).isEqualTo(503);
    assertThat(server.getRequestCount()).isEqualTo(1);
  }

  @Test
  void returnsBodyTooLargeWhenResponseExceedsMaxBytes() {
    server.enqueue(new MockResponse().setResponseCode(200).setBody("a".repeat(5000)));

    HttpFetchResult result = fetcher.fetch(server.url("/big").toString());

    assertThat(result.errorCode()).isEqualTo("body_too_large");
    assertThat(result.body()).isNull();
    assertThat(result.isSuccessful()).isFalse();
  }

  @Test
  void malformedUrlFailsWithoutRequest() {
    HttpFetchResult result = fetcher.fetch("ftp://shop.example/file");

    assertThat(result.errorCode()).isEqualTo("invalid_url");
    assertThat(result.statusCode()).isZero();
    assertThat(server.getRequestCount()).isZero();
  }

  @Test
  void oversizeErrorBodyKeepsTheStatusClass() {
    server.enqueue(new MockResponse().setResponseCode(503).setBody("b".repeat(10_000)));

    HttpFetchResult result = fetcher.fetch(server.url("/busy-big").toString());

    assertThat(result.statusCode()).isEqualTo(503);
    assertThat(result.errorCode()).isNull();
    assertThat(result.body()).isNull();
    String errorClass = FetchErrorClassifier.classify(result);
    assertThat(errorClass).isEqualTo(FetchErrorClassifier.HTTP_5XX);
    assertThat(FetchErrorClassifier.isRetryable(errorClass)).isTrue();
  }

  @Test
  void slowBodyIsCutOffAtTheRequestTimeout() {
    properties.setRequestTimeoutSeconds(1);
    fetcher = new HttpPageFetcher(properties, executor);
    server.enqueue(new MockResponse()
        .setResponseCode(200)
        .setHeader("Content-Type", "text/html")
        .setBody("<html>" + "x".repeat(1000) + "</html>")
        .throttleBody(16, 1, TimeUnit.SECONDS));

    long started = System.nanoTime();
    HttpFetchResult result = fetcher.fetch(server.url("/slow").toString());
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

    assertThat(result.errorCode()).isEqualTo("timeout");
    assertThat(result.isSuccessful()).isFalse();
    assertThat(FetchErrorClassifier.classify(result)).isEqualTo(FetchErrorClassifier.TIMEOUT);
    assertThat(elapsedMs).isLessThan(5_000);
  }

  @Test
  void cappedSubscriberStopsPastLimit() throws Exception {
    HttpPageFetcher.CappedBodySubscriber small = new HttpPageFetcher.CappedBodySubscriber(10);
    small.onSubscribe(new NoopSubscription());
    small.onNext(List.of(ByteBuffer.wrap("hello".getBytes(StandardCharsets.UTF_8))));
    small.onComplete();

    NoopSubscription bigSubscription = new NoopSubscription();
    HttpPageFetcher.CappedBodySubscriber big = new HttpPageFetcher.CappedBodySubscriber(10);
    big.onSubscribe(bigSubscription);
    big.onNext(List.of(ByteBuffer.wrap(new byte[6]), ByteBuffer.wrap(new byte[6])));
    big.onComplete();

    assertThat(small.getBody().toCompletableFuture().get()).hasSize(5);
    assertThat(big.getBody().toCompletableFuture().get()).isNull();
    assertThat(bigSubscription.cancelled).isTrue();
  }

  @Test
  void charsetFallsBackToUtf8() {
    assertThat(HttpPageFetcher.charsetOf("text/html; charset=ISO-8859-1"))
        .isEqualTo(StandardCharsets.ISO_8859_1);
    assertThat(HttpPageFetcher.charsetOf("text/html; charset=bogus-charset")).isEqualTo(StandardCharsets.UTF_8);
    assertThat(HttpPageFetcher.charsetOf(null)).isEqualTo(StandardCharsets.UTF_8);
  }

  private static final class NoopSubscription implements Flow.Subscription {
    private boolean cancelled;

    @Override
    public void request(long n) {}

    @Override
    public void cancel() {
      cancelled = true;
    }
  }
}
