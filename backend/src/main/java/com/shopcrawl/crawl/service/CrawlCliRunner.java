package com.shopcrawl.crawl.service;

import com.shopcrawl.config.CrawlerProperties;
import com.shopcrawl.crawl.model.CrawlJobView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Component
@Order(1)
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);
    private static final long POLL_INTERVAL_MS = 1000;

    private final CrawlerProperties properties;
    private final CrawlJobService jobService;
    private final CrawlWorkerPool workerPool;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        CrawlJobService jobService,
        CrawlWorkerPool workerPool,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.jobService = jobService;
        this.workerPool = workerPool;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        List<String> domains = Arrays.stream(properties.getCli().getDomains().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
        if (domains.isEmpty()) {
            log.warn("crawler.cli.run is set but crawler.cli.domains is empty; nothing to crawl");
            return;
        }
        if (!workerPool.getStatus().running()) {
            workerPool.start();
        }

        String jobId = jobService.startJob(domains, properties.getCli().getMaxDepth());
        CrawlJobView view = awaitTerminal(jobId, Duration.ofSeconds(properties.getCli().getWaitTimeoutSeconds()));
        if (!view.status().isTerminal()) {
            log.warn("Crawl job {} still running after {}s", jobId, properties.getCli().getWaitTimeoutSeconds());
        }
        log.info(
            "Crawl job {} finished with status {}: claimed={}, succeeded={}, failed={}, pending={}",
            view.jobId(),
            view.status(),
            view.urlsClaimed(),
            view.succeeded(),
            view.failed(),
            view.frontier().live()
        );

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    private CrawlJobView awaitTerminal(String jobId, Duration timeout) {
        Instant deadline = Instant.now().plus(timeout);
        CrawlJobView view = jobService.getJob(jobId);
        while (!view.status().isTerminal() && Instant.now().isBefore(deadline)) {
            try {
                TimeUnit.MILLISECONDS.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            view = jobService.getJob(jobId);
        }
        return view;
    }
}
