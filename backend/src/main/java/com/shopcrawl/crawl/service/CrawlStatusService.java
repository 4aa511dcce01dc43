package com.shopcrawl.crawl.service;

import com.shopcrawl.crawl.model.StatusResponse;
import com.shopcrawl.crawl.persistence.CrawlJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class CrawlStatusService {
    private static final Logger log = LoggerFactory.getLogger(CrawlStatusService.class);

    private final CrawlJobRepository repository;
    private final CrawlWorkerPool workerPool;

    public CrawlStatusService(CrawlJobRepository repository, CrawlWorkerPool workerPool) {
        this.repository = repository;
        this.workerPool = workerPool;
    }

    public StatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            log.warn("Database connectivity check failed", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            return new StatusResponse(false, new LinkedHashMap<>(), workerPool.getStatus());
        }
        Map<String, Long> counts = repository.tableCounts();
        return new StatusResponse(true, counts, workerPool.getStatus());
    }
}
