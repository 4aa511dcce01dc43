package com.shopcrawl.crawl.service;

import com.shopcrawl.crawl.model.CrawlResult;
import com.shopcrawl.crawl.model.CrawlResultStatus;
import com.shopcrawl.crawl.persistence.CrawlResultRepository;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;

/**
 * Per-URL outcomes. Recording is keyed by (job, URL) so a retried or re-delivered report
 * leaves a single row.
 */
@Service
public class CrawlResultSink {
    private static final Logger log = LoggerFactory.getLogger(CrawlResultSink.class);
    private static final String[] CSV_HEADER = {
        "url", "domain", "depth", "status", "http_status", "error_class", "links_found", "fetch_duration_ms", "attempt"
    };

    private final CrawlResultRepository repository;

    public CrawlResultSink(CrawlResultRepository repository) {
        this.repository = repository;
    }

    public void record(CrawlResult result) {
        StoreGuard.run("result record", () -> repository.upsert(result));
        log.debug(
            "Recorded {} for {} (job={}, depth={}, links={})",
            result.status(),
            result.url(),
            result.jobId(),
            result.depth(),
            result.links().size()
        );
    }

    public List<CrawlResult> findResults(String jobId, CrawlResultStatus status, String domain, int limit) {
        return StoreGuard.call("result lookup", () -> repository.findResults(jobId, status, domain, limit));
    }

    public Map<CrawlResultStatus, Long> countByStatus(String jobId) {
        return StoreGuard.call("result count", () -> repository.countByStatus(jobId));
    }

    public int writeCsv(String jobId, CrawlResultStatus status, String domain, int limit, Writer writer)
        throws IOException {
        List<CrawlResult> results = findResults(jobId, status, domain, limit);
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(CSV_HEADER)
            .build();
        CSVPrinter printer = new CSVPrinter(writer, format);
        for (CrawlResult result : results) {
            printer.printRecord(
                result.url(),
                result.domain(),
                result.depth(),
                result.status().name(),
                result.httpStatus(),
                result.errorClass(),
                result.links().size(),
                result.fetchDurationMs(),
                result.attempt()
            );
        }
        // the writer belongs to the caller
        printer.flush();
        return results.size();
    }
}
