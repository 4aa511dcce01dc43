package com.shopcrawl.crawl.api;

import com.shopcrawl.crawl.model.CrawlJobStatus;
import com.shopcrawl.crawl.model.CrawlJobView;
import com.shopcrawl.crawl.model.CrawlResult;
import com.shopcrawl.crawl.model.CrawlResultStatus;
import com.shopcrawl.crawl.model.CrawlStartResponse;
import com.shopcrawl.crawl.model.StatusResponse;
import com.shopcrawl.crawl.service.CrawlJobService;
import com.shopcrawl.crawl.service.CrawlResultSink;
import com.shopcrawl.crawl.service.CrawlStatusService;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api")
public class CrawlController {
    private static final int DEFAULT_RESULT_LIMIT = 200;
    private static final int CSV_RESULT_LIMIT = 5000;

    private final CrawlJobService jobService;
    private final CrawlResultSink resultSink;
    private final CrawlStatusService statusService;

    public CrawlController(
        CrawlJobService jobService,
        CrawlResultSink resultSink,
        CrawlStatusService statusService
    ) {
        this.jobService = jobService;
        this.resultSink = resultSink;
        this.statusService = statusService;
    }

    @PostMapping("/crawls")
    public CrawlStartResponse startCrawl(@RequestBody CrawlApiStartRequest request) {
        String jobId = jobService.startJob(request.domains(), request.maxDepth());
        CrawlJobStatus status = jobService.getJob(jobId).status();
        return new CrawlStartResponse(jobId, status);
    }

    @GetMapping("/crawls")
    public List<CrawlJobView> listCrawls(@RequestParam(name = "limit", required = false) Integer limit) {
        return jobService.listJobs(limit);
    }

    @GetMapping("/crawls/{jobId}")
    public CrawlJobView getCrawl(@PathVariable("jobId") String jobId) {
        return jobService.getJob(jobId);
    }

    @PostMapping("/crawls/{jobId}/cancel")
    public CrawlJobView cancelCrawl(@PathVariable("jobId") String jobId) {
        return jobService.cancelJob(jobId);
    }

    @GetMapping("/crawls/{jobId}/results")
    public List<CrawlResult> getResults(
        @PathVariable("jobId") String jobId,
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "domain", required = false) String domain,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        jobService.getJob(jobId);
        int safeLimit = limit == null ? DEFAULT_RESULT_LIMIT : Math.max(1, limit);
        return resultSink.findResults(jobId, parseStatus(status), domain, safeLimit);
    }

    @GetMapping("/crawls/{jobId}/results.csv")
    public void exportResults(
        @PathVariable("jobId") String jobId,
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "domain", required = false) String domain,
        HttpServletResponse response
    ) throws IOException {
        jobService.getJob(jobId);
        CrawlResultStatus resultStatus = parseStatus(status);
        response.setContentType("text/csv");
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setHeader("Content-Disposition", "attachment; filename=\"crawl-" + jobId + ".csv\"");
        resultSink.writeCsv(jobId, resultStatus, domain, CSV_RESULT_LIMIT, response.getWriter());
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return statusService.getStatus();
    }

    private static CrawlResultStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return CrawlResultStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("status must be SUCCESS or FAILURE, got: " + status);
        }
    }
}
