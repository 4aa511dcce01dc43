package com.shopcrawl.crawl.api;

import com.shopcrawl.crawl.model.WorkerPoolStatusResponse;
import com.shopcrawl.crawl.service.CrawlWorkerPool;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/workers")
public class CrawlWorkerController {
    private final CrawlWorkerPool workerPool;

    public CrawlWorkerController(CrawlWorkerPool workerPool) {
        this.workerPool = workerPool;
    }

    @PostMapping("/start")
    public WorkerPoolStatusResponse start() {
        workerPool.start();
        return workerPool.getStatus();
    }

    @PostMapping("/stop")
    public WorkerPoolStatusResponse stop() {
        workerPool.stop();
        return workerPool.getStatus();
    }

    @GetMapping("/status")
    public WorkerPoolStatusResponse status() {
        return workerPool.getStatus();
    }
}
