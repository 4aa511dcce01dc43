package com.shopcrawl.crawl.service;

import com.shopcrawl.config.CrawlerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FrontierServiceRetryPolicyTest {

    private FrontierService frontierService;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setMaxRetries(2);
        properties.setRetryBackoffBaseMs(1000);
        properties.setRetryBackoffMaxMs(5000);
        frontierService = new FrontierService(null, null, null, null, null, properties, null, Clock.systemUTC());
    }

    @Test
    void retriesUntilAttemptsExceedMaxRetries() {
        assertTrue(frontierService.willRetry(1, true));
        assertTrue(frontierService.willRetry(2, true));
        assertFalse(frontierService.willRetry(3, true));
        assertFalse(frontierService.willRetry(1, false));
    }

    @Test
    void backoffDoublesUpToCeiling() {
        assertEquals(1000, frontierService.backoffDelayMs(1));
        assertEquals(2000, frontierService.backoffDelayMs(2));
        assertEquals(4000, frontierService.backoffDelayMs(3));
        assertEquals(5000, frontierService.backoffDelayMs(4));
        assertEquals(5000, frontierService.backoffDelayMs(200));
    }

    @Test
    void rotationResumesAfterLastServedDomain() {
        List<String> domains = List.of("a.test", "b.test", "c.test");

        assertEquals(List.of("c.test", "a.test", "b.test"), FrontierService.rotate(domains, "b.test"));
        assertEquals(List.of("a.test", "b.test", "c.test"), FrontierService.rotate(domains, "c.test"));
        assertEquals(List.of("b.test", "c.test", "a.test"), FrontierService.rotate(domains, "b-old.test"));
        assertEquals(domains, FrontierService.rotate(domains, null));
    }
}
