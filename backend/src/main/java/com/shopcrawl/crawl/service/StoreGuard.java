package com.shopcrawl.crawl.service;

import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.util.function.Supplier;

final class StoreGuard {
    private StoreGuard() {
    }

    static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            throw new CrawlStoreException(operation + " failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    static void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
