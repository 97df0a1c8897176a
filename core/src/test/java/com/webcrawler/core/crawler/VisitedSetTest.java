package com.webcrawler.core.crawler;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class VisitedSetTest {

    @Test
    void claim_succeeds_once() {
        VisitedSet v = new VisitedSet();
        URI u = URI.create("http://example.com/");
        assertFalse(v.contains(u));
        assertTrue(v.tryClaim(u));
        assertFalse(v.tryClaim(u));
        assertTrue(v.contains(u));
        assertEquals(1, v.size());
    }

    @Test
    void concurrent_claims_have_exactly_one_winner() throws Exception {
        final int THREADS = 16;
        VisitedSet v = new VisitedSet();
        URI u = URI.create("http://example.com/hot");
        AtomicInteger winners = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);

        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        try {
            for (int i = 0; i < THREADS; i++) {
                pool.submit(() -> {
                    start.await();
                    if (v.tryClaim(u)) winners.incrementAndGet();
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }
        assertEquals(1, winners.get());
    }
}
