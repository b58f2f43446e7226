package com.restaurantbi.insightflow.domain.run;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionTableTest {

    @Test
    void testExactlyOneConcurrentAdmissionWins() throws Exception {
        AdmissionTable table = new AdmissionTable();
        int contenders = 16;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        try {
            for (int i = 0; i < contenders; i++) {
                String runId = "run-" + i;
                pool.submit(() -> {
                    start.await();
                    if (table.tryAdmit("daily-ingest", "2024-05-01", runId).isEmpty()) {
                        admitted.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, admitted.get());
        assertEquals(1, table.size());
    }

    @Test
    void testReleaseOnlyByOwner() {
        AdmissionTable table = new AdmissionTable();
        assertTrue(table.tryAdmit("p", "k", "run-1").isEmpty());
        assertEquals(Optional.of("run-1"), table.tryAdmit("p", "k", "run-2"));

        assertFalse(table.release("p", "k", "run-2"));
        assertTrue(table.release("p", "k", "run-1"));
        assertTrue(table.tryAdmit("p", "k", "run-2").isEmpty());
        assertTrue(table.tryAdmit("p", "other-key", "run-3").isEmpty());
    }
}
