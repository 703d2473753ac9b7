package com.ryuqq.waypoint.testkit.contract;

import com.ryuqq.waypoint.core.protection.Bulkhead;
import com.ryuqq.waypoint.core.protection.BulkheadConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link Bulkhead} implementations.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>At most {@code maxConcurrentCalls} permits are held at once</li>
 *   <li>A saturated bulkhead rejects immediately (no waiting)</li>
 *   <li>release() frees a permit and rejections are counted</li>
 * </ul>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public abstract class BulkheadContract extends AbstractContractTest {

    protected static final BulkheadConfig CONFIG = new BulkheadConfig(2);

    protected Bulkhead bulkhead;

    protected abstract Bulkhead createBulkhead(BulkheadConfig config);

    @BeforeEach
    void createBulkheadUnderTest() {
        bulkhead = createBulkhead(CONFIG);
    }

    @Test
    void testPermitsUpToLimit_AreGranted() {
        // When / Then
        assertTrue(bulkhead.tryAcquire());
        assertTrue(bulkhead.tryAcquire());
        assertEquals(2, bulkhead.getCurrentConcurrency());
    }

    @Test
    void testSaturatedBulkhead_RejectsImmediately() {
        // Given
        bulkhead.tryAcquire();
        bulkhead.tryAcquire();

        // When
        long start = System.nanoTime();
        boolean acquired = bulkhead.tryAcquire();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // Then
        assertFalse(acquired);
        assertTrue(elapsedMs < 500, "rejection must not wait for a permit (took " + elapsedMs + "ms)");
        assertEquals(1, bulkhead.getRejectedCount());
    }

    @Test
    void testRelease_FreesPermit() {
        // Given
        bulkhead.tryAcquire();
        bulkhead.tryAcquire();

        // When
        bulkhead.release();

        // Then
        assertEquals(1, bulkhead.getCurrentConcurrency());
        assertTrue(bulkhead.tryAcquire());
    }

    @Test
    void testConfig_IsExposed() {
        assertEquals(2, bulkhead.getConfig().maxConcurrentCalls());
    }

    @Test
    void testConcurrentAcquire_NeverExceedsLimit() throws Exception {
        // Given
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        try {
            // When
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return bulkhead.tryAcquire();
                }));
            }
            start.countDown();

            int granted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    granted++;
                }
            }

            // Then
            assertEquals(2, granted);
            assertEquals(threads - 2, bulkhead.getRejectedCount());
        } finally {
            executor.shutdownNow();
        }
    }
}
