/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.stashapp.exporter.scrape;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.stashapp.exporter.client.ScrapeFailureReason;
import org.stashapp.exporter.client.StashClient;
import org.stashapp.exporter.client.StashScrapeException;
import org.stashapp.exporter.endpoint.ExpositionRenderer;
import org.stashapp.exporter.metrics.ExporterMetrics;
import org.stashapp.exporter.model.LibraryStats;
import org.stashapp.exporter.model.StatsSnapshot;
import org.stashapp.exporter.snapshot.StatsSnapshotStore;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScrapeSchedulerTest {

    private static final LibraryStats STATS = LibraryStats.builder()
            .scenes(10)
            .images(20)
            .performers(3)
            .studios(2)
            .files(100)
            .filesSizeBytes(123456)
            .build();

    @Mock
    private StashClient client;

    @Mock
    private ExporterMetrics exporterMetrics;

    private StatsSnapshotStore store;
    private ScrapeScheduler scheduler;
    private final ExpositionRenderer renderer = new ExpositionRenderer();

    @BeforeEach
    void setUp() {
        store = new StatsSnapshotStore();
        scheduler = new ScrapeScheduler(client, store, exporterMetrics);
        scheduler.start();
    }

    @Test
    void testTick_SuccessPublishesSnapshot() throws Exception {
        when(client.fetchStats()).thenReturn(STATS);

        ScrapeResult result = scheduler.tick();

        assertTrue(result.successful());
        StatsSnapshot snapshot = store.read();
        assertTrue(snapshot.up());
        assertEquals(STATS, snapshot.stats());

        String text = renderer.render(snapshot);
        assertTrue(text.contains("stash_scenes_total 10.0\n"));
        assertTrue(text.contains("stash_images_total 20.0\n"));
        assertTrue(text.contains("stash_performers_total 3.0\n"));
        assertTrue(text.contains("stash_studios_total 2.0\n"));
        assertTrue(text.contains("stash_files_total 100.0\n"));
        assertTrue(text.contains("stash_files_size_bytes 123456.0\n"));
        assertTrue(text.contains("stash_up 1.0\n"));

        verify(exporterMetrics).incrementScrapes();
        verify(exporterMetrics).recordScrapeDuration(any(Duration.class));
        verify(exporterMetrics, never()).incrementScrapeError(any());
    }

    @Test
    void testTick_FailureKeepsLastKnownValues() throws Exception {
        when(client.fetchStats())
                .thenReturn(STATS)
                .thenThrow(new StashScrapeException(ScrapeFailureReason.TIMEOUT, "Request timed out"));

        scheduler.tick();
        ScrapeResult result = scheduler.tick();

        assertFalse(result.successful());
        assertEquals(ScrapeResult.Outcome.FAILED, result.outcome());
        assertEquals(ScrapeFailureReason.TIMEOUT, result.reason());

        StatsSnapshot snapshot = store.read();
        assertFalse(snapshot.up());
        assertEquals(STATS, snapshot.stats());

        String text = renderer.render(snapshot);
        assertTrue(text.contains("stash_scenes_total 10.0\n"));
        assertTrue(text.contains("stash_files_size_bytes 123456.0\n"));
        assertTrue(text.contains("stash_up 0.0\n"));

        verify(exporterMetrics).incrementScrapeError(ScrapeFailureReason.TIMEOUT);
    }

    @Test
    void testTick_FailureBeforeFirstSuccessServesZeros() throws Exception {
        when(client.fetchStats())
                .thenThrow(new StashScrapeException(ScrapeFailureReason.TRANSPORT, "Connection refused"));

        scheduler.tick();

        assertEquals(StatsSnapshot.initial(), store.read());
    }

    @Test
    void testTick_RecoversAfterFailure() throws Exception {
        when(client.fetchStats())
                .thenThrow(new StashScrapeException(ScrapeFailureReason.HTTP_STATUS, "HTTP 502"))
                .thenReturn(STATS);

        scheduler.tick();
        assertFalse(store.read().up());

        assertTrue(scheduler.tick().successful());
        assertTrue(store.read().up());
        assertEquals(STATS, store.read().stats());
    }

    @Test
    void testTick_UnexpectedExceptionIsContained() throws Exception {
        when(client.fetchStats()).thenReturn(STATS).thenThrow(new IllegalStateException("boom"));
        scheduler.tick();

        ScrapeResult result = assertDoesNotThrow(() -> scheduler.tick());

        assertEquals(ScrapeFailureReason.UNEXPECTED, result.reason());
        assertFalse(store.read().up());
        assertEquals(STATS, store.read().stats());
        assertEquals(ScraperState.IDLE, scheduler.getState());
    }

    @Test
    void testTick_IgnoredWhenNotStarted() throws Exception {
        ScrapeScheduler stopped = new ScrapeScheduler(client, store, exporterMetrics);

        ScrapeResult result = stopped.tick();

        assertEquals(ScrapeResult.Outcome.SKIPPED, result.outcome());
        verify(client, never()).fetchStats();
        assertTrue(stopped.getLastResult().isEmpty());
    }

    @Test
    void testTick_IgnoredAfterStop() throws Exception {
        scheduler.stop();

        assertEquals(ScrapeResult.Outcome.SKIPPED, scheduler.tick().outcome());
        assertFalse(scheduler.isRunning());
        verify(client, never()).fetchStats();
    }

    @Test
    void testTick_SkippedWhileScrapeInFlight() throws Exception {
        CountDownLatch inFlight = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        when(client.fetchStats()).thenAnswer(invocation -> {
            maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
            inFlight.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            concurrent.decrementAndGet();
            return STATS;
        });

        CompletableFuture<ScrapeResult> slow = CompletableFuture.supplyAsync(scheduler::tick);
        assertTrue(inFlight.await(5, TimeUnit.SECONDS));
        assertEquals(ScraperState.SCRAPING, scheduler.getState());

        ScrapeResult skipped = scheduler.tick();
        ScrapeResult skippedAgain = scheduler.tick();

        release.countDown();
        ScrapeResult completed = slow.get(5, TimeUnit.SECONDS);

        assertEquals(ScrapeResult.Outcome.SKIPPED, skipped.outcome());
        assertEquals(ScrapeResult.Outcome.SKIPPED, skippedAgain.outcome());
        assertTrue(completed.successful());
        assertEquals(1, maxConcurrent.get());
        verify(client, times(1)).fetchStats();
        verify(exporterMetrics, times(2)).incrementSkipped();
        assertEquals(ScraperState.IDLE, scheduler.getState());
    }

    @Test
    void testTick_SkippedTickIsNotQueued() throws Exception {
        CountDownLatch inFlight = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(client.fetchStats()).thenAnswer(invocation -> {
            inFlight.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return STATS;
        });

        CompletableFuture<ScrapeResult> slow = CompletableFuture.supplyAsync(scheduler::tick);
        assertTrue(inFlight.await(5, TimeUnit.SECONDS));
        scheduler.tick();
        release.countDown();
        slow.get(5, TimeUnit.SECONDS);

        // Nothing runs later on behalf of the skipped tick
        Thread.sleep(100);
        verify(client, times(1)).fetchStats();
    }

    @Test
    void testTick_SlowScrapesOnFixedRateNeverOverlap() throws Exception {
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        when(client.fetchStats()).thenAnswer(invocation -> {
            maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
            Thread.sleep(120);
            concurrent.decrementAndGet();
            return STATS;
        });

        ScheduledExecutorService timer = Executors.newScheduledThreadPool(4);
        try {
            // Fixed rate on a multi-threaded pool lets ticks fire while a scrape runs
            for (int i = 0; i < 4; i++) {
                timer.scheduleAtFixedRate(scheduler::tick, i * 10L, 40, TimeUnit.MILLISECONDS);
            }
            Thread.sleep(600);
        } finally {
            timer.shutdownNow();
            assertTrue(timer.awaitTermination(5, TimeUnit.SECONDS));
        }

        assertEquals(1, maxConcurrent.get());
        verify(exporterMetrics, atLeastOnce()).incrementSkipped();
    }

    @Test
    void testTick_IntervalHonored() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        when(client.fetchStats()).thenAnswer(invocation -> {
            attempts.incrementAndGet();
            return STATS;
        });

        long intervalMillis = 100;
        long windowMillis = 1050;
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
        try {
            timer.scheduleAtFixedRate(scheduler::tick, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
            Thread.sleep(windowMillis);
        } finally {
            timer.shutdownNow();
            assertTrue(timer.awaitTermination(5, TimeUnit.SECONDS));
        }

        long expected = windowMillis / intervalMillis;
        // One extra tick of slack for scheduling jitter on busy build machines
        assertTrue(Math.abs(attempts.get() - expected) <= 2,
                "Expected about " + expected + " scrapes, got " + attempts.get());
    }

    @Test
    void testGetLastResult() throws Exception {
        when(client.fetchStats()).thenReturn(STATS);
        assertTrue(scheduler.getLastResult().isEmpty());

        scheduler.tick();

        assertTrue(scheduler.getLastResult().orElseThrow().successful());
    }
}
