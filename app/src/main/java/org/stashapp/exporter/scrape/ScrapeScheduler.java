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

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.stashapp.exporter.client.ScrapeFailureReason;
import org.stashapp.exporter.client.StashClient;
import org.stashapp.exporter.client.StashScrapeException;
import org.stashapp.exporter.metrics.ExporterMetrics;
import org.stashapp.exporter.model.LibraryStats;
import org.stashapp.exporter.snapshot.StatsSnapshotStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives periodic scrapes of the Stash API and publishes the results to the
 * {@link StatsSnapshotStore}.
 *
 * <p><b>Policy:</b>
 * <ul>
 *   <li>Success replaces the whole snapshot and marks the exporter up</li>
 *   <li>Failure only marks the exporter down; last known values stay in place</li>
 *   <li>At most one scrape is in flight; a tick that finds one running is skipped, not queued</li>
 *   <li>Failures are logged and counted, never propagated to the scheduler</li>
 * </ul>
 *
 * <p>Ticks are ignored until {@link #start()} is called after startup validation,
 * and again after {@link #stop()}.
 */
@Slf4j
@ApplicationScoped
public class ScrapeScheduler {

    private final Lock scrapeLock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<ScraperState> state = new AtomicReference<>(ScraperState.IDLE);
    private final AtomicReference<ScrapeResult> lastResult = new AtomicReference<>();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    private final StashClient client;
    private final StatsSnapshotStore store;
    private final ExporterMetrics exporterMetrics;
    private final Clock clock;

    @Inject
    public ScrapeScheduler(StashClient client, StatsSnapshotStore store, ExporterMetrics exporterMetrics) {
        this(client, store, exporterMetrics, Clock.systemUTC());
    }

    ScrapeScheduler(StashClient client, StatsSnapshotStore store, ExporterMetrics exporterMetrics, Clock clock) {
        this.client = client;
        this.store = store;
        this.exporterMetrics = exporterMetrics;
        this.clock = clock;
    }

    /**
     * Accept ticks from now on.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Scrape scheduler started");
        }
    }

    /**
     * Ignore further ticks. A scrape already in flight finishes within its request timeout.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Scrape scheduler stopped");
        }
    }

    /**
     * Periodic trigger. Uses the interval configured in app.scrape.interval;
     * the first tick fires app.scrape.initial-delay after startup.
     */
    @Scheduled(identity = "stash-scrape",
            every = "${app.scrape.interval}",
            delayed = "${app.scrape.initial-delay}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP,
            skipExecutionIf = Scheduled.ApplicationNotRunning.class)
    void scheduledScrape() {
        try {
            tick();
        } catch (Exception e) {
            // Keep the trigger alive whatever escapes tick()
            log.error("Unexpected error in scheduled scrape: {}", e.getMessage(), e);
        }
    }

    /**
     * Run one scrape unless the scheduler is stopped or a scrape is already in flight.
     *
     * @return What happened on this tick
     */
    public ScrapeResult tick() {
        Instant start = clock.instant();
        if (!running.get()) {
            log.debug("Scheduler not running, ignoring tick");
            return ScrapeResult.skipped(start);
        }
        if (!scrapeLock.tryLock()) {
            log.debug("Previous scrape still in flight, skipping tick");
            exporterMetrics.incrementSkipped();
            return ScrapeResult.skipped(start);
        }
        try {
            state.set(ScraperState.SCRAPING);
            ScrapeResult result = scrapeOnce(start);
            lastResult.set(result);
            return result;
        } finally {
            state.set(ScraperState.IDLE);
            scrapeLock.unlock();
        }
    }

    private ScrapeResult scrapeOnce(Instant start) {
        exporterMetrics.incrementScrapes();
        log.debug("Starting scrape");
        try {
            LibraryStats stats = client.fetchStats();
            store.replace(stats);
            int failuresBefore = consecutiveFailures.getAndSet(0);
            if (failuresBefore > 0) {
                log.info("Stash scrape succeeded again after {} failed attempt(s)", failuresBefore);
            }
            return ScrapeResult.successful(start);
        } catch (StashScrapeException e) {
            return recordFailure(start, e.getReason(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected error during scrape: {}", e.getMessage(), e);
            return recordFailure(start, ScrapeFailureReason.UNEXPECTED, e);
        } finally {
            recordDuration(start);
        }
    }

    private ScrapeResult recordFailure(Instant start, ScrapeFailureReason reason, Exception e) {
        store.markDown();
        exporterMetrics.incrementScrapeError(reason);
        int failures = consecutiveFailures.incrementAndGet();
        log.warn("Stash scrape failed ({}, {} in a row): {}", reason, failures, e.getMessage());
        log.debug("Scrape failure details:", e);
        return ScrapeResult.failed(start, reason, e);
    }

    private void recordDuration(Instant start) {
        Duration duration = Duration.between(start, clock.instant());
        exporterMetrics.recordScrapeDuration(duration);
        log.debug("Scrape completed in {} ms", duration.toMillis());
    }

    public ScraperState getState() {
        return state.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return Result of the last tick that actually scraped, empty before the first one
     */
    public Optional<ScrapeResult> getLastResult() {
        return Optional.ofNullable(lastResult.get());
    }
}
