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
package org.stashapp.exporter.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.stashapp.exporter.client.ScrapeFailureReason;
import org.stashapp.exporter.common.Constants;
import org.stashapp.exporter.common.MetricNameBuilder;

import java.time.Duration;
import java.time.Instant;

/**
 * Internal exporter metrics, served by Micrometer on {@code /q/metrics}.
 */
@Slf4j
@ApplicationScoped
public class ExporterMetrics {

    private static final String NAME_SCRAPES = MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "scrapes");
    private static final String NAME_SCRAPE_ERRORS = MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "scrape_errors");
    private static final String NAME_SKIPPED = MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "skipped_scrapes");
    private static final String NAME_SCRAPE_DURATION = MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "scrape_duration");
    private static final String NAME_UPTIME = MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "uptime_seconds");

    private final Instant startTime = Instant.now();

    private final MeterRegistry registry;

    private Counter scrapeCounter;
    private Counter skippedCounter;
    private Timer scrapeDurationTimer;

    @Inject
    public ExporterMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @PostConstruct
    public void init() {
        scrapeCounter = Counter.builder(NAME_SCRAPES)
                .description("Total number of scrapes of the Stash API")
                .register(registry);
        skippedCounter = Counter.builder(NAME_SKIPPED)
                .description("Scheduled scrapes skipped because the previous one was still running")
                .register(registry);
        scrapeDurationTimer = Timer.builder(NAME_SCRAPE_DURATION)
                .description("Duration of scrapes of the Stash API")
                .register(registry);
        Gauge.builder(NAME_UPTIME, () -> Duration.between(startTime, Instant.now()).toSeconds())
                .description("Duration in seconds since the exporter started")
                .register(registry);
        log.info("Exporter metrics initialized");
    }

    public void incrementScrapes() {
        scrapeCounter.increment();
    }

    public void incrementSkipped() {
        skippedCounter.increment();
    }

    /**
     * Increment the error counter for one failure reason.
     *
     * @param reason Why the scrape failed
     */
    public void incrementScrapeError(ScrapeFailureReason reason) {
        Counter.builder(NAME_SCRAPE_ERRORS)
                .tag("reason", reason.tagValue())
                .description("Number of failed scrapes of the Stash API by reason")
                .register(registry)
                .increment();
    }

    public void recordScrapeDuration(Duration duration) {
        scrapeDurationTimer.record(duration);
    }
}
