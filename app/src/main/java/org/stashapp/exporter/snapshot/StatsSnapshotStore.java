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
package org.stashapp.exporter.snapshot;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.stashapp.exporter.model.LibraryStats;
import org.stashapp.exporter.model.StatsSnapshot;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link StatsSnapshot}.
 *
 * <p>Snapshots are immutable and published through a single atomic reference, so
 * {@link #read()} always returns a complete snapshot and never blocks.
 * {@link #replace(LibraryStats)} and {@link #markDown()} are called by the scrape
 * scheduler only.
 */
@Slf4j
@ApplicationScoped
public class StatsSnapshotStore {

    private final AtomicReference<StatsSnapshot> current = new AtomicReference<>(StatsSnapshot.initial());
    private final Clock clock;

    public StatsSnapshotStore() {
        this(Clock.systemUTC());
    }

    StatsSnapshotStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return The current snapshot
     */
    public StatsSnapshot read() {
        return current.get();
    }

    /**
     * Publish freshly scraped stats and mark the exporter up.
     *
     * @param stats Complete stats from a successful scrape
     */
    public void replace(LibraryStats stats) {
        Objects.requireNonNull(stats, "stats");
        current.set(StatsSnapshot.scraped(stats, clock.instant()));
    }

    /**
     * Clear the {@code up} flag, keeping the last known values.
     */
    public void markDown() {
        StatsSnapshot previous = current.getAndUpdate(StatsSnapshot::markedDown);
        if (previous.up()) {
            log.debug("Snapshot marked down, keeping values from {}", previous.lastSuccess());
        }
    }
}
