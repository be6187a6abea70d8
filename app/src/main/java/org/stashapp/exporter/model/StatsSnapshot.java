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
package org.stashapp.exporter.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Complete, internally consistent set of values served on the metrics endpoint.
 *
 * @param stats       Last successfully scraped stats (zeros before the first success)
 * @param up          Whether the most recent scrape succeeded
 * @param lastSuccess When the last successful scrape completed, null before the first one
 */
public record StatsSnapshot(LibraryStats stats, boolean up, Instant lastSuccess) {

    public StatsSnapshot {
        Objects.requireNonNull(stats, "stats");
    }

    public static StatsSnapshot initial() {
        return new StatsSnapshot(LibraryStats.empty(), false, null);
    }

    public static StatsSnapshot scraped(LibraryStats stats, Instant at) {
        return new StatsSnapshot(stats, true, Objects.requireNonNull(at, "at"));
    }

    /**
     * Same values with {@code up} cleared.
     *
     * @return This snapshot if already down, otherwise a copy marked down
     */
    public StatsSnapshot markedDown() {
        return up ? new StatsSnapshot(stats, false, lastSuccess) : this;
    }

    /**
     * Last success as Unix epoch seconds, 0 before the first success.
     */
    public double lastSuccessEpochSeconds() {
        return lastSuccess == null ? 0.0 : lastSuccess.toEpochMilli() / 1000.0;
    }
}
