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

import org.stashapp.exporter.client.ScrapeFailureReason;

import java.time.Instant;

/**
 * Outcome of one scheduler tick.
 *
 * @param timestamp When the tick started
 * @param outcome   What happened
 * @param reason    Failure reason, null unless {@code outcome} is {@link Outcome#FAILED}
 * @param error     Failure cause, may be null
 */
public record ScrapeResult(Instant timestamp, Outcome outcome, ScrapeFailureReason reason, Throwable error) {

    public enum Outcome {
        SUCCEEDED,
        FAILED,
        /** The tick did not scrape: a scrape was in flight or the scheduler is stopped. */
        SKIPPED
    }

    /**
     * Create a successful scrape result.
     *
     * @param start When the scrape started
     * @return Successful scrape result
     */
    public static ScrapeResult successful(Instant start) {
        return new ScrapeResult(start, Outcome.SUCCEEDED, null, null);
    }

    /**
     * Create a failed scrape result.
     *
     * @param start  When the scrape started
     * @param reason Classified failure reason
     * @param error  The error that caused the failure
     * @return Failed scrape result
     */
    public static ScrapeResult failed(Instant start, ScrapeFailureReason reason, Throwable error) {
        return new ScrapeResult(start, Outcome.FAILED, reason, error);
    }

    public static ScrapeResult skipped(Instant start) {
        return new ScrapeResult(start, Outcome.SKIPPED, null, null);
    }

    public boolean successful() {
        return outcome == Outcome.SUCCEEDED;
    }
}
