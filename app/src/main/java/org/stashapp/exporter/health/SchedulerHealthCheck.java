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
package org.stashapp.exporter.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Liveness;
import org.stashapp.exporter.scrape.ScrapeScheduler;

/**
 * Liveness check: the scrape scheduler accepts ticks
 */
@Liveness
@ApplicationScoped
public class SchedulerHealthCheck implements HealthCheck {

    @Inject
    ScrapeScheduler scheduler;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("stash-scheduler")
                .status(scheduler.isRunning())
                .withData("state", scheduler.getState().name());
        scheduler.getLastResult().ifPresent(result -> {
            builder.withData("lastScrape", result.timestamp().toString());
            builder.withData("lastOutcome", result.outcome().name());
            if (result.reason() != null) {
                builder.withData("lastFailureReason", result.reason().tagValue());
            }
        });
        return builder.build();
    }
}
