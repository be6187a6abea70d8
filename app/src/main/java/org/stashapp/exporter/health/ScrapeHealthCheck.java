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
import org.eclipse.microprofile.health.Readiness;
import org.stashapp.exporter.model.StatsSnapshot;
import org.stashapp.exporter.snapshot.StatsSnapshotStore;

/**
 * Readiness check reporting the last scrape of the Stash API.
 * Always UP: /metrics serves a complete snapshot while Stash is down, and
 * stash_up carries the Stash outage. The scrape state is reported as data only.
 */
@Readiness
@ApplicationScoped
public class ScrapeHealthCheck implements HealthCheck {

    @Inject
    StatsSnapshotStore store;

    @Override
    public HealthCheckResponse call() {
        StatsSnapshot snapshot = store.read();

        HealthCheckResponseBuilder builder = HealthCheckResponse.named("stash-scrape")
                .up()
                .withData("up", snapshot.up());
        if (snapshot.lastSuccess() != null) {
            builder.withData("lastSuccess", snapshot.lastSuccess().toString());
        }
        return builder.build();
    }
}
