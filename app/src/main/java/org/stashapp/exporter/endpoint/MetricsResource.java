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
package org.stashapp.exporter.endpoint;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lombok.extern.slf4j.Slf4j;
import org.stashapp.exporter.common.Constants;
import org.stashapp.exporter.snapshot.StatsSnapshotStore;

/**
 * Prometheus endpoint serving the current library snapshot on {@code /metrics}.
 *
 * <p>Each request reads the snapshot once, so a response never mixes values from two scrapes.
 */
@Slf4j
@Path(Constants.METRICS_PATH)
public class MetricsResource {

    private final StatsSnapshotStore store;
    private final ExpositionRenderer renderer;

    @Inject
    public MetricsResource(StatsSnapshotStore store, ExpositionRenderer renderer) {
        this.store = store;
        this.renderer = renderer;
    }

    @GET
    @Produces({ExpositionRenderer.CONTENT_TYPE, MediaType.TEXT_PLAIN})
    public Response metrics() {
        try {
            String body = renderer.render(store.read());
            return Response.ok(body, ExpositionRenderer.CONTENT_TYPE).build();
        } catch (RuntimeException e) {
            log.error("Failed to render metrics: {}", e.getMessage(), e);
            return Response.serverError()
                    .type(MediaType.TEXT_PLAIN)
                    .entity("Failed to render metrics")
                    .build();
        }
    }
}
