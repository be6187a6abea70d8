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
package org.stashapp.exporter.client;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.ConnectTimeoutException;
import io.vertx.core.impl.NoStackTraceTimeoutException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import lombok.extern.slf4j.Slf4j;
import org.stashapp.exporter.config.ExporterSettings;
import org.stashapp.exporter.model.LibraryStats;

import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Fetches library statistics from Stash.
 *
 * <p>Each call to {@link #fetchStats()} issues exactly one request; retrying is left
 * to the next scheduled scrape. Every failure is reported as a
 * {@link StashScrapeException} carrying its {@link ScrapeFailureReason}.
 */
@Slf4j
@ApplicationScoped
public class StashClient {

    private final StashGraphQLApi api;
    private final ExporterSettings settings;

    @Inject
    public StashClient(StashGraphQLApi api, ExporterSettings settings) {
        this.api = Objects.requireNonNull(api, "api");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Run the library stats query once.
     *
     * @return Parsed stats
     * @throws StashScrapeException if the request or the response is unusable
     */
    public LibraryStats fetchStats() throws StashScrapeException {
        JsonNode body = execute();
        LibraryStats stats = parse(body);
        log.debug("Fetched library stats: {}", stats);
        return stats;
    }

    private JsonNode execute() throws StashScrapeException {
        try {
            return api.execute(settings.apiKey(), StashQueries.libraryStats());
        } catch (WebApplicationException e) {
            // The JSON body reader reports unparseable bodies as WebApplicationException
            JacksonException parseFailure = findCause(e, JacksonException.class);
            if (parseFailure != null) {
                throw new StashScrapeException(ScrapeFailureReason.MALFORMED_PAYLOAD,
                        "Response body is not valid JSON: " + parseFailure.getOriginalMessage(), e);
            }
            int status = e.getResponse() != null ? e.getResponse().getStatus() : -1;
            throw new StashScrapeException(ScrapeFailureReason.HTTP_STATUS,
                    "Stash responded with HTTP " + status, e);
        } catch (ProcessingException e) {
            throw classifyProcessingFailure(e);
        }
    }

    private StashScrapeException classifyProcessingFailure(ProcessingException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (isTimeout(cause)) {
                return new StashScrapeException(ScrapeFailureReason.TIMEOUT,
                        "Request to " + settings.graphqlUrl() + " timed out after " + settings.requestTimeout(), e);
            }
            if (cause instanceof JacksonException) {
                return new StashScrapeException(ScrapeFailureReason.MALFORMED_PAYLOAD,
                        "Response body is not valid JSON: " + ((JacksonException) cause).getOriginalMessage(), e);
            }
        }
        return new StashScrapeException(ScrapeFailureReason.TRANSPORT,
                "Request to " + settings.graphqlUrl() + " failed: " + rootMessage(e), e);
    }

    // Vert.x reports idle (read) timeouts, Netty connect timeouts
    private static boolean isTimeout(Throwable cause) {
        return cause instanceof NoStackTraceTimeoutException
                || cause instanceof ConnectTimeoutException
                || cause instanceof TimeoutException
                || cause instanceof SocketTimeoutException;
    }

    private static <T extends Throwable> T findCause(Throwable e, Class<T> type) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (type.isInstance(cause)) {
                return type.cast(cause);
            }
        }
        return null;
    }

    static LibraryStats parse(JsonNode body) throws StashScrapeException {
        if (body == null || !body.isObject()) {
            throw new StashScrapeException(ScrapeFailureReason.MALFORMED_PAYLOAD, "Response body is not a JSON object");
        }

        JsonNode errors = body.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            String message = errors.get(0).path("message").asText("unknown error");
            throw new StashScrapeException(ScrapeFailureReason.GRAPHQL_ERROR,
                    "GraphQL query failed with " + errors.size() + " error(s): " + message);
        }

        JsonNode data = body.path("data");
        JsonNode stats = requireObject(data.path("stats"), "data.stats");
        JsonNode files = requireObject(data.path("findFiles"), "data.findFiles");

        return LibraryStats.builder()
                .scenes(requireCount(stats, "scene_count"))
                .images(requireCount(stats, "image_count"))
                .performers(requireCount(stats, "performer_count"))
                .studios(requireCount(stats, "studio_count"))
                .files(requireCount(files, "count"))
                .filesSizeBytes(requireCount(files, "size"))
                .galleries(requireCount(stats, "gallery_count"))
                .tags(requireCount(stats, "tag_count"))
                .groups(requireCount(stats, "group_count"))
                .scenesSizeBytes(requireCount(stats, "scenes_size"))
                .imagesSizeBytes(requireCount(stats, "images_size"))
                .scenesDurationSeconds(requireAmount(stats, "scenes_duration"))
                .playsTotal(requireCount(stats, "total_play_count"))
                .playDurationSeconds(requireAmount(stats, "total_play_duration"))
                .oCountTotal(requireCount(stats, "total_o_count"))
                .scenesPlayed(requireCount(stats, "scenes_played"))
                .build();
    }

    private static JsonNode requireObject(JsonNode node, String path) throws StashScrapeException {
        if (!node.isObject()) {
            throw new StashScrapeException(ScrapeFailureReason.MALFORMED_PAYLOAD, "Missing object '" + path + "'");
        }
        return node;
    }

    private static long requireCount(JsonNode parent, String field) throws StashScrapeException {
        double amount = requireAmount(parent, field);
        JsonNode value = parent.get(field);
        // Stash reports sizes as floats; counts are integral
        return value.isIntegralNumber() && value.canConvertToLong() ? value.asLong() : Math.round(amount);
    }

    private static double requireAmount(JsonNode parent, String field) throws StashScrapeException {
        JsonNode value = parent.get(field);
        if (value == null || !value.isNumber()) {
            throw new StashScrapeException(ScrapeFailureReason.MALFORMED_PAYLOAD,
                    "Missing or non-numeric field '" + field + "'");
        }
        double amount = value.asDouble();
        if (amount < 0 || Double.isNaN(amount)) {
            throw new StashScrapeException(ScrapeFailureReason.MALFORMED_PAYLOAD,
                    "Negative value for field '" + field + "': " + value);
        }
        return amount;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
