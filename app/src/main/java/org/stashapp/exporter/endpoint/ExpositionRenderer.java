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

import io.prometheus.client.Collector.MetricFamilySamples;
import io.prometheus.client.GaugeMetricFamily;
import io.prometheus.client.exporter.common.TextFormat;
import jakarta.enterprise.context.ApplicationScoped;
import org.stashapp.exporter.common.MetricNameBuilder;
import org.stashapp.exporter.model.LibraryStats;
import org.stashapp.exporter.model.StatsSnapshot;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Renders a {@link StatsSnapshot} in the Prometheus text exposition format (0.0.4).
 *
 * <p>The gauge set is fixed and always complete: every gauge is written whether or not
 * the last scrape succeeded. Output depends on the snapshot only.
 */
@ApplicationScoped
public class ExpositionRenderer {

    public static final String CONTENT_TYPE = TextFormat.CONTENT_TYPE_004;

    private static final List<GaugeDefinition> GAUGES = List.of(
            stat("scenes_total", "Number of scenes in the library", LibraryStats::scenes),
            stat("images_total", "Number of images in the library", LibraryStats::images),
            stat("performers_total", "Number of performers", LibraryStats::performers),
            stat("studios_total", "Number of studios", LibraryStats::studios),
            stat("files_total", "Number of files known to Stash", LibraryStats::files),
            stat("files_size_bytes", "Total size of all files in bytes", LibraryStats::filesSizeBytes),
            stat("galleries_total", "Number of galleries", LibraryStats::galleries),
            stat("tags_total", "Number of tags", LibraryStats::tags),
            stat("groups_total", "Number of groups", LibraryStats::groups),
            stat("scenes_size_bytes", "Total size of scene files in bytes", LibraryStats::scenesSizeBytes),
            stat("images_size_bytes", "Total size of image files in bytes", LibraryStats::imagesSizeBytes),
            stat("scenes_duration_seconds", "Total duration of all scenes in seconds", LibraryStats::scenesDurationSeconds),
            stat("plays_total", "Total number of scene plays", LibraryStats::playsTotal),
            stat("play_duration_seconds", "Total play duration in seconds", LibraryStats::playDurationSeconds),
            stat("o_count_total", "Total O-counter across scenes", LibraryStats::oCountTotal),
            stat("scenes_played_total", "Number of scenes played at least once", LibraryStats::scenesPlayed),
            new GaugeDefinition(MetricNameBuilder.build("last_success_timestamp_seconds"),
                    "Unix time of the last successful scrape of the Stash API, 0 if none yet",
                    StatsSnapshot::lastSuccessEpochSeconds),
            new GaugeDefinition(MetricNameBuilder.build("up"),
                    "Whether the last scrape of the Stash API succeeded (1=up, 0=down)",
                    snapshot -> snapshot.up() ? 1.0 : 0.0)
    );

    /**
     * Render one snapshot.
     *
     * @param snapshot Snapshot to render (never null)
     * @return Exposition text
     */
    public String render(StatsSnapshot snapshot) {
        List<MetricFamilySamples> families = new ArrayList<>(GAUGES.size());
        for (GaugeDefinition gauge : GAUGES) {
            families.add(new GaugeMetricFamily(gauge.name(), gauge.help(), gauge.value().applyAsDouble(snapshot)));
        }

        StringWriter writer = new StringWriter();
        try {
            TextFormat.write004(writer, Collections.enumeration(families));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render metrics", e);
        }
        return writer.toString();
    }

    /**
     * @return Names of all rendered gauges, in output order
     */
    public List<String> gaugeNames() {
        return GAUGES.stream().map(GaugeDefinition::name).toList();
    }

    private static GaugeDefinition stat(String name, String help, ToDoubleFunction<LibraryStats> extractor) {
        return new GaugeDefinition(MetricNameBuilder.build(name), help,
                snapshot -> extractor.applyAsDouble(snapshot.stats()));
    }

    private record GaugeDefinition(String name, String help, ToDoubleFunction<StatsSnapshot> value) {
    }
}
