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

import lombok.experimental.UtilityClass;

/**
 * GraphQL documents sent to Stash.
 */
@UtilityClass
public final class StashQueries {

    public static final String LIBRARY_STATS_OPERATION = "LibraryStats";

    /**
     * Aggregate library statistics. Only cheap, pre-aggregated fields are requested;
     * {@code findFiles} with {@code per_page: 0} returns the totals without any file rows.
     */
    public static final String LIBRARY_STATS_QUERY = """
            query LibraryStats {
              stats {
                scene_count
                scenes_size
                scenes_duration
                image_count
                images_size
                gallery_count
                performer_count
                studio_count
                group_count
                tag_count
                total_o_count
                total_play_duration
                total_play_count
                scenes_played
              }
              findFiles(filter: { per_page: 0 }) {
                count
                size
              }
            }
            """;

    public static GraphQLRequest libraryStats() {
        return new GraphQLRequest(LIBRARY_STATS_QUERY, LIBRARY_STATS_OPERATION);
    }
}
