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

import lombok.Builder;

/**
 * Library-wide aggregate counts reported by Stash.
 *
 * <p>All values are non-negative. Sizes are in bytes, durations in seconds.
 */
@Builder
public record LibraryStats(
        long scenes,
        long images,
        long performers,
        long studios,
        long files,
        long filesSizeBytes,
        long galleries,
        long tags,
        long groups,
        long scenesSizeBytes,
        long imagesSizeBytes,
        double scenesDurationSeconds,
        long playsTotal,
        double playDurationSeconds,
        long oCountTotal,
        long scenesPlayed
) {
    private static final LibraryStats EMPTY = LibraryStats.builder().build();

    /**
     * Stats used before the first successful scrape.
     *
     * @return Stats with every value at zero
     */
    public static LibraryStats empty() {
        return EMPTY;
    }
}
