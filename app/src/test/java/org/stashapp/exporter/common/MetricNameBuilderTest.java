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
package org.stashapp.exporter.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MetricNameBuilderTest {

    @Test
    void testBuild_WithSubsystem() {
        assertEquals("stash_exporter_scrapes", MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "scrapes"));
    }

    @Test
    void testBuild_WithNullSubsystem() {
        assertEquals("stash_up", MetricNameBuilder.build(null, "up"));
    }

    @Test
    void testBuild_WithEmptySubsystem() {
        assertEquals("stash_scenes_total", MetricNameBuilder.build("", "scenes_total"));
    }

    @Test
    void testBuild_WithoutSubsystem() {
        assertEquals("stash_files_size_bytes", MetricNameBuilder.build("files_size_bytes"));
    }
}
