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
package org.stashapp.exporter.config;

import io.quarkus.runtime.configuration.DurationConverter;
import io.smallrye.config.ConfigValidationException;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StashConfigTest {

    @Test
    void testMapping_MissingApiKeyFailsAtConfigInit() {
        assertThrows(ConfigValidationException.class, () -> build(Map.of()));
    }

    @Test
    void testMapping_EmptyApiKeyFailsAtConfigInit() {
        assertThrows(ConfigValidationException.class, () -> build(Map.of("stash.api-key", "")));
    }

    @Test
    void testMapping_ReadsValues() {
        SmallRyeConfig config = build(Map.of(
                "stash.api-key", "secret",
                "stash.request-timeout", "5s"));

        StashConfig stashConfig = config.getConfigMapping(StashConfig.class);

        assertEquals("secret", stashConfig.apiKey());
        assertEquals("http://localhost:9999/graphql", stashConfig.graphqlUrl());
        assertEquals(Duration.ofSeconds(5), stashConfig.requestTimeout().orElseThrow());
    }

    private static SmallRyeConfig build(Map<String, String> properties) {
        return new SmallRyeConfigBuilder()
                .withMapping(StashConfig.class)
                .withConverter(Duration.class, 100, new DurationConverter())
                .withSources(new PropertiesConfigSource(properties, "test", 100))
                .build();
    }
}
