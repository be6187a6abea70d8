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

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Connection settings for the Stash GraphQL API.
 *
 * <p>Values are raw; {@link ConfigValidator} turns them into {@link ExporterSettings}.
 */
@ConfigMapping(prefix = "stash")
public interface StashConfig {

    /**
     * Full URL of the GraphQL endpoint.
     *
     * @return GraphQL URL (default: http://localhost:9999/graphql)
     */
    @WithDefault("http://localhost:9999/graphql")
    String graphqlUrl();

    /**
     * API key sent in the {@code ApiKey} header. Required: an unset or empty
     * STASH_API_KEY fails config initialisation before the HTTP server starts.
     *
     * @return API key
     */
    String apiKey();

    /**
     * Upper bound for a single GraphQL request. Must be shorter than the scrape interval.
     * When absent, 80% of the scrape interval is used.
     *
     * @return Request timeout, empty to derive it from the interval
     */
    Optional<Duration> requestTimeout();
}
