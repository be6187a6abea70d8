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

/**
 * Scrape scheduling configuration.
 */
@ConfigMapping(prefix = "app.scrape")
public interface ScrapeConfig {

    /**
     * Interval between two scrapes of the Stash API.
     * The same property drives the scheduler trigger.
     *
     * @return Scrape interval (default: 30 seconds)
     */
    @WithDefault("30s")
    Duration interval();

    /**
     * Delay between application start and the first scrape.
     *
     * @return Initial delay (default: 1 second)
     */
    @WithDefault("1s")
    Duration initialDelay();
}
