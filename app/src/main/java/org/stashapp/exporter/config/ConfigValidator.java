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

import io.quarkus.runtime.configuration.ConfigurationException;
import lombok.experimental.UtilityClass;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;

/**
 * Turns raw configuration into {@link ExporterSettings}.
 *
 * <p>Any violation is fatal: the exporter must not start scraping or serving with
 * a configuration it cannot honour.
 */
@UtilityClass
public final class ConfigValidator {

    private static final long DERIVED_TIMEOUT_PERCENT = 80;

    /**
     * Validate configuration and derive the effective request timeout.
     *
     * @param stashConfig  Stash connection settings
     * @param scrapeConfig Scrape scheduling settings
     * @return Validated settings
     * @throws ConfigurationException if a required value is missing or values are inconsistent
     */
    public static ExporterSettings validate(StashConfig stashConfig, ScrapeConfig scrapeConfig) {
        String apiKey = stashConfig.apiKey() == null ? "" : stashConfig.apiKey().trim();
        if (apiKey.isEmpty()) {
            throw new ConfigurationException("Stash API key is required: set STASH_API_KEY (stash.api-key)");
        }

        URI graphqlUrl = parseUrl(stashConfig.graphqlUrl());

        Duration interval = scrapeConfig.interval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new ConfigurationException("Scrape interval must be positive, got " + interval);
        }

        Duration timeout = stashConfig.requestTimeout()
                .orElseGet(() -> interval.multipliedBy(DERIVED_TIMEOUT_PERCENT).dividedBy(100));
        if (timeout.isZero() || timeout.isNegative()) {
            throw new ConfigurationException("Request timeout must be positive, got " + timeout);
        }
        if (timeout.compareTo(interval) >= 0) {
            throw new ConfigurationException("Request timeout (" + timeout
                    + ") must be shorter than the scrape interval (" + interval + ")");
        }

        return new ExporterSettings(graphqlUrl, apiKey, interval, timeout);
    }

    private static URI parseUrl(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Stash GraphQL URL must not be empty");
        }
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
                throw new ConfigurationException("Stash GraphQL URL must be an absolute http(s) URL: " + value);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid Stash GraphQL URL: " + value, e);
        }
    }
}
