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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.rest.client.RestClientBuilder;
import org.stashapp.exporter.config.ExporterSettings;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Builds the GraphQL REST client from validated settings.
 *
 * <p>Connect and read timeouts together stay within the configured request timeout,
 * which is shorter than the scrape interval.
 */
@Slf4j
@ApplicationScoped
public class StashClientProducer {

    private static final long CONNECT_TIMEOUT_SHARE = 4;

    @Produces
    @Singleton
    StashGraphQLApi stashGraphQLApi(ExporterSettings settings) {
        long totalMillis = Math.max(2, settings.requestTimeout().toMillis());
        long connectMillis = Math.max(1, totalMillis / CONNECT_TIMEOUT_SHARE);
        long readMillis = totalMillis - connectMillis;
        log.debug("Building Stash client for {} (connect timeout {} ms, read timeout {} ms)",
                settings.graphqlUrl(), connectMillis, readMillis);
        return RestClientBuilder.newBuilder()
                .baseUri(settings.graphqlUrl())
                .connectTimeout(connectMillis, TimeUnit.MILLISECONDS)
                .readTimeout(readMillis, TimeUnit.MILLISECONDS)
                .build(StashGraphQLApi.class);
    }

    void close(@Disposes StashGraphQLApi api) {
        if (api instanceof Closeable closeable) {
            try {
                closeable.close();
            } catch (IOException e) {
                log.warn("Failed to close Stash client: {}", e.getMessage());
            }
        }
    }
}
