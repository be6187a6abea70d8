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
package org.stashapp.exporter.bootstrap;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.runtime.configuration.ConfigurationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.stashapp.exporter.config.ConfigValidator;
import org.stashapp.exporter.config.ExporterSettings;
import org.stashapp.exporter.config.ScrapeConfig;
import org.stashapp.exporter.config.StashConfig;
import org.stashapp.exporter.scrape.ScrapeScheduler;

/**
 * Application lifecycle bean.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li>Startup: print banner, validate configuration, arm the scrape scheduler</li>
 *   <li>Runtime: periodic scrapes via {@link ScrapeScheduler}</li>
 *   <li>Shutdown: scheduler disarmed, HTTP server drained by Quarkus</li>
 * </ol>
 *
 * <p>A configuration error is rethrown from the startup observer, which aborts the
 * boot with a non-zero exit code before any scrape runs.
 */
@Slf4j
@ApplicationScoped
public class ExporterApp {
    private final StashConfig stashConfig;
    private final ScrapeConfig scrapeConfig;
    private final ScrapeScheduler scheduler;
    private final Banners banner;

    @Inject
    public ExporterApp(StashConfig stashConfig,
                       ScrapeConfig scrapeConfig,
                       ScrapeScheduler scheduler,
                       Banners banner) {
        this.stashConfig = stashConfig;
        this.scrapeConfig = scrapeConfig;
        this.scheduler = scheduler;
        this.banner = banner;
    }

    void onStartup(@Observes StartupEvent event) {
        banner.printHeader();

        ExporterSettings settings;
        try {
            settings = ConfigValidator.validate(stashConfig, scrapeConfig);
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            log.error("Shutting down Stash Exporter");
            throw e;
        }

        logConfiguration(settings);
        scheduler.start();

        banner.printFooter();
    }

    void onShutdown(@Observes ShutdownEvent event) {
        scheduler.stop();
        banner.printShutdown();
    }

    private void logConfiguration(ExporterSettings settings) {
        log.info("Configuration:");
        log.info("  Stash GraphQL URL:      {}", maskSensitiveInfo(settings.graphqlUrl().toString()));
        log.info("  API key:                {}", maskSecret(settings.apiKey()));
        log.info("  Scrape interval:        {}", settings.scrapeInterval());
        log.info("  Request timeout:        {}", settings.requestTimeout());
    }

    /**
     * Mask credentials embedded in a URL (user:pass@host or apikey query parameter).
     *
     * @param url URL to log
     * @return Masked URL
     */
    static String maskSensitiveInfo(String url) {
        if (url == null) {
            return "not configured";
        }
        return url.replaceAll("(?i)(apikey|api_key)=[^&\\s]+", "$1=***")
                .replaceAll(":[^:/@]+@", ":***@");
    }

    static String maskSecret(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "not configured";
        }
        return "*** (" + secret.length() + " chars)";
    }
}
