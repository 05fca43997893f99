package me.golemcore.actions.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code actions.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link SchedulerProperties} - timer dispatch and shutdown</li>
 * <li>{@link SearchProperties} - web search providers</li>
 * <li>{@link LlmProperties} - chat completion provider</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "actions")
@Data
public class ActionsProperties {

    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private SearchProperties search = new SearchProperties();
    private LlmProperties llm = new LlmProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/actions";
    }

    @Data
    public static class DirectoriesProperties {
        private String actions = "actions";
        private String conversations = "conversations";
        private String memory = "memory";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== SCHEDULER ====================

    @Data
    public static class SchedulerProperties {
        /** Start the scheduler once the application is ready. */
        private boolean autoStart = true;

        /**
         * A fire that could not start within this window of its scheduled time is
         * skipped as missed.
         */
        private Duration misfireGraceTime = Duration.ofSeconds(60);

        /** Max time {@code stop()} waits for in-flight fires. */
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        /**
         * Zone for cron expressions and offset-less dates. Blank means the clock's
         * zone.
         */
        private String timeZone = "";
    }

    // ==================== SEARCH ====================

    @Data
    public static class SearchProperties {
        private String defaultEngine = "brave";
        private int maxResults = 10;
        private List<String> domainFilterList = new ArrayList<>();
        private BraveProperties brave = new BraveProperties();
        private SearxngProperties searxng = new SearxngProperties();
        private TavilyProperties tavily = new TavilyProperties();
        private GooglePseProperties googlePse = new GooglePseProperties();
        private DuckDuckGoProperties duckduckgo = new DuckDuckGoProperties();
    }

    @Data
    public static class BraveProperties {
        private String apiKey = "";
        private String baseUrl = "https://api.search.brave.com";
    }

    @Data
    public static class SearxngProperties {
        private String baseUrl = "";
    }

    @Data
    public static class TavilyProperties {
        private String apiKey = "";
        private String baseUrl = "https://api.tavily.com";
    }

    @Data
    public static class GooglePseProperties {
        private String apiKey = "";
        private String engineId = "";
        private String baseUrl = "https://www.googleapis.com";
    }

    @Data
    public static class DuckDuckGoProperties {
        private boolean enabled = true;
        private String baseUrl = "https://api.duckduckgo.com";
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** Either "openai" (any OpenAI-compatible endpoint) or "anthropic". */
        private String provider = "openai";
        private String apiKey = "";
        private String baseUrl;
        private String defaultModel = "gpt-4o-mini";
        private Duration timeout = Duration.ofSeconds(120);
        private double temperature = 0.7;
        private int maxTokens = 4096;
    }
}
