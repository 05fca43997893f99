package me.golemcore.actions.adapter.outbound.search;

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


import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.actions.domain.model.SearchResult;
import me.golemcore.actions.infrastructure.config.ActionsProperties;
import me.golemcore.actions.infrastructure.http.FeignClientFactory;
import me.golemcore.actions.port.outbound.WebSearchPort;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Web search through the Brave Search API.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code actions.search.brave.api-key} - subscription token (required)
 * <li>{@code actions.search.brave.base-url} - API root
 * </ul>
 *
 * <p>
 * HTTP 429 responses are retried with exponential backoff.
 *
 * @see <a href="https://brave.com/search/api/">Brave Search API</a>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BraveSearchAdapter implements WebSearchPort {

    public static final String ENGINE_ID = "brave";

    private static final int MAX_RETRIES = 3;
    private static final int MAX_COUNT = 20;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final FeignClientFactory feignClientFactory;
    private final ActionsProperties properties;

    private BraveSearchApi searchApi;
    private String apiKey;
    private long initialBackoffMs = 2000;

    @PostConstruct
    public void init() {
        ActionsProperties.BraveProperties config = properties.getSearch().getBrave();
        this.apiKey = config.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.info("[BraveSearch] API key not configured, engine unavailable");
            return;
        }
        this.searchApi = feignClientFactory.create(BraveSearchApi.class, config.getBaseUrl());
        log.info("[BraveSearch] Initialized");
    }

    void setInitialBackoffMs(long initialBackoffMs) {
        this.initialBackoffMs = initialBackoffMs;
    }

    @Override
    public String getEngineId() {
        return ENGINE_ID;
    }

    @Override
    public boolean isAvailable() {
        return searchApi != null;
    }

    @Override
    public List<SearchResult> search(String query, int maxResults) {
        if (searchApi == null) {
            throw new IllegalStateException("Brave Search API key not configured");
        }
        int count = Math.max(1, Math.min(MAX_COUNT, maxResults));
        for (int attempt = 0;; attempt++) {
            try {
                log.debug("[BraveSearch] query='{}', count={}, attempt={}", query, count, attempt);
                return toResults(searchApi.search(apiKey, query, count));
            } catch (FeignException e) {
                if (e.status() == HTTP_TOO_MANY_REQUESTS && attempt < MAX_RETRIES) {
                    long backoffMs = (long) (initialBackoffMs * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[BraveSearch] Rate limit hit (attempt {}/{}), retrying in {}ms",
                            attempt + 1, MAX_RETRIES, backoffMs);
                    sleep(backoffMs);
                } else if (e.status() == HTTP_TOO_MANY_REQUESTS) {
                    throw new IllegalStateException("Brave Search rate limit exceeded", e);
                } else {
                    throw new IllegalStateException("Brave Search API error (status " + e.status() + ")", e);
                }
            }
        }
    }

    private static List<SearchResult> toResults(BraveSearchResponse response) {
        if (response == null || response.getWeb() == null || response.getWeb().getResults() == null) {
            return List.of();
        }
        return response.getWeb().getResults().stream()
                .map(r -> SearchResult.builder()
                        .title(r.getTitle())
                        .link(r.getUrl())
                        .snippet(r.getDescription())
                        .build())
                .toList();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("BraveSearch retry sleep interrupted", e);
        }
    }

    interface BraveSearchApi {
        @RequestLine("GET /res/v1/web/search?q={query}&count={count}")
        @Headers({
                "Accept: application/json",
                "X-Subscription-Token: {apiKey}"
        })
        BraveSearchResponse search(
                @Param("apiKey") String apiKey,
                @Param("query") String query,
                @Param("count") int count);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BraveSearchResponse {
        private WebResults web;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResults {
        private List<WebResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResult {
        private String title;
        private String url;
        private String description;
    }
}
