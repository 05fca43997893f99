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
import com.fasterxml.jackson.annotation.JsonProperty;
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

import java.util.ArrayList;
import java.util.List;

/**
 * Keyless web search through the DuckDuckGo Instant Answer API. The abstract
 * (when present) comes first, followed by related topics; topic groups are
 * flattened.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DuckDuckGoSearchAdapter implements WebSearchPort {

    public static final String ENGINE_ID = "duckduckgo";

    private final FeignClientFactory feignClientFactory;
    private final ActionsProperties properties;

    private DuckDuckGoApi searchApi;

    @PostConstruct
    public void init() {
        ActionsProperties.DuckDuckGoProperties config = properties.getSearch().getDuckduckgo();
        if (!config.isEnabled()) {
            log.info("[DuckDuckGo] Disabled");
            return;
        }
        this.searchApi = feignClientFactory.create(DuckDuckGoApi.class, config.getBaseUrl());
        log.info("[DuckDuckGo] Initialized");
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
            throw new IllegalStateException("DuckDuckGo search is disabled");
        }
        DuckDuckGoResponse response;
        try {
            response = searchApi.search(query);
        } catch (FeignException e) {
            throw new IllegalStateException("DuckDuckGo error (status " + e.status() + ")", e);
        }
        if (response == null) {
            return List.of();
        }
        int limit = Math.max(1, maxResults);
        List<SearchResult> results = new ArrayList<>();
        if (hasText(response.getAbstractUrl()) && hasText(response.getAbstractText())) {
            results.add(SearchResult.builder()
                    .title(hasText(response.getHeading()) ? response.getHeading() : query)
                    .link(response.getAbstractUrl())
                    .snippet(response.getAbstractText())
                    .build());
        }
        collectTopics(response.getRelatedTopics(), results, limit);
        return results;
    }

    private static void collectTopics(List<DuckDuckGoTopic> topics, List<SearchResult> results, int limit) {
        if (topics == null) {
            return;
        }
        for (DuckDuckGoTopic topic : topics) {
            if (results.size() >= limit) {
                return;
            }
            if (topic.getTopics() != null) {
                collectTopics(topic.getTopics(), results, limit);
            } else if (hasText(topic.getFirstUrl())) {
                results.add(SearchResult.builder()
                        .title(titleOf(topic.getText()))
                        .link(topic.getFirstUrl())
                        .snippet(topic.getText())
                        .build());
            }
        }
    }

    // Topic text reads "Title - description".
    static String titleOf(String text) {
        if (text == null) {
            return null;
        }
        int dash = text.indexOf(" - ");
        return dash > 0 ? text.substring(0, dash) : text;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    interface DuckDuckGoApi {
        @RequestLine("GET /?q={query}&format=json&no_html=1&skip_disambig=1")
        @Headers("Accept: application/json")
        DuckDuckGoResponse search(@Param("query") String query);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DuckDuckGoResponse {
        @JsonProperty("Heading")
        private String heading;
        @JsonProperty("AbstractText")
        private String abstractText;
        @JsonProperty("AbstractURL")
        private String abstractUrl;
        @JsonProperty("RelatedTopics")
        private List<DuckDuckGoTopic> relatedTopics;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DuckDuckGoTopic {
        @JsonProperty("Text")
        private String text;
        @JsonProperty("FirstURL")
        private String firstUrl;
        @JsonProperty("Topics")
        private List<DuckDuckGoTopic> topics;
    }
}
