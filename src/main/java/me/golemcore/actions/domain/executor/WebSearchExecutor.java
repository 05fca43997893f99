package me.golemcore.actions.domain.executor;

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


import lombok.extern.slf4j.Slf4j;
import me.golemcore.actions.domain.model.ActionResult;
import me.golemcore.actions.domain.model.SearchResult;
import me.golemcore.actions.infrastructure.config.ActionsProperties;
import me.golemcore.actions.port.outbound.ConversationPort;
import me.golemcore.actions.port.outbound.WebSearchPort;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Action {@code web_search}: runs a query against one of the configured search
 * engines and, unless {@code save_to_chat} is false, appends a digest of the
 * results to a conversation.
 *
 * <p>
 * Config keys:
 * <ul>
 * <li>{@code query} - required</li>
 * <li>{@code engine} - brave, searxng, tavily, google_pse or duckduckgo; defaults to
 * {@code actions.search.default-engine}</li>
 * <li>{@code max_results} - defaults to {@code actions.search.max-results}</li>
 * <li>{@code save_to_chat} - default true</li>
 * <li>{@code chat_id} - conversation to continue</li>
 * </ul>
 */
@Component
@Slf4j
public class WebSearchExecutor implements ActionExecutor {

    public static final String TYPE = "web_search";

    static final String DIGEST_MODEL = "scheduled-search";
    private static final int MAX_RESULTS_CAP = 50;
    private static final DateTimeFormatter DIGEST_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Map<String, WebSearchPort> engines;
    private final ConversationPort conversationPort;
    private final ActionsProperties properties;
    private final Clock clock;

    public WebSearchExecutor(List<WebSearchPort> engines, ConversationPort conversationPort,
            ActionsProperties properties, Clock clock) {
        this.engines = engines.stream()
                .collect(Collectors.toMap(WebSearchPort::getEngineId, Function.identity(), (a, b) -> a,
                        LinkedHashMap::new));
        this.conversationPort = conversationPort;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String getActionType() {
        return TYPE;
    }

    @Override
    public ActionResult execute(String owner, Map<String, Object> config) {
        try {
            String query = ConfigValues.getString(config, "query", null);
            if (query == null) {
                return ActionResult.error("No query provided");
            }
            ActionsProperties.SearchProperties search = properties.getSearch();
            String engineId = ConfigValues.getString(config, "engine", search.getDefaultEngine())
                    .toLowerCase(Locale.ROOT);
            int maxResults = Math.max(1,
                    Math.min(MAX_RESULTS_CAP, ConfigValues.getInt(config, "max_results", search.getMaxResults())));

            WebSearchPort engine = engines.get(engineId);
            if (engine == null) {
                return ActionResult.error("Unsupported search engine: " + engineId);
            }
            if (!engine.isAvailable()) {
                return ActionResult.error(engineId + " search is not configured");
            }

            log.info("[Executor] Web search for {}: '{}' (engine: {})", owner, query, engineId);
            List<SearchResult> results = filterDomains(engine.search(query, maxResults), search.getDomainFilterList());

            String chatId = null;
            if (ConfigValues.getBoolean(config, "save_to_chat", true)) {
                chatId = saveToChat(owner, query, engineId, results, ConfigValues.getString(config, "chat_id", null));
            }

            return ActionResult.success()
                    .with("query", query)
                    .with("engine", engineId)
                    .with("results_count", results.size())
                    .with("results", results.stream().map(WebSearchExecutor::toMap).toList())
                    .with(ActionResult.CONVERSATION_ID, chatId);
        } catch (RuntimeException e) {
            log.error("[Executor] Web search failed for {}", owner, e);
            return ActionResult.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    static List<SearchResult> filterDomains(List<SearchResult> results, List<String> allowedDomains) {
        if (results == null) {
            return List.of();
        }
        List<String> domains = allowedDomains == null ? List.of()
                : allowedDomains.stream()
                        .filter(domain -> domain != null && !domain.isBlank())
                        .map(domain -> domain.trim().toLowerCase(Locale.ROOT))
                        .toList();
        if (domains.isEmpty()) {
            return results;
        }
        return results.stream()
                .filter(result -> matchesDomain(result.getLink(), domains))
                .toList();
    }

    private static boolean matchesDomain(String link, List<String> allowedDomains) {
        if (link == null) {
            return false;
        }
        String host;
        try {
            host = URI.create(link).getHost();
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (host == null) {
            return false;
        }
        String normalized = host.toLowerCase(Locale.ROOT);
        return allowedDomains.stream()
                .anyMatch(domain -> normalized.equals(domain) || normalized.endsWith("." + domain));
    }

    // A failed transcript write must not fail the search itself.
    private String saveToChat(String owner, String query, String engineId, List<SearchResult> results,
            String chatId) {
        try {
            return conversationPort.appendExchange(owner, chatId, query, DIGEST_MODEL,
                    "[Scheduled Search] " + query, digest(query, engineId, results));
        } catch (RuntimeException e) {
            log.warn("[Executor] Failed to save search results to chat for {}: {}", owner, e.getMessage());
            return null;
        }
    }

    String digest(String query, String engineId, List<SearchResult> results) {
        StringBuilder sb = new StringBuilder();
        sb.append("**Search Results for:** ").append(query).append('\n');
        sb.append("**Date:** ").append(ZonedDateTime.now(clock).format(DIGEST_DATE)).append('\n');
        sb.append("**Engine:** ").append(engineId).append('\n');
        sb.append("**Results Found:** ").append(results.size()).append("\n\n");
        sb.append("---\n\n");
        int index = 1;
        for (SearchResult result : results) {
            String title = result.getTitle() != null && !result.getTitle().isBlank() ? result.getTitle()
                    : "No title";
            String link = result.getLink() != null ? result.getLink() : "";
            sb.append("### ").append(index++).append(". ").append(title).append('\n');
            sb.append('[').append(link).append("](").append(link).append(")\n\n");
            if (result.getSnippet() != null && !result.getSnippet().isBlank()) {
                sb.append(result.getSnippet()).append("\n\n");
            }
            sb.append("---\n\n");
        }
        return sb.toString();
    }

    private static Map<String, Object> toMap(SearchResult result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("title", result.getTitle() != null ? result.getTitle() : "");
        map.put("link", result.getLink() != null ? result.getLink() : "");
        map.put("snippet", result.getSnippet() != null ? result.getSnippet() : "");
        return map;
    }
}
