package me.golemcore.actions.adapter.outbound.llm;

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


import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.actions.domain.model.LlmRequest;
import me.golemcore.actions.domain.model.LlmResponse;
import me.golemcore.actions.domain.model.LlmUsage;
import me.golemcore.actions.domain.model.Message;
import me.golemcore.actions.infrastructure.config.ActionsProperties;
import me.golemcore.actions.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link LlmPort} on top of langchain4j.
 *
 * <p>
 * {@code actions.llm.provider} selects the client: {@code anthropic} uses the
 * Anthropic API, anything else an OpenAI-compatible endpoint at
 * {@code actions.llm.base-url}. One {@link ChatModel} is built per requested
 * model name and reused. Rate limit errors are retried with exponential
 * backoff; the client's own retries are off.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 5_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";

    private final ActionsProperties properties;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    public Langchain4jAdapter(ActionsProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getProviderId() {
        return provider();
    }

    @Override
    public String getDefaultModel() {
        return properties.getLlm().getDefaultModel();
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getApiKey();
        String baseUrl = properties.getLlm().getBaseUrl();
        // A local OpenAI-compatible server may run without a key
        return (apiKey != null && !apiKey.isBlank())
                || (!PROVIDER_ANTHROPIC.equals(provider()) && baseUrl != null && !baseUrl.isBlank());
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = request.getModel() != null && !request.getModel().isBlank() ? request.getModel()
                    : getDefaultModel();
            ChatModel chatModel = models.computeIfAbsent(model, this::createModel);
            List<ChatMessage> messages = convertMessages(request);

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    ChatResponse response = chatModel.chat(messages);
                    return convertResponse(response, model);
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms",
                                attempt + 1, MAX_RETRIES, backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.error("[LLM] Chat with {} failed: {}", model, e.getMessage());
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    ChatModel createModel(String model) {
        ActionsProperties.LlmProperties llm = properties.getLlm();
        log.info("[LLM] Creating {} client for model {}", provider(), model);
        if (PROVIDER_ANTHROPIC.equals(provider())) {
            AnthropicChatModel.AnthropicChatModelBuilder builder = AnthropicChatModel.builder()
                    .apiKey(llm.getApiKey())
                    .modelName(model)
                    .maxRetries(0)
                    .maxTokens(llm.getMaxTokens())
                    .temperature(llm.getTemperature())
                    .timeout(llm.getTimeout());
            if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
                builder.baseUrl(llm.getBaseUrl());
            }
            return builder.build();
        }
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey() != null && !llm.getApiKey().isBlank() ? llm.getApiKey() : "none")
                .modelName(model)
                .maxRetries(0)
                .maxTokens(llm.getMaxTokens())
                .temperature(llm.getTemperature())
                .timeout(llm.getTimeout());
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        if (request.getMessages() == null) {
            return messages;
        }
        for (Message msg : request.getMessages()) {
            String role = msg.getRole() != null ? msg.getRole() : Message.ROLE_USER;
            switch (role) {
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(msg.getContent()));
            case Message.ROLE_ASSISTANT -> messages.add(AiMessage.from(msg.getContent()));
            case Message.ROLE_USER -> messages.add(UserMessage.from(msg.getContent()));
            default -> {
                log.warn("[LLM] Unknown message role: {}, treating as user message", role);
                messages.add(UserMessage.from(msg.getContent()));
            }
            }
        }
        return messages;
    }

    private static LlmResponse convertResponse(ChatResponse response, String model) {
        LlmUsage usage = null;
        TokenUsage tokenUsage = response.tokenUsage();
        if (tokenUsage != null) {
            usage = LlmUsage.builder()
                    .inputTokens(orZero(tokenUsage.inputTokenCount()))
                    .outputTokens(orZero(tokenUsage.outputTokenCount()))
                    .totalTokens(orZero(tokenUsage.totalTokenCount()))
                    .build();
        }
        return LlmResponse.builder()
                .content(response.aiMessage() != null ? response.aiMessage().text() : null)
                .model(model)
                .usage(usage)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private String provider() {
        String provider = properties.getLlm().getProvider();
        return provider != null ? provider.trim().toLowerCase(Locale.ROOT) : "openai";
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", e);
        }
    }
}
