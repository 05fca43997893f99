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


import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.actions.domain.model.ActionResult;
import me.golemcore.actions.domain.model.LlmRequest;
import me.golemcore.actions.domain.model.LlmResponse;
import me.golemcore.actions.domain.model.Message;
import me.golemcore.actions.port.outbound.ConversationPort;
import me.golemcore.actions.port.outbound.LlmPort;
import me.golemcore.actions.port.outbound.MemoryPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Action {@code chat_completion}: sends {@code prompt} (with an optional
 * {@code system_prompt}) to the configured LLM.
 *
 * <p>
 * The answer can be appended to a conversation ({@code save_to_chat}) and/or
 * stored as a memory note ({@code save_to_memory}); both are off by default.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatCompletionExecutor implements ActionExecutor {

    public static final String TYPE = "chat_completion";

    private final LlmPort llmPort;
    private final ConversationPort conversationPort;
    private final MemoryPort memoryPort;

    @Override
    public String getActionType() {
        return TYPE;
    }

    @Override
    public ActionResult execute(String owner, Map<String, Object> config) {
        String prompt = ConfigValues.getString(config, "prompt", null);
        if (prompt == null) {
            return ActionResult.error("No prompt provided");
        }
        String model = ConfigValues.getString(config, "model", null);
        if (model == null) {
            return ActionResult.error("No model specified");
        }
        if (!llmPort.isAvailable()) {
            return ActionResult.error("LLM provider " + llmPort.getProviderId() + " is not configured");
        }

        log.info("[Executor] Chat completion for {} with model {}", owner, model);
        LlmRequest request = LlmRequest.builder()
                .model(model)
                .systemPrompt(ConfigValues.getString(config, "system_prompt", null))
                .build();
        request.addMessage(Message.user(prompt));

        String response;
        try {
            LlmResponse llmResponse = llmPort.chat(request).get();
            response = llmResponse != null && llmResponse.getContent() != null ? llmResponse.getContent() : "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ActionResult.error("Chat completion interrupted");
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Executor] Chat completion failed for {}", owner, cause);
            return ActionResult.error("Chat completion failed: " + cause.getMessage());
        } catch (RuntimeException e) {
            log.error("[Executor] Chat completion failed for {}", owner, e);
            return ActionResult.error("Chat completion failed: " + e.getMessage());
        }

        ActionResult result = ActionResult.success()
                .with("model", model)
                .with("prompt", prompt)
                .with("response", response);

        if (ConfigValues.getBoolean(config, "save_to_chat", false)) {
            try {
                String chatId = conversationPort.appendExchange(owner,
                        ConfigValues.getString(config, "chat_id", null), prompt, model, prompt, response);
                result.with(ActionResult.CONVERSATION_ID, chatId);
            } catch (RuntimeException e) {
                log.warn("[Executor] Failed to save completion to chat for {}: {}", owner, e.getMessage());
            }
        }
        if (ConfigValues.getBoolean(config, "save_to_memory", false)) {
            try {
                memoryPort.remember(owner, "Automated chat:\nQ: " + prompt + "\nA: " + response);
            } catch (RuntimeException e) {
                log.warn("[Executor] Failed to save completion to memory for {}: {}", owner, e.getMessage());
            }
        }
        return result;
    }
}
