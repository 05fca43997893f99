package me.golemcore.actions.adapter.outbound.storage;

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


import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.actions.domain.exception.ActionStorageException;
import me.golemcore.actions.domain.model.Conversation;
import me.golemcore.actions.domain.model.Message;
import me.golemcore.actions.infrastructure.config.ActionsProperties;
import me.golemcore.actions.port.outbound.ConversationPort;
import me.golemcore.actions.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * Stores conversation transcripts as {@code conversations/<owner>/<id>.json}.
 */
@Component
@Slf4j
public class JsonConversationAdapter implements ConversationPort {

    private static final int MAX_TITLE_LENGTH = 120;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String directory;

    public JsonConversationAdapter(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            ActionsProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.directory = properties.getStorage().getDirectories().getConversations();
    }

    @Override
    public synchronized String appendExchange(String owner, String conversationId, String title, String model,
            String userContent, String assistantContent) {
        Instant now = clock.instant();
        Conversation conversation = conversationId != null ? find(owner, conversationId).orElse(null) : null;
        if (conversation == null) {
            conversation = Conversation.builder()
                    .id(UUID.randomUUID().toString())
                    .owner(owner)
                    .title(title(title))
                    .model(model)
                    .messages(new ArrayList<>())
                    .createdAt(now)
                    .build();
            log.info("[Storage] New conversation {} for {}", conversation.getId(), owner);
        }

        Conversation.ConversationMessage question = Conversation.ConversationMessage.builder()
                .id(UUID.randomUUID().toString())
                .parentId(conversation.getCurrentMessageId())
                .role(Message.ROLE_USER)
                .content(userContent)
                .timestamp(now)
                .build();
        Conversation.ConversationMessage answer = Conversation.ConversationMessage.builder()
                .id(UUID.randomUUID().toString())
                .parentId(question.getId())
                .role(Message.ROLE_ASSISTANT)
                .content(assistantContent)
                .model(model)
                .timestamp(now)
                .build();
        conversation.getMessages().add(question);
        conversation.getMessages().add(answer);
        conversation.setCurrentMessageId(answer.getId());
        conversation.setUpdatedAt(now);

        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(conversation);
            storagePort.putTextAtomic(directory, path(owner, conversation.getId()), json, false).join();
        } catch (JsonProcessingException e) {
            throw new ActionStorageException("Failed to serialize conversation " + conversation.getId(), e);
        } catch (CompletionException e) {
            throw new ActionStorageException("Failed to save conversation " + conversation.getId(),
                    e.getCause() != null ? e.getCause() : e);
        }
        return conversation.getId();
    }

    @Override
    public Optional<Conversation> find(String owner, String conversationId) {
        if (conversationId == null || conversationId.isBlank() || !isSafeSegment(conversationId)) {
            return Optional.empty();
        }
        String json;
        try {
            json = storagePort.getText(directory, path(owner, conversationId)).join();
        } catch (CompletionException e) {
            throw new ActionStorageException("Failed to read conversation " + conversationId,
                    e.getCause() != null ? e.getCause() : e);
        }
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            Conversation conversation = objectMapper.readValue(json, Conversation.class);
            if (conversation.getMessages() == null) {
                conversation.setMessages(new ArrayList<>());
            }
            return Optional.of(conversation);
        } catch (JsonProcessingException e) {
            log.warn("[Storage] Unreadable conversation {}/{}: {}", owner, conversationId, e.getMessage());
            return Optional.empty();
        }
    }

    private static String path(String owner, String conversationId) {
        return ownerSegment(owner) + "/" + conversationId + ".json";
    }

    static String ownerSegment(String owner) {
        if (owner == null || owner.isBlank()) {
            return "_anonymous";
        }
        String segment = owner.replaceAll("[^A-Za-z0-9._-]", "_");
        return segment.startsWith(".") ? "_" + segment.substring(1) : segment;
    }

    private static boolean isSafeSegment(String value) {
        return value.matches("[A-Za-z0-9._-]+") && !value.contains("..");
    }

    private static String title(String title) {
        if (title == null || title.isBlank()) {
            return "Scheduled action";
        }
        String trimmed = title.trim();
        return trimmed.length() > MAX_TITLE_LENGTH ? trimmed.substring(0, MAX_TITLE_LENGTH) : trimmed;
    }
}
