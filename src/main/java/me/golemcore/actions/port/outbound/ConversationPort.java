package me.golemcore.actions.port.outbound;

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

import me.golemcore.actions.domain.model.Conversation;

import java.util.Optional;

/**
 * Port for conversation transcripts written by scheduled actions.
 */
public interface ConversationPort {

    /**
     * Append a user/assistant exchange to a conversation.
     *
     * @param conversationId
     *            existing conversation to continue; null, unknown or foreign ids
     *            start a new conversation titled {@code title}
     * @return id of the conversation the exchange was written to
     */
    String appendExchange(String owner, String conversationId, String title, String model,
            String userContent, String assistantContent);

    Optional<Conversation> find(String owner, String conversationId);
}
