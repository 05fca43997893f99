package me.golemcore.actions.domain.model;

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

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Structured outcome of an action execution: a status, an optional message and
 * type-specific details that serialize as top-level JSON fields.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionResult {

    /**
     * Detail key under which executors report a conversation they wrote to.
     */
    public static final String CONVERSATION_ID = "chat_id";

    private ActionStatus status;
    private String message;

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();

    public static ActionResult success() {
        return ActionResult.builder().status(ActionStatus.SUCCESS).build();
    }

    public static ActionResult success(String message) {
        return ActionResult.builder().status(ActionStatus.SUCCESS).message(message).build();
    }

    public static ActionResult error(String message) {
        return ActionResult.builder().status(ActionStatus.ERROR).message(message).build();
    }

    /**
     * Add a detail; null values are skipped.
     */
    public ActionResult with(String key, Object value) {
        if (value != null) {
            getDetails().put(key, value);
        }
        return this;
    }

    public Object get(String key) {
        return getDetails().get(key);
    }

    @JsonAnyGetter
    public Map<String, Object> getDetails() {
        if (details == null) {
            details = new LinkedHashMap<>();
        }
        return details;
    }

    @JsonAnySetter
    public void putDetail(String key, Object value) {
        with(key, value);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ActionStatus.SUCCESS;
    }

    /**
     * Side artifact id produced by the execution, if any.
     */
    @JsonIgnore
    public Optional<String> getConversationId() {
        Object value = get(CONVERSATION_ID);
        if (value instanceof String id && !id.isBlank()) {
            return Optional.of(id);
        }
        return Optional.empty();
    }
}
