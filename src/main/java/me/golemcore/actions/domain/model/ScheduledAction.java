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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A user-defined action bound to a schedule. Owned by the
 * {@link me.golemcore.actions.port.outbound.ScheduledActionPort}; the scheduler
 * only ever holds detached snapshots.
 *
 * <p>
 * {@code actionConfig} is interpreted by the executor registered for
 * {@code actionType}, {@code scheduleConfig} by the trigger calculator for
 * {@code scheduleType}. Run timestamps are seconds since the epoch and are
 * advisory: the live timer decides when the action actually fires.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledAction {

    private String id;
    private String owner;
    private String name;
    private String description;

    private String actionType;

    @Builder.Default
    private Map<String, Object> actionConfig = new LinkedHashMap<>();

    private String scheduleType;

    @Builder.Default
    private Map<String, Object> scheduleConfig = new LinkedHashMap<>();

    @Builder.Default
    private boolean enabled = true;

    private Long lastRunAt;
    private Long nextRunAt;

    private long createdAt;
    private long updatedAt;

    /**
     * Whether this action fires at most once.
     */
    @JsonIgnore
    public boolean isOneShot() {
        return ScheduleType.ONCE.getValue().equals(scheduleType);
    }

    /**
     * Detached copy with its own config maps.
     */
    public ScheduledAction copy() {
        return toBuilder()
                .actionConfig(actionConfig != null ? new LinkedHashMap<>(actionConfig) : new LinkedHashMap<>())
                .scheduleConfig(scheduleConfig != null ? new LinkedHashMap<>(scheduleConfig) : new LinkedHashMap<>())
                .build();
    }
}
