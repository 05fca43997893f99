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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Partial update of a scheduled action. Null fields are left untouched.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledActionUpdate {

    private String name;
    private String description;
    private Map<String, Object> actionConfig;
    private String scheduleType;
    private Map<String, Object> scheduleConfig;
    private Boolean enabled;

    public static ScheduledActionUpdate enabled(boolean enabled) {
        return ScheduledActionUpdate.builder().enabled(enabled).build();
    }

    public boolean touchesSchedule() {
        return scheduleType != null || scheduleConfig != null;
    }
}
