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

import me.golemcore.actions.domain.exception.UnsupportedScheduleTypeException;

import java.util.Locale;

/**
 * Supported schedule kinds and their persisted tags.
 */
public enum ScheduleType {

    CRON("cron"), INTERVAL("interval"), ONCE("once");

    private final String value;

    ScheduleType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolve a persisted tag.
     *
     * @throws UnsupportedScheduleTypeException
     *             if the tag is unknown
     */
    public static ScheduleType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ScheduleType type : values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new UnsupportedScheduleTypeException(value);
    }
}
