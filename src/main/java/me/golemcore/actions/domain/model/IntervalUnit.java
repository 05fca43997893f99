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

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Units accepted by interval schedules.
 */
public enum IntervalUnit {

    SECONDS("seconds"), MINUTES("minutes"), HOURS("hours"), DAYS("days"), WEEKS("weeks");

    private final String value;

    IntervalUnit(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public Duration toDuration(long amount) {
        return switch (this) {
        case SECONDS -> Duration.ofSeconds(amount);
        case MINUTES -> Duration.ofMinutes(amount);
        case HOURS -> Duration.ofHours(amount);
        case DAYS -> Duration.ofDays(amount);
        case WEEKS -> Duration.ofDays(amount * 7);
        };
    }

    public static Optional<IntervalUnit> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (IntervalUnit unit : values()) {
            if (unit.value.equals(normalized)) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }
}
