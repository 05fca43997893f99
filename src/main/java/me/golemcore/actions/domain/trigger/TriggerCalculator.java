package me.golemcore.actions.domain.trigger;

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
import me.golemcore.actions.domain.exception.InvalidScheduleException;
import me.golemcore.actions.domain.model.IntervalUnit;
import me.golemcore.actions.domain.model.ScheduleType;
import me.golemcore.actions.infrastructure.config.ActionsProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Turns a persisted {@code (schedule_type, schedule_config)} pair into an
 * {@link ActionTrigger}.
 *
 * <p>
 * Supported configs:
 * <ul>
 * <li>cron - {@code {expression: "m h dom mon dow"}}, defaults to
 * {@code 0 9 * * *}</li>
 * <li>interval - {@code {value: int, unit: seconds|minutes|hours|days|weeks}},
 * defaults to 60 minutes</li>
 * <li>once - {@code {datetime: ISO-8601}}; {@code run_at} is accepted as an
 * alias</li>
 * </ul>
 *
 * <p>
 * Pure mapping without side effects: equal input gives equal triggers.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class TriggerCalculator {

    static final String DEFAULT_CRON = "0 9 * * *";
    static final long DEFAULT_INTERVAL_VALUE = 60;
    static final IntervalUnit DEFAULT_INTERVAL_UNIT = IntervalUnit.MINUTES;

    private final ZoneId zone;

    public TriggerCalculator(Clock clock, ActionsProperties properties) {
        String configured = properties.getScheduler().getTimeZone();
        this.zone = configured == null || configured.isBlank() ? clock.getZone() : ZoneId.of(configured.trim());
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * @throws me.golemcore.actions.domain.exception.UnsupportedScheduleTypeException
     *             for an unknown type
     * @throws InvalidScheduleException
     *             for a config that cannot produce a trigger
     */
    public ActionTrigger calculate(String scheduleType, Map<String, Object> config) {
        return calculate(ScheduleType.fromValue(scheduleType), config);
    }

    public ActionTrigger calculate(ScheduleType type, Map<String, Object> config) {
        Map<String, Object> safeConfig = config != null ? config : Map.of();
        return switch (type) {
        case CRON -> cron(safeConfig);
        case INTERVAL -> interval(safeConfig);
        case ONCE -> once(safeConfig);
        };
    }

    private ActionTrigger cron(Map<String, Object> config) {
        Object expression = config.get("expression");
        String value = expression != null ? expression.toString() : DEFAULT_CRON;
        return new CronActionTrigger(value, zone);
    }

    private ActionTrigger interval(Map<String, Object> config) {
        long value = intervalValue(config.get("value"));
        Object rawUnit = config.get("unit");
        IntervalUnit unit = rawUnit == null
                ? DEFAULT_INTERVAL_UNIT
                : IntervalUnit.fromValue(rawUnit.toString())
                        .orElseThrow(() -> new InvalidScheduleException("Unknown interval unit: " + rawUnit));
        try {
            return new IntervalActionTrigger(unit.toDuration(value));
        } catch (ArithmeticException e) {
            throw new InvalidScheduleException("Interval too large: " + value + " " + unit.getValue(), e);
        }
    }

    private static long intervalValue(Object raw) {
        if (raw == null) {
            return DEFAULT_INTERVAL_VALUE;
        }
        long value;
        try {
            BigDecimal number = raw instanceof Number n ? new BigDecimal(n.toString())
                    : new BigDecimal(raw.toString().trim());
            value = number.longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidScheduleException("Interval value must be an integer: " + raw, e);
        }
        if (value <= 0) {
            throw new InvalidScheduleException("Interval value must be positive: " + raw);
        }
        return value;
    }

    private ActionTrigger once(Map<String, Object> config) {
        Object raw = config.get("datetime");
        if (raw == null) {
            raw = config.get("run_at");
        }
        if (raw == null || raw.toString().isBlank()) {
            throw new InvalidScheduleException("One-time schedule requires a datetime");
        }
        return new OnceActionTrigger(parseInstant(raw.toString().trim()));
    }

    Instant parseInstant(String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            log.trace("[Trigger] '{}' has no offset", text);
        }
        try {
            return LocalDateTime.parse(text.replace(' ', 'T')).atZone(zone).toInstant();
        } catch (DateTimeParseException ignored) {
            log.trace("[Trigger] '{}' is not a local date-time", text);
        }
        try {
            return LocalDate.parse(text).atStartOfDay(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidScheduleException("Invalid datetime: " + text, e);
        }
    }
}
