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


import me.golemcore.actions.domain.exception.InvalidScheduleException;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recurring trigger for a classic 5-field cron expression
 * ({@code minute hour day-of-month month day-of-week}).
 *
 * <p>
 * Spring's {@link CronExpression} matches day-of-month AND day-of-week. Classic
 * cron fires when either matches if both are restricted, so in that case the
 * expression is split in two and the earlier candidate wins. A field starting
 * with {@code *} (such as {@code *}{@code /2}) counts as unrestricted.
 */
public final class CronActionTrigger implements ActionTrigger {

    private static final int FIELD_COUNT = 5;
    private static final int DAY_OF_MONTH = 2;
    private static final int DAY_OF_WEEK = 4;

    private final String expression;
    private final ZoneId zone;
    private final List<CronExpression> alternatives;

    public CronActionTrigger(String expression, ZoneId zone) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("Cron expression is required");
        }
        this.expression = expression.trim();
        this.zone = Objects.requireNonNull(zone, "zone");
        this.alternatives = parse(this.expression);
    }

    public String getExpression() {
        return expression;
    }

    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Instant firstFireTime(Instant now) {
        return after(now);
    }

    @Override
    public Instant nextFireTime(Instant previousFireTime, Instant now) {
        Instant base = previousFireTime == null || previousFireTime.isBefore(now) ? now : previousFireTime;
        return after(base);
    }

    private Instant after(Instant instant) {
        ZonedDateTime from = ZonedDateTime.ofInstant(instant, zone);
        ZonedDateTime best = null;
        for (CronExpression cron : alternatives) {
            ZonedDateTime candidate = cron.next(from);
            if (candidate != null && (best == null || candidate.isBefore(best))) {
                best = candidate;
            }
        }
        return best != null ? best.toInstant() : null;
    }

    @Override
    public String describe() {
        return "cron[" + expression + ", " + zone.getId() + "]";
    }

    private static List<CronExpression> parse(String expression) {
        String[] fields = expression.split("\\s+");
        if (fields.length != FIELD_COUNT) {
            throw new InvalidScheduleException(
                    "Cron expression must have exactly 5 fields, got " + fields.length + ": " + expression);
        }
        List<CronExpression> result = new ArrayList<>(2);
        if (isRestricted(fields[DAY_OF_MONTH]) && isRestricted(fields[DAY_OF_WEEK])) {
            String[] byDayOfMonth = fields.clone();
            byDayOfMonth[DAY_OF_WEEK] = "*";
            String[] byDayOfWeek = fields.clone();
            byDayOfWeek[DAY_OF_MONTH] = "*";
            result.add(toSpring(byDayOfMonth, expression));
            result.add(toSpring(byDayOfWeek, expression));
        } else {
            result.add(toSpring(fields, expression));
        }
        return List.copyOf(result);
    }

    private static boolean isRestricted(String field) {
        return !field.startsWith("*") && !"?".equals(field);
    }

    private static CronExpression toSpring(String[] fields, String original) {
        try {
            return CronExpression.parse("0 " + String.join(" ", fields));
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + original + "': " + e.getMessage(), e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CronActionTrigger other)) {
            return false;
        }
        return expression.equals(other.expression) && zone.equals(other.zone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, zone);
    }

    @Override
    public String toString() {
        return describe();
    }
}
