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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fires every {@code period}, first one period after the timer is armed.
 */
public final class IntervalActionTrigger implements ActionTrigger {

    private final Duration period;

    public IntervalActionTrigger(Duration period) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new InvalidScheduleException("Interval must be positive");
        }
        this.period = period;
    }

    public Duration getPeriod() {
        return period;
    }

    @Override
    public Instant firstFireTime(Instant now) {
        return now.plus(period);
    }

    /**
     * Keeps the original cadence: skipped periods are dropped, not replayed.
     */
    @Override
    public Instant nextFireTime(Instant previousFireTime, Instant now) {
        if (previousFireTime == null) {
            return firstFireTime(now);
        }
        Instant next = previousFireTime.plus(period);
        if (!next.isAfter(now)) {
            long behind = Duration.between(next, now).toMillis() / period.toMillis() + 1;
            next = next.plus(period.multipliedBy(behind));
        }
        return next;
    }

    @Override
    public String describe() {
        return "interval[" + period + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof IntervalActionTrigger other && period.equals(other.period);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period);
    }

    @Override
    public String toString() {
        return describe();
    }
}
