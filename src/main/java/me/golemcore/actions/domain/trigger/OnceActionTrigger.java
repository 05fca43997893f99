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


import java.time.Instant;
import java.util.Objects;

/**
 * Fires a single time at {@code runAt}. A date already in the past fires as
 * soon as the timer is armed.
 */
public final class OnceActionTrigger implements ActionTrigger {

    private final Instant runAt;

    public OnceActionTrigger(Instant runAt) {
        this.runAt = Objects.requireNonNull(runAt, "runAt");
    }

    public Instant getRunAt() {
        return runAt;
    }

    @Override
    public Instant firstFireTime(Instant now) {
        return runAt.isBefore(now) ? now : runAt;
    }

    @Override
    public Instant nextFireTime(Instant previousFireTime, Instant now) {
        return null;
    }

    @Override
    public String describe() {
        return "date[" + runAt + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof OnceActionTrigger other && runAt.equals(other.runAt);
    }

    @Override
    public int hashCode() {
        return runAt.hashCode();
    }

    @Override
    public String toString() {
        return describe();
    }
}
