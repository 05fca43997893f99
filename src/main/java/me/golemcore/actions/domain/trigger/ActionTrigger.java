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

/**
 * Concrete fire-time semantics derived from a schedule description.
 *
 * <p>
 * Implementations are immutable and compare by value, so two triggers built
 * from the same schedule config are equal.
 */
public interface ActionTrigger {

    /**
     * First fire time for a timer armed at {@code now}, or null if the trigger
     * will never fire.
     */
    Instant firstFireTime(Instant now);

    /**
     * Fire time following {@code previousFireTime}, strictly after {@code now},
     * or null when the trigger is exhausted.
     */
    Instant nextFireTime(Instant previousFireTime, Instant now);

    /**
     * Short human-readable form, e.g. {@code interval[PT5M]}.
     */
    String describe();
}
