package me.golemcore.actions.infrastructure.event;

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


import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Thin facade over {@link ApplicationEventPublisher} for in-process events such
 * as {@link me.golemcore.actions.domain.model.ActionNotification}.
 *
 * <p>
 * Delivery is synchronous to every {@code @EventListener} on the publishing
 * thread, which for notifications is a scheduler worker.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventBus {

    private final ApplicationEventPublisher eventPublisher;

    public void publish(Object event) {
        log.debug("[Events] Publishing {}", event.getClass().getSimpleName());
        eventPublisher.publishEvent(event);
    }
}
