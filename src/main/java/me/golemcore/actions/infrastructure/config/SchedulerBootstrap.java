package me.golemcore.actions.infrastructure.config;

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


import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.actions.domain.scheduler.ActionScheduler;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the {@link ActionScheduler} once the application is ready and stops it
 * on shutdown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SchedulerBootstrap {

    private final ActionScheduler scheduler;
    private final ActionsProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.getScheduler().isAutoStart()) {
            log.info("[Scheduler] Auto-start disabled");
            return;
        }
        scheduler.start();
    }

    @PreDestroy
    public void shutdown() {
        scheduler.stop();
    }
}
