package me.golemcore.actions.adapter.outbound.notification;

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
import me.golemcore.actions.domain.model.ActionNotification;
import me.golemcore.actions.infrastructure.event.SpringEventBus;
import me.golemcore.actions.port.outbound.NotificationPort;
import org.springframework.stereotype.Component;

/**
 * Delivers notifications as {@link ActionNotification} application events so
 * any listener (websocket push, mail, chat) can pick them up.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventNotificationAdapter implements NotificationPort {

    private final SpringEventBus eventBus;

    @Override
    public void send(ActionNotification notification) {
        log.info("[Notify] {} [{}] {} - {}", notification.owner(), notification.type(), notification.title(),
                notification.message());
        eventBus.publish(notification);
    }
}
