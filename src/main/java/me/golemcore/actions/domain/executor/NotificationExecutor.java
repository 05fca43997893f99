package me.golemcore.actions.domain.executor;

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
import me.golemcore.actions.domain.model.ActionResult;
import me.golemcore.actions.port.outbound.NotificationPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Action {@code notification}: delivers {@code title}, {@code message} and
 * {@code type} (info, success, warning, error) to the owner.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationExecutor implements ActionExecutor {

    public static final String TYPE = "notification";

    static final String DEFAULT_TITLE = "Scheduled Action";
    static final String DEFAULT_MESSAGE = "Your scheduled action has completed";
    static final String DEFAULT_TYPE = "info";

    private final NotificationPort notificationPort;
    private final Clock clock;

    @Override
    public String getActionType() {
        return TYPE;
    }

    @Override
    public ActionResult execute(String owner, Map<String, Object> config) {
        String title = ConfigValues.getString(config, "title", DEFAULT_TITLE);
        String message = ConfigValues.getString(config, "message", DEFAULT_MESSAGE);
        String type = ConfigValues.getString(config, "type", DEFAULT_TYPE);
        try {
            notificationPort.send(new ActionNotification(owner, title, message, type, clock.instant()));
        } catch (RuntimeException e) {
            log.error("[Executor] Failed to notify {}", owner, e);
            return ActionResult.error("Failed to send notification: " + e.getMessage());
        }
        return ActionResult.success(message)
                .with("title", title)
                .with("type", type);
    }
}
