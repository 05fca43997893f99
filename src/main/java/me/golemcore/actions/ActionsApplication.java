package me.golemcore.actions;

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


import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Scheduled actions service.
 *
 * <p>
 * Users attach an action (web search, LLM completion, notification) to a cron,
 * interval or one-time schedule; the service runs it unattended and keeps run
 * bookkeeping next to the definition.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Inbound        ScheduledActionsController (REST)
 * Domain         ScheduledActionService, ActionScheduler, TriggerCalculator, executors
 * Outbound       JSON storage, langchain4j, Brave/SearXNG/Tavily, notification events
 * </pre>
 *
 * <p>
 * Configuration lives under {@code actions.*} in
 * {@code application.properties}.
 *
 * @since 1.0
 */
@SpringBootApplication
public class ActionsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ActionsApplication.class, args);
    }

}
