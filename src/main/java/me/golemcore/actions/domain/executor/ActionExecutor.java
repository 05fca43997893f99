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


import me.golemcore.actions.domain.model.ActionResult;

import java.util.Map;

/**
 * Runs one kind of scheduled action.
 *
 * <p>
 * Implementations are Spring beans collected by {@link ActionExecutorRegistry};
 * adding an action type means adding a bean. Failures are reported as
 * {@link ActionResult#error(String)} rather than thrown.
 */
public interface ActionExecutor {

    /**
     * Tag stored in {@code action_type}, e.g. {@code web_search}.
     */
    String getActionType();

    ActionResult execute(String owner, Map<String, Object> config);
}
