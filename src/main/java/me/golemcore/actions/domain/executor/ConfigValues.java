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


import java.util.Map;

/**
 * Lenient readers for the free-form {@code action_config} map, which arrives
 * from JSON and may carry numbers or booleans as strings.
 */
public final class ConfigValues {

    private ConfigValues() {
    }

    public static String getString(Map<String, Object> config, String key, String defaultValue) {
        Object value = config != null ? config.get(key) : null;
        if (value == null) {
            return defaultValue;
        }
        String text = value.toString();
        return text.isBlank() ? defaultValue : text;
    }

    public static int getInt(Map<String, Object> config, String key, int defaultValue) {
        Object value = config != null ? config.get(key) : null;
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public static boolean getBoolean(Map<String, Object> config, String key, boolean defaultValue) {
        Object value = config != null ? config.get(key) : null;
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s && !s.isBlank()) {
            return Boolean.parseBoolean(s.trim());
        }
        return defaultValue;
    }
}
