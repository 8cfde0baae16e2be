package me.golemcore.coder.tools;

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

import me.golemcore.coder.domain.component.ToolValidationException;

import java.util.Map;

/**
 * Typed access to tool arguments parsed from the model's JSON.
 */
final class ToolArguments {

    private ToolArguments() {
    }

    static String requireString(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (!(value instanceof String text) || text.isBlank()) {
            throw new ToolValidationException("Missing required parameter: " + name);
        }
        return text;
    }

    /**
     * Like {@link #requireString} but allows an empty string.
     */
    static String requireText(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (!(value instanceof String text)) {
            throw new ToolValidationException("Missing required parameter: " + name);
        }
        return text;
    }

    static String optionalString(Map<String, Object> parameters, String name, String defaultValue) {
        Object value = parameters.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof String text)) {
            throw new ToolValidationException("Parameter '" + name + "' must be a string");
        }
        return text.isBlank() ? defaultValue : text;
    }

    static Integer optionalInt(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new ToolValidationException("Parameter '" + name + "' must be an integer");
            }
        }
        throw new ToolValidationException("Parameter '" + name + "' must be an integer");
    }

    static boolean optionalBoolean(Map<String, Object> parameters, String name, boolean defaultValue) {
        Object value = parameters.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            return Boolean.parseBoolean(text.trim());
        }
        throw new ToolValidationException("Parameter '" + name + "' must be a boolean");
    }
}
