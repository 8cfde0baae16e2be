package me.golemcore.coder.domain.service.command;

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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Minimal environment handed to child processes. Only allow-listed variable
 * names are copied from the source map, so provider API keys and other ambient
 * secrets never reach a subprocess.
 */
public final class CommandEnvironment {

    public static final Set<String> DEFAULT_ALLOWED_VARS = Set.of(
            "PATH", "HOME", "USER", "SHELL", "TERM", "LANG", "LC_ALL", "TZ", "TMPDIR");

    private static final String XDG_PREFIX = "XDG_";

    private final Map<String, String> variables;

    private CommandEnvironment(Map<String, String> variables) {
        this.variables = Collections.unmodifiableMap(variables);
    }

    /**
     * Filters {@code source} down to the allowed names plus any configured
     * extras.
     */
    public static CommandEnvironment filter(Map<String, String> source, Collection<String> extraAllowed) {
        Set<String> allowed = new TreeSet<>(DEFAULT_ALLOWED_VARS);
        if (extraAllowed != null) {
            extraAllowed.stream()
                    .map(String::trim)
                    .filter(name -> !name.isEmpty())
                    .forEach(allowed::add);
        }
        Map<String, String> filtered = new LinkedHashMap<>();
        source.forEach((name, value) -> {
            if (value != null && (allowed.contains(name) || name.startsWith(XDG_PREFIX))) {
                filtered.put(name, value);
            }
        });
        return new CommandEnvironment(filtered);
    }

    public static CommandEnvironment of(Map<String, String> variables) {
        return new CommandEnvironment(new LinkedHashMap<>(variables));
    }

    public Map<String, String> getVariables() {
        return variables;
    }

    public String get(String name) {
        return variables.get(name);
    }
}
