package me.golemcore.coder.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.component.ToolComponent;
import me.golemcore.coder.domain.model.ToolDefinition;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name-keyed table of the tools available to the model, built once from all
 * {@link ToolComponent} beans.
 */
@Service
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools;

    public ToolRegistry(List<ToolComponent> components) {
        Map<String, ToolComponent> byName = new LinkedHashMap<>();
        for (ToolComponent component : components) {
            String name = component.getToolName();
            ToolComponent previous = byName.putIfAbsent(name, component);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + name);
            }
        }
        this.tools = Collections.unmodifiableMap(byName);
        log.info("[Tools] Registered {} tools: {}", tools.size(), tools.keySet());
    }

    public Optional<ToolComponent> getTool(String name) {
        ToolComponent tool = name != null ? tools.get(name) : null;
        if (tool == null || !tool.isEnabled()) {
            return Optional.empty();
        }
        return Optional.of(tool);
    }

    public List<ToolDefinition> getDefinitions() {
        return tools.values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .toList();
    }

    public List<String> getToolNames() {
        return tools.values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getToolName)
                .toList();
    }
}
