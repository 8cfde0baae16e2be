package me.golemcore.coder.infrastructure.config;

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

import lombok.Data;
import me.golemcore.coder.domain.model.AgentMode;
import me.golemcore.coder.domain.model.ToolPermission;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the coding agent, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code coder.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model backend and pricing</li>
 * <li>{@link AgentProperties} - turn loop limits, compaction, streaming</li>
 * <li>{@link ApprovalProperties} - human-in-the-loop approval timeouts</li>
 * <li>{@link ShellProperties} - command executor sandbox and allow/deny
 * lists</li>
 * <li>{@link ToolsProperties} - per-tool permissions</li>
 * <li>{@link StorageProperties} - session logs</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "coder")
@Data
public class CoderProperties {

    private LlmProperties llm = new LlmProperties();
    private AgentProperties agent = new AgentProperties();
    private ApprovalProperties approval = new ApprovalProperties();
    private ShellProperties shell = new ShellProperties();
    private ToolsProperties tools = new ToolsProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class LlmProperties {
        private String provider = "openai";
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private double temperature = 0.2;
        private Integer maxTokens;
        private boolean streaming = true;
        private int requestTimeoutSeconds = 300;
        private double inputPricePerMillion = 0.0;
        private double outputPricePerMillion = 0.0;
    }

    @Data
    public static class AgentProperties {
        private String systemPrompt = "You are a careful coding agent working inside the user's project workspace. "
                + "Use the available tools to inspect and change files and run commands.";
        private int maxTurns = 0; // 0 = unlimited
        private double maxPrice = 0.0; // 0 = unlimited
        private long autoCompactThreshold = 200_000;
        private boolean contextWarnings = false;
        private double warningRatio = 0.5;
        private int streamBatchSize = 5;
        private boolean deterministicStreaming = false;
        private boolean parallelToolExecution = true;
        private int historyLimit = 100;
        private AgentMode initialMode = AgentMode.NORMAL;
        private boolean autoApprove = false;
    }

    @Data
    public static class ApprovalProperties {
        private int timeoutSeconds = 0; // 0 = wait until resolved or expired
        private int ttlSeconds = 900;
        private int sweepIntervalSeconds = 30;
    }

    @Data
    public static class ShellProperties {
        private String workspace = ".";
        private int defaultTimeout = 30;
        private int maxTimeout = 300;
        private List<String> allowedExecutables = new ArrayList<>();
        private List<String> allowedEnvVars = new ArrayList<>();
        private List<String> allowlist = new ArrayList<>(List.of(
                "echo", "find", "git diff", "git log", "git status", "tree", "whoami",
                "cat", "file", "head", "ls", "pwd", "stat", "tail", "uname", "wc", "which"));
        private List<String> denylist = new ArrayList<>(List.of(
                "rm -rf", "rm -fr", "sudo", "su ", "gdb", "pdb", "passwd", "nano", "vim", "vi ", "emacs",
                "bash -i", "sh -i", "zsh -i", "fish -i", "dash -i", "screen", "tmux",
                "shutdown", "reboot", "mkfs", "dd if="));
        private List<String> denylistStandalone = new ArrayList<>(List.of(
                "python", "python3", "ipython", "bash", "sh", "zsh", "nohup", "vi", "vim", "emacs", "nano", "su"));
    }

    @Data
    public static class ToolsProperties {
        private Map<String, ToolPermission> permissions = new HashMap<>();
        private int maxOutputChars = 50_000;
    }

    @Data
    public static class StorageProperties {
        private String sessionsDirectory = ".golemcore-coder/sessions";
    }
}
