package me.golemcore.coder.domain.loop;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.middleware.AutoCompactMiddleware;
import me.golemcore.coder.domain.middleware.ContextWarningMiddleware;
import me.golemcore.coder.domain.middleware.MiddlewarePipeline;
import me.golemcore.coder.domain.middleware.PriceLimitMiddleware;
import me.golemcore.coder.domain.middleware.TurnLimitMiddleware;
import me.golemcore.coder.domain.mode.ModeManager;
import me.golemcore.coder.domain.model.AgentStats;
import me.golemcore.coder.domain.model.Conversation;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.SessionSnapshot;
import me.golemcore.coder.domain.service.ApprovalGate;
import me.golemcore.coder.domain.service.CompactionService;
import me.golemcore.coder.domain.service.ToolAuthorizer;
import me.golemcore.coder.domain.service.ToolRegistry;
import me.golemcore.coder.domain.service.command.CommandEnvironment;
import me.golemcore.coder.domain.service.command.SecureCommandExecutor;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.InteractionLogPort;
import me.golemcore.coder.port.outbound.ModelBackendPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Builds one {@link CodingAgent} per session from the shared beans. Mode state,
 * the shell working directory, "always" grants and middleware counters belong
 * to the agent and are never shared between sessions.
 */
@Service
@Slf4j
public class CodingAgentFactory {

    private final CoderProperties properties;
    private final ToolRegistry toolRegistry;
    private final ApprovalGate approvalGate;
    private final ModelBackendPort modelBackend;
    private final InteractionLogPort interactionLog;
    private final CompactionService compactionService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final CommandEnvironment commandEnvironment;
    private final ExecutorService commandIoExecutor;

    public CodingAgentFactory(CoderProperties properties, ToolRegistry toolRegistry, ApprovalGate approvalGate,
            ModelBackendPort modelBackend, InteractionLogPort interactionLog, CompactionService compactionService,
            ObjectMapper objectMapper, Clock clock, CommandEnvironment commandEnvironment,
            @Qualifier("commandIoExecutor") ExecutorService commandIoExecutor) {
        this.properties = properties;
        this.toolRegistry = toolRegistry;
        this.approvalGate = approvalGate;
        this.modelBackend = modelBackend;
        this.interactionLog = interactionLog;
        this.compactionService = compactionService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.commandEnvironment = commandEnvironment;
        this.commandIoExecutor = commandIoExecutor;
    }

    public CodingAgent create() {
        CoderProperties.AgentProperties agent = properties.getAgent();

        ModeManager modeManager = new ModeManager(agent.getInitialMode(), agent.getHistoryLimit(), clock);
        if (agent.isAutoApprove()) {
            modeManager.forceAutoApprove(true);
        }

        AgentStats stats = new AgentStats();
        stats.setInputPricePerMillion(properties.getLlm().getInputPricePerMillion());
        stats.setOutputPricePerMillion(properties.getLlm().getOutputPricePerMillion());

        Path workspace = Paths.get(properties.getShell().getWorkspace()).toAbsolutePath().normalize();
        SecureCommandExecutor executor = new SecureCommandExecutor(workspace, commandEnvironment,
                properties.getShell().getAllowedExecutables(), commandIoExecutor);

        CodingAgent codingAgent = CodingAgent.builder()
                .conversation(new Conversation(Message.system(agent.getSystemPrompt())))
                .stats(stats)
                .modeManager(modeManager)
                .authorizer(new ToolAuthorizer(modeManager, toolRegistry, properties.getTools().getPermissions()))
                .toolRegistry(toolRegistry)
                .approvalGate(approvalGate)
                .modelBackend(modelBackend)
                .interactionLog(interactionLog)
                .compactionService(compactionService)
                .pipeline(buildPipeline(agent))
                .commandExecutor(executor)
                .objectMapper(objectMapper)
                .properties(properties)
                .workspace(workspace)
                .clock(clock)
                .build();
        log.info("[Agent] Created session {} in {} mode (workspace: {})", codingAgent.getSessionId(),
                modeManager.getMode(), workspace);
        return codingAgent;
    }

    /**
     * Creates an agent continuing the persisted session {@code sessionId}.
     */
    public Optional<CodingAgent> resume(String sessionId) {
        return interactionLog.loadSession(sessionId).map(this::resumeFrom);
    }

    /**
     * Creates an agent continuing the most recently saved session.
     */
    public Optional<CodingAgent> resumeLatest() {
        return interactionLog.findLatestSession().map(this::resumeFrom);
    }

    MiddlewarePipeline buildPipeline(CoderProperties.AgentProperties agent) {
        MiddlewarePipeline pipeline = new MiddlewarePipeline();
        if (agent.getMaxTurns() > 0) {
            pipeline.add(new TurnLimitMiddleware(agent.getMaxTurns()));
        }
        if (agent.getMaxPrice() > 0) {
            pipeline.add(new PriceLimitMiddleware(agent.getMaxPrice()));
        }
        if (agent.getAutoCompactThreshold() > 0) {
            pipeline.add(new AutoCompactMiddleware(agent.getAutoCompactThreshold()));
            if (agent.isContextWarnings()) {
                pipeline.add(new ContextWarningMiddleware(agent.getWarningRatio(), agent.getAutoCompactThreshold()));
            }
        }
        return pipeline;
    }

    private CodingAgent resumeFrom(SessionSnapshot snapshot) {
        CodingAgent codingAgent = create();
        codingAgent.resumeFrom(snapshot);
        return codingAgent;
    }
}
