package me.golemcore.coder.adapter.inbound.command;

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
import me.golemcore.coder.domain.loop.CodingAgent;
import me.golemcore.coder.domain.mode.ModeManager;
import me.golemcore.coder.domain.model.AgentMode;
import me.golemcore.coder.domain.model.AgentStats;
import me.golemcore.coder.domain.model.ApprovalVerdict;
import me.golemcore.coder.domain.model.PendingApproval;
import me.golemcore.coder.domain.service.ApprovalGate;
import me.golemcore.coder.port.inbound.SessionCommandPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Slash commands of a coding session.
 *
 * <ul>
 * <li>{@code /mode} shows the mode, {@code /mode <name>} switches to it and
 * {@code /mode next} cycles</li>
 * <li>{@code /clear} drops the history and starts a new session</li>
 * <li>{@code /compact} replaces the history with a summary</li>
 * <li>{@code /status} shows tokens, cost and tool counters</li>
 * <li>{@code /approve <id> [yes|no|always] [message]} answers a pending
 * approval</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionCommandHandler implements SessionCommandPort {

    private static final String CMD_MODE = "mode";
    private static final String CMD_CLEAR = "clear";
    private static final String CMD_COMPACT = "compact";
    private static final String CMD_STATUS = "status";
    private static final String CMD_APPROVE = "approve";
    private static final String SUBCMD_NEXT = "next";

    private static final List<CommandDefinition> COMMANDS = List.of(
            new CommandDefinition(CMD_MODE, "Show or switch the agent mode", "/mode [name|next]"),
            new CommandDefinition(CMD_CLEAR, "Clear the conversation history", "/clear"),
            new CommandDefinition(CMD_COMPACT, "Summarize the conversation to free context", "/compact"),
            new CommandDefinition(CMD_STATUS, "Show session statistics", "/status"),
            new CommandDefinition(CMD_APPROVE, "Answer a pending tool approval",
                    "/approve <id> [yes|no|always] [message]"));

    private static final Set<String> KNOWN_COMMANDS = Set.of(CMD_MODE, CMD_CLEAR, CMD_COMPACT, CMD_STATUS,
            CMD_APPROVE);

    private final ApprovalGate approvalGate;

    @Override
    public CommandResult execute(CodingAgent agent, String command, List<String> args) {
        String name = command.startsWith("/") ? command.substring(1) : command;
        log.debug("[Command] /{} for session {}", name, agent.getSessionId());
        return switch (name) {
        case CMD_MODE -> handleMode(agent, args);
        case CMD_CLEAR -> handleClear(agent);
        case CMD_COMPACT -> handleCompact(agent);
        case CMD_STATUS -> handleStatus(agent);
        case CMD_APPROVE -> handleApprove(args);
        default -> CommandResult.failure("Unknown command: /" + name);
        };
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMANDS.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return COMMANDS;
    }

    private CommandResult handleMode(CodingAgent agent, List<String> args) {
        ModeManager modeManager = agent.getModeManager();
        if (args.isEmpty()) {
            return CommandResult.success(modeManager.describeMode() + "\n\nAvailable modes:\n"
                    + String.join("\n", ModeManager.listModes()));
        }
        String target = args.get(0);
        if (SUBCMD_NEXT.equalsIgnoreCase(target)) {
            return CommandResult.success(agent.cycleMode());
        }
        try {
            AgentMode previous = modeManager.getMode();
            AgentMode current = modeManager.setModeFromName(target);
            return CommandResult.success(ModeManager.getTransitionMessage(previous, current));
        } catch (IllegalArgumentException e) {
            return CommandResult.failure(e.getMessage());
        }
    }

    private CommandResult handleClear(CodingAgent agent) {
        agent.clearHistory();
        return CommandResult.success("Conversation history cleared. New session: " + agent.getSessionId());
    }

    private CommandResult handleCompact(CodingAgent agent) {
        if (agent.getConversation().size() <= 1) {
            return CommandResult.success("Nothing to compact.");
        }
        long before = agent.getStats().getContextTokens();
        agent.compact();
        return CommandResult.success("Conversation compacted: " + before + " -> "
                + agent.getStats().getContextTokens() + " tokens.");
    }

    private CommandResult handleStatus(CodingAgent agent) {
        AgentStats stats = agent.getStats();
        String status = String.format(Locale.ROOT, """
                Session: %s
                Mode: %s
                Messages: %d
                Steps: %d
                Tokens: %d prompt / %d completion (context %d)
                Cost: $%.4f
                Tool calls: %d agreed, %d rejected, %d succeeded, %d failed
                Pending approvals: %d""",
                agent.getSessionId(),
                agent.getModeManager().getModeIndicator(),
                agent.getConversation().size(),
                stats.getSteps(),
                stats.getSessionPromptTokens(), stats.getSessionCompletionTokens(), stats.getContextTokens(),
                stats.getSessionCost(),
                stats.getToolCallsAgreed(), stats.getToolCallsRejected(),
                stats.getToolCallsSucceeded(), stats.getToolCallsFailed(),
                approvalGate.pendingCount());
        return CommandResult.success(status);
    }

    private CommandResult handleApprove(List<String> args) {
        if (args.isEmpty()) {
            return CommandResult.failure("Usage: /approve <id> [yes|no|always] [message]");
        }
        String correlationId = args.get(0);
        Optional<PendingApproval> pending = approvalGate.getPending(correlationId);
        if (pending.isEmpty()) {
            return CommandResult.failure("No pending approval with id " + correlationId);
        }

        ApprovalVerdict verdict = ApprovalVerdict.YES;
        if (args.size() > 1) {
            try {
                verdict = ApprovalVerdict.valueOf(args.get(1).toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return CommandResult.failure("Unknown verdict '" + args.get(1) + "'. Use yes, no or always.");
            }
        }
        String message = args.size() > 2 ? String.join(" ", args.subList(2, args.size())) : null;

        boolean resolved = approvalGate.resolve(correlationId, verdict, message);
        if (!resolved) {
            return CommandResult.failure("Approval " + correlationId + " was already resolved");
        }
        return CommandResult.success("Tool '" + pending.get().toolName() + "': " + verdict);
    }
}
