package me.golemcore.coder.adapter.inbound.console;

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
import me.golemcore.coder.domain.loop.CodingAgentFactory;
import me.golemcore.coder.domain.model.AgentEvent;
import me.golemcore.coder.domain.model.ApprovalRequestedEvent;
import me.golemcore.coder.domain.model.ApprovalResolvedEvent;
import me.golemcore.coder.domain.model.ApprovalVerdict;
import me.golemcore.coder.domain.model.AssistantEvent;
import me.golemcore.coder.domain.model.CompactEndEvent;
import me.golemcore.coder.domain.model.CompactStartEvent;
import me.golemcore.coder.domain.model.PendingApproval;
import me.golemcore.coder.domain.model.ToolCallEvent;
import me.golemcore.coder.domain.model.ToolResultEvent;
import me.golemcore.coder.port.inbound.SessionCommandPort;
import me.golemcore.coder.port.outbound.ModelBackendException;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Line-based terminal front end. Plain lines start a turn, {@code /...} lines
 * are session commands, and while an approval is pending {@code y}, {@code n}
 * or {@code a} answers the oldest one.
 *
 * <p>
 * Start with {@code --resume} to continue the most recent session. Disabled
 * with {@code coder.console.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "coder.console", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ConsoleAdapter implements CommandLineRunner {

    private static final String EXIT = "/exit";
    private static final int ARGUMENT_PREVIEW = 300;

    private final CodingAgentFactory agentFactory;
    private final SessionCommandPort commands;
    private final ApplicationEventPublisher eventPublisher;

    private final Deque<PendingApproval> pendingApprovals = new ConcurrentLinkedDeque<>();
    private final PrintStream out = System.out;

    private volatile Disposable runningTurn;

    @Override
    public void run(String... args) {
        boolean resume = Arrays.asList(args).contains("--resume");
        CodingAgent agent = resume
                ? agentFactory.resumeLatest().orElseGet(agentFactory::create)
                : agentFactory.create();
        out.println("golemcore-coder session " + agent.getSessionId() + " - "
                + agent.getModeManager().getModeIndicator() + ". Type /exit to quit.");

        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                String input = line.trim();
                if (EXIT.equals(input)) {
                    break;
                }
                if (!input.isEmpty()) {
                    handleLine(agent, input);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read console input", e);
        } finally {
            agent.cancel();
        }
    }

    @EventListener
    public void onApprovalRequested(ApprovalRequestedEvent event) {
        PendingApproval approval = event.approval();
        pendingApprovals.addLast(approval);
        out.println();
        out.println("? Approve tool '" + approval.toolName() + "' with " + preview(approval.arguments().toString())
                + " [y]es / [n]o / [a]lways");
    }

    private void handleLine(CodingAgent agent, String input) {
        if (!pendingApprovals.isEmpty() && answerApproval(input)) {
            return;
        }
        if (input.startsWith("/")) {
            List<String> parts = Arrays.asList(input.substring(1).split("\\s+"));
            SessionCommandPort.CommandResult result = commands.execute(agent, parts.get(0),
                    parts.subList(1, parts.size()));
            out.println(result.output());
            return;
        }
        Disposable turn = runningTurn;
        if (turn != null && !turn.isDisposed()) {
            out.println("A turn is still running. Wait for it, or answer the pending approval.");
            return;
        }
        runningTurn = agent.act(input).subscribe(this::print, this::printError, () -> out.println());
    }

    private boolean answerApproval(String input) {
        ApprovalVerdict verdict = switch (input.toLowerCase(Locale.ROOT)) {
        case "y", "yes" -> ApprovalVerdict.YES;
        case "n", "no" -> ApprovalVerdict.NO;
        case "a", "always" -> ApprovalVerdict.ALWAYS;
        default -> null;
        };
        if (verdict == null) {
            return false;
        }
        PendingApproval approval = pendingApprovals.pollFirst();
        if (approval == null) {
            return false;
        }
        String message = verdict == ApprovalVerdict.NO ? "declined" : null;
        eventPublisher.publishEvent(new ApprovalResolvedEvent(approval.correlationId(), verdict, message));
        return true;
    }

    private void print(AgentEvent event) {
        if (event instanceof AssistantEvent assistant) {
            if (assistant.stoppedByMiddleware()) {
                out.println();
                out.println("[stopped] " + assistant.content());
            } else {
                out.print(assistant.content());
            }
        } else if (event instanceof ToolCallEvent call) {
            out.println();
            out.println("> " + call.toolName() + " " + preview(call.arguments()));
        } else if (event instanceof ToolResultEvent result) {
            String status = result.skipped() ? "skipped" : result.error() ? "failed" : "ok";
            out.println("< " + result.toolName() + " " + status + " (" + result.duration().toMillis() + "ms)");
            if (result.skipped()) {
                out.println("  " + result.skipReason());
            }
        } else if (event instanceof CompactStartEvent start) {
            out.println("[compacting " + start.currentContextTokens() + " tokens]");
        } else if (event instanceof CompactEndEvent end) {
            out.println("[compacted " + end.oldContextTokens() + " -> " + end.newContextTokens() + " tokens]");
        }
    }

    private void printError(Throwable error) {
        out.println();
        out.println("Error: " + error.getMessage());
        if (error instanceof ModelBackendException backendError) {
            out.println(backendError.getRecoveryHint());
        }
        log.debug("[Console] Turn failed", error);
    }

    private static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= ARGUMENT_PREVIEW ? text : text.substring(0, ARGUMENT_PREVIEW) + "...";
    }
}
