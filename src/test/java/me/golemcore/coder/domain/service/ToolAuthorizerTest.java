package me.golemcore.coder.domain.service;

import me.golemcore.coder.domain.mode.ModeManager;
import me.golemcore.coder.domain.model.AgentMode;
import me.golemcore.coder.domain.model.AuthorizationDecision;
import me.golemcore.coder.domain.model.ToolPermission;
import me.golemcore.coder.domain.service.command.CommandPermissionClassifier;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.tools.BashTool;
import me.golemcore.coder.tools.DeleteFileTool;
import me.golemcore.coder.tools.ReadFileTool;
import me.golemcore.coder.tools.WriteFileTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolAuthorizerTest {

    private static final String CALL_ID = "call_1";

    private Clock clock;
    private BashTool bashTool;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC);
        CoderProperties properties = new CoderProperties();
        CoderProperties.ShellProperties shell = properties.getShell();
        bashTool = new BashTool(properties, new CommandPermissionClassifier(shell.getAllowlist(),
                shell.getDenylist(), shell.getDenylistStandalone()));
        registry = new ToolRegistry(List.of(bashTool, new ReadFileTool(), new WriteFileTool(),
                new DeleteFileTool()));
    }

    @AfterEach
    void tearDown() {
        bashTool.shutdown();
    }

    @Test
    void shouldSkipWriteInPlanModeEvenWithForcedAutoApprove() {
        ModeManager modeManager = new ModeManager(AgentMode.PLAN, 10, clock);
        modeManager.forceAutoApprove(true);
        ToolAuthorizer authorizer = new ToolAuthorizer(modeManager, registry, Map.of());

        AuthorizationDecision decision = authorizer.authorize("delete_file", Map.of("path", "a.txt"), CALL_ID);

        assertTrue(decision.isSkip());
        assertTrue(decision.reason().contains("blocked"));
        assertTrue(decision.reason().contains("PLAN"));
    }

    @Test
    void shouldAwaitApprovalForWriteInNormalMode() {
        ToolAuthorizer authorizer = authorizer(AgentMode.NORMAL, Map.of());

        AuthorizationDecision decision = authorizer.authorize("write_file", Map.of("path", "a.txt"), CALL_ID);

        assertTrue(decision.isAwaitApproval());
    }

    @Test
    void shouldExecuteAutomaticallyInAutoMode() {
        ToolAuthorizer authorizer = authorizer(AgentMode.AUTO, Map.of());

        assertTrue(authorizer.authorize("write_file", Map.of("path", "a.txt"), CALL_ID).isExecute());
    }

    @Test
    void shouldSkipDenylistedCommandEvenInYoloMode() {
        ToolAuthorizer authorizer = authorizer(AgentMode.YOLO, Map.of());

        AuthorizationDecision decision = authorizer.authorize("bash", Map.of("command", "sudo rm x"), CALL_ID);

        assertTrue(decision.isSkip());
        assertTrue(decision.reason().contains("deny-list"));
    }

    @Test
    void shouldExecuteAllowlistedCommandWithoutApproval() {
        ToolAuthorizer authorizer = authorizer(AgentMode.NORMAL, Map.of());

        AuthorizationDecision decision = authorizer.authorize("bash", Map.of("command", "git status"), CALL_ID);

        assertTrue(decision.isExecute());
    }

    @Test
    void shouldAskForCommandSubstitutionInNormalMode() {
        ToolAuthorizer authorizer = authorizer(AgentMode.NORMAL, Map.of());

        AuthorizationDecision decision = authorizer.authorize("bash", Map.of("command", "echo $(whoami)"), CALL_ID);

        assertTrue(decision.isAwaitApproval());
    }

    @Test
    void shouldHonorConfiguredPermissions() {
        ToolAuthorizer authorizer = authorizer(AgentMode.NORMAL, Map.of(
                "read_file", ToolPermission.ALWAYS,
                "delete_file", ToolPermission.NEVER));

        assertTrue(authorizer.authorize("read_file", Map.of("path", "a"), CALL_ID).isExecute());
        AuthorizationDecision denied = authorizer.authorize("delete_file", Map.of("path", "a"), CALL_ID);
        assertTrue(denied.isSkip());
        assertTrue(denied.reason().contains("disabled by configuration"));
    }

    @Test
    void shouldExecuteAfterAlwaysGrantUntilCleared() {
        ToolAuthorizer authorizer = authorizer(AgentMode.NORMAL, Map.of());

        authorizer.grantAlways("write_file");
        assertTrue(authorizer.authorize("write_file", Map.of("path", "a"), CALL_ID).isExecute());

        authorizer.clearGrants();
        assertTrue(authorizer.authorize("write_file", Map.of("path", "a"), CALL_ID).isAwaitApproval());
    }

    @Test
    void shouldKeepModeBlockAboveAlwaysGrant() {
        ModeManager modeManager = new ModeManager(AgentMode.ARCHITECT, 10, clock);
        ToolAuthorizer authorizer = new ToolAuthorizer(modeManager, registry, Map.of());

        authorizer.grantAlways("write_file");

        assertTrue(authorizer.authorize("write_file", Map.of("path", "a"), CALL_ID).isSkip());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "find . -name '*.txt' -delete",
            "find . -exec rm {} +",
            "find src -type f -execdir chmod +x {} ;",
            "find . -fprint listing.txt",
            "tree -o out.txt",
            "sort -o sorted.txt names.txt",
            "git diff --output=patch.txt",
            "ls | xargs rm"
    })
    void shouldBlockFileMutatingReadCommandsInPlanMode(String command) {
        ModeManager modeManager = new ModeManager(AgentMode.PLAN, 10, clock);
        modeManager.forceAutoApprove(true);
        ToolAuthorizer authorizer = new ToolAuthorizer(modeManager, registry, Map.of());

        AuthorizationDecision decision = authorizer.authorize("bash", Map.of("command", command), CALL_ID);

        assertTrue(decision.isSkip(), command);
        assertTrue(decision.reason().contains("blocked"), command);
    }

    @Test
    void shouldNotAutoExecuteFindThroughAllowlistInReadOnlyMode() {
        ToolAuthorizer plan = authorizer(AgentMode.PLAN, Map.of());
        ToolAuthorizer normal = authorizer(AgentMode.NORMAL, Map.of());
        Map<String, Object> arguments = Map.of("command", "find . -name '*.java'");

        assertTrue(plan.authorize("bash", arguments, CALL_ID).isAwaitApproval());
        assertTrue(normal.authorize("bash", arguments, CALL_ID).isExecute());
        assertTrue(plan.authorize("bash", Map.of("command", "git status"), CALL_ID).isExecute());
    }

    private ToolAuthorizer authorizer(AgentMode mode, Map<String, ToolPermission> permissions) {
        return new ToolAuthorizer(new ModeManager(mode, 10, clock), registry, permissions);
    }
}
