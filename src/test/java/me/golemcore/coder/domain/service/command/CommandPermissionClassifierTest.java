package me.golemcore.coder.domain.service.command;

import me.golemcore.coder.domain.model.ToolPermission;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class CommandPermissionClassifierTest {

    private CommandPermissionClassifier classifier;

    @BeforeEach
    void setUp() {
        CoderProperties.ShellProperties shell = new CoderProperties().getShell();
        classifier = new CommandPermissionClassifier(shell.getAllowlist(), shell.getDenylist(),
                shell.getDenylistStandalone());
    }

    @Test
    void shouldAllowAllowlistedCommand() {
        assertEquals(ToolPermission.ALWAYS, classifier.classify("ls"));
        assertEquals(ToolPermission.ALWAYS, classifier.classify("ls -la src"));
        assertEquals(ToolPermission.ALWAYS, classifier.classify("git status"));
    }

    @Test
    void shouldAllowPipelineOnlyWhenEverySegmentIsAllowed() {
        assertEquals(ToolPermission.ALWAYS, classifier.classify("cat README.md | wc -l"));
        assertEquals(ToolPermission.ASK, classifier.classify("cat README.md | python3 process.py"));
    }

    @Test
    void shouldDenyWhenAnySegmentIsDenylisted() {
        assertEquals(ToolPermission.NEVER, classifier.classify("ls; rm -rf /"));
        assertEquals(ToolPermission.NEVER, classifier.classify("ls && sudo reboot"));
        assertEquals(ToolPermission.NEVER, classifier.classify("echo hi\nrm -rf build"));
    }

    @Test
    void shouldMatchExecutableByBasename() {
        assertEquals(ToolPermission.NEVER, classifier.classify("/bin/rm -rf /"));
        assertEquals(ToolPermission.ALWAYS, classifier.classify("/usr/bin/ls"));
    }

    @Test
    void shouldDenyStandaloneInterpreters() {
        assertEquals(ToolPermission.NEVER, classifier.classify("python3"));
        assertEquals(ToolPermission.NEVER, classifier.classify("bash"));
        assertNotEquals(ToolPermission.NEVER, classifier.classify("python3 script.py"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "echo `whoami`", "echo $(whoami)", "cat <(ls)" })
    void shouldNeverAutoAllowCommandSubstitution(String command) {
        assertEquals(ToolPermission.ASK, classifier.classify(command));
    }

    @Test
    void shouldDenyDenylistedCommandInsideSubstitution() {
        assertEquals(ToolPermission.NEVER, classifier.classify("echo $(rm -rf /)"));
        assertEquals(ToolPermission.NEVER, classifier.classify("echo `sudo id`"));
    }

    @Test
    void shouldIgnoreLeadingEnvironmentAssignments() {
        assertEquals(ToolPermission.NEVER, classifier.classify("FOO=bar rm -rf /tmp/x"));
        assertEquals(ToolPermission.ALWAYS, classifier.classify("LANG=C ls"));
    }

    @Test
    void shouldAskForBlankOrUnknownCommands() {
        assertEquals(ToolPermission.ASK, classifier.classify(""));
        assertEquals(ToolPermission.ASK, classifier.classify("   "));
        assertEquals(ToolPermission.ASK, classifier.classify(null));
        assertEquals(ToolPermission.ASK, classifier.classify("npm test"));
    }

    @Test
    void shouldNotTreatPrefixOfLongerWordAsMatch() {
        assertEquals(ToolPermission.ASK, classifier.classify("lsof -i"));
        assertEquals(ToolPermission.ASK, classifier.classify("git statusx"));
    }
}
