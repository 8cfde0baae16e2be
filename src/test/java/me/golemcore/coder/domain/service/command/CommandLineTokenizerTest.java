package me.golemcore.coder.domain.service.command;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineTokenizerTest {

    @Test
    void shouldSplitOnWhitespace() {
        assertEquals(List.of("git", "log", "-n", "3"), CommandLineTokenizer.tokenize("  git   log -n\t3 "));
    }

    @Test
    void shouldKeepQuotedTextTogether() {
        assertEquals(List.of("grep", "hello world", "src"),
                CommandLineTokenizer.tokenize("grep \"hello world\" src"));
        assertEquals(List.of("echo", "it's $HOME"), CommandLineTokenizer.tokenize("echo \"it's \\$HOME\""));
        assertEquals(List.of("echo", "a b"), CommandLineTokenizer.tokenize("echo 'a b'"));
    }

    @Test
    void shouldJoinAdjacentQuotedParts() {
        assertEquals(List.of("--name=a b"), CommandLineTokenizer.tokenize("--name='a b'"));
    }

    @Test
    void shouldKeepEscapedSpace() {
        assertEquals(List.of("cat", "my file.txt"), CommandLineTokenizer.tokenize("cat my\\ file.txt"));
    }

    @Test
    void shouldRejectUnterminatedQuote() {
        CommandSyntaxException error = assertThrows(CommandSyntaxException.class,
                () -> CommandLineTokenizer.tokenize("echo 'oops"));
        assertTrue(error.getMessage().contains("No closing quotation"));
        assertThrows(CommandSyntaxException.class, () -> CommandLineTokenizer.tokenize("echo \"oops"));
    }

    @Test
    void shouldRejectTrailingBackslash() {
        assertThrows(CommandSyntaxException.class, () -> CommandLineTokenizer.tokenize("echo \\"));
    }

    @Test
    void shouldReturnEmptyListForBlankInput() {
        assertTrue(CommandLineTokenizer.tokenize("   ").isEmpty());
        assertTrue(CommandLineTokenizer.tokenize(null).isEmpty());
        assertEquals(List.of(""), CommandLineTokenizer.tokenize("''"));
    }
}
