package me.golemcore.coder.tools;

import me.golemcore.coder.domain.component.ToolContext;
import me.golemcore.coder.domain.component.ToolValidationException;
import me.golemcore.coder.domain.model.ToolFailureKind;
import me.golemcore.coder.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileToolsTest {

    @TempDir
    Path workspace;

    private ToolContext context;

    @BeforeEach
    void setUp() {
        context = new ToolContext("session-1", workspace, null);
    }

    @Test
    void shouldWriteNewFileWithParents() throws Exception {
        ToolResult result = new WriteFileTool().execute(context, Map.of(
                "path", "src/Main.java",
                "content", "class Main {}")).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Created src/Main.java"));
        assertEquals("class Main {}", Files.readString(workspace.resolve("src/Main.java")));
    }

    @Test
    void shouldRefuseOverwriteWithoutFlag() throws Exception {
        Files.writeString(workspace.resolve("a.txt"), "old");
        WriteFileTool tool = new WriteFileTool();

        ToolResult refused = tool.execute(context, Map.of("path", "a.txt", "content", "new")).join();
        assertFalse(refused.isSuccess());
        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, refused.getFailureKind());
        assertEquals("old", Files.readString(workspace.resolve("a.txt")));

        ToolResult replaced = tool.execute(context, Map.of("path", "a.txt", "content", "new",
                "overwrite", true)).join();
        assertTrue(replaced.isSuccess());
        assertEquals("new", Files.readString(workspace.resolve("a.txt")));
    }

    @Test
    void shouldRejectPathOutsideWorkspace() {
        ToolResult result = new WriteFileTool().execute(context, Map.of(
                "path", "../escape.txt",
                "content", "x")).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, result.getFailureKind());
        assertTrue(result.getError().contains("within workspace"));
        assertFalse(Files.exists(workspace.getParent().resolve("escape.txt")));
    }

    @Test
    void shouldValidateRequiredArguments() {
        WriteFileTool tool = new WriteFileTool();
        Map<String, Object> missingContent = Map.of("path", "a.txt");

        ToolValidationException error = assertThrows(ToolValidationException.class,
                () -> tool.validate(missingContent));
        assertTrue(error.getMessage().contains("content"));
    }

    @Test
    void shouldReadFileWithPaging() throws Exception {
        Files.writeString(workspace.resolve("lines.txt"), "one\ntwo\nthree\nfour\n");

        ToolResult page = new ReadFileTool().execute(context, Map.of(
                "path", "lines.txt", "offset", 1, "limit", 2)).join();

        assertTrue(page.isSuccess());
        assertTrue(page.getOutput().startsWith("two\nthree"));
        assertTrue(page.getOutput().contains("1 more lines"));
    }

    @Test
    void shouldReportMissingFileOnRead() {
        ToolResult result = new ReadFileTool().execute(context, Map.of("path", "nope.txt")).join();

        assertFalse(result.isSuccess());
        assertEquals("Error: File not found: nope.txt", result.toMessageContent());
    }

    @Test
    void shouldReplaceUniqueOccurrence() throws Exception {
        Files.writeString(workspace.resolve("App.java"), "int x = 1;\nint y = 2;\n");

        ToolResult result = new SearchReplaceTool().execute(context, Map.of(
                "path", "App.java", "search", "int x = 1;", "replace", "int x = 42;")).join();

        assertTrue(result.isSuccess());
        assertEquals("int x = 42;\nint y = 2;\n", Files.readString(workspace.resolve("App.java")));
    }

    @Test
    void shouldRefuseAmbiguousReplacement() throws Exception {
        Files.writeString(workspace.resolve("App.java"), "a a a");
        SearchReplaceTool tool = new SearchReplaceTool();

        ToolResult ambiguous = tool.execute(context, Map.of("path", "App.java", "search", "a",
                "replace", "b")).join();
        assertFalse(ambiguous.isSuccess());
        assertTrue(ambiguous.getError().contains("occurs 3 times"));

        ToolResult all = tool.execute(context, Map.of("path", "App.java", "search", "a", "replace", "$b",
                "replace_all", true)).join();
        assertTrue(all.isSuccess());
        assertEquals("$b $b $b", Files.readString(workspace.resolve("App.java")));
    }

    @Test
    void shouldDeleteFileButNotWorkspaceRoot() throws Exception {
        Files.writeString(workspace.resolve("tmp.txt"), "x");
        DeleteFileTool tool = new DeleteFileTool();

        assertTrue(tool.execute(context, Map.of("path", "tmp.txt")).join().isSuccess());
        assertFalse(Files.exists(workspace.resolve("tmp.txt")));

        ToolResult root = tool.execute(context, Map.of("path", ".")).join();
        assertFalse(root.isSuccess());
        assertTrue(root.getError().contains("workspace root"));
    }

    @Test
    void shouldListFilesSkippingIgnoredDirectories() throws Exception {
        Files.createDirectories(workspace.resolve("src/main"));
        Files.createDirectories(workspace.resolve(".git/objects"));
        Files.writeString(workspace.resolve("src/main/App.java"), "x");

        ToolResult result = new ListFilesTool().execute(context, Map.of("max_depth", 3)).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("src/"));
        assertTrue(result.getOutput().contains("src/main/App.java"));
        assertFalse(result.getOutput().contains(".git"));
    }

    @Test
    void shouldGrepWithLineNumbers() throws Exception {
        Files.createDirectories(workspace.resolve("src"));
        Files.writeString(workspace.resolve("src/A.java"), "class A {\n  // TODO fix\n}\n");
        Files.writeString(workspace.resolve("src/B.java"), "class B {}\n");

        ToolResult result = new GrepTool().execute(context, Map.of("pattern", "todo", "ignore_case", true))
                .join();

        assertTrue(result.isSuccess());
        assertEquals("src/A.java:2:   // TODO fix", result.getOutput());
    }

    @Test
    void shouldRejectInvalidGrepPattern() {
        GrepTool tool = new GrepTool();
        Map<String, Object> args = Map.of("pattern", "([a-z");

        assertThrows(ToolValidationException.class, () -> tool.validate(args));
    }
}
