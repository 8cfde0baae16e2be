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

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * Runs a single command under a restricted environment.
 *
 * <p>
 * Security:
 * <ul>
 * <li>The command is tokenized, never handed to a shell unless its executable
 * is a shell built-in
 * <li>The executable must be on the allow-list (matched by basename)
 * <li>The child environment is an explicit allow-listed map plus non-interactive
 * defaults
 * <li>stdin is closed, the process tree is killed on timeout
 * </ul>
 *
 * <p>
 * {@code cd} is emulated: it only moves the executor's own working directory,
 * which is then used for every later command of the same session.
 */
@Slf4j
public class SecureCommandExecutor {

    public static final Set<String> DEFAULT_ALLOWED_EXECUTABLES = Set.of(
            // files and text
            "cat", "ls", "head", "tail", "wc", "grep", "egrep", "fgrep", "rg", "find", "fd", "tree", "file",
            "stat", "du", "df", "sort", "uniq", "cut", "tr", "diff", "cmp", "comm", "awk", "sed", "xargs",
            "basename", "dirname", "realpath", "readlink", "echo", "printf", "pwd", "touch", "mkdir", "cp",
            "mv", "rm", "rmdir", "ln", "chmod", "tee", "less", "more", "jq", "yq", "tar", "zip", "unzip",
            "gzip", "gunzip", "md5sum", "sha1sum", "sha256sum", "date", "env", "which", "whoami", "uname",
            "hostname", "true", "false", "test", "sleep", "seq", "nl", "column", "patch",
            // version control
            "git", "gh",
            // languages and build tools
            "python", "python3", "pip", "pip3", "uv", "poetry", "pytest", "ruff", "mypy", "black",
            "node", "npm", "npx", "yarn", "pnpm", "deno", "bun", "tsc",
            "java", "javac", "mvn", "gradle", "kotlin", "kotlinc",
            "go", "gofmt", "cargo", "rustc", "rustfmt", "make", "cmake", "gcc", "g++", "clang",
            "ruby", "bundle", "rake", "php", "composer", "dotnet",
            // network and containers
            "curl", "wget", "docker", "kubectl");

    public static final Set<String> SHELL_BUILTINS = Set.of(
            "cd", "pushd", "popd", "dirs", "source", "exec", "exit", "export", "unset", "alias", "unalias",
            "history", "jobs", "fg", "bg", "wait", "umask", "ulimit", "type", "times", "hash");

    private static final Map<String, String> SECURE_DEFAULTS = Map.ofEntries(
            Map.entry("CI", "true"),
            Map.entry("NONINTERACTIVE", "1"),
            Map.entry("NO_TTY", "1"),
            Map.entry("NO_COLOR", "1"),
            Map.entry("PAGER", "cat"),
            Map.entry("GIT_PAGER", "cat"),
            Map.entry("EDITOR", "cat"),
            Map.entry("VISUAL", "cat"),
            Map.entry("PYTHONUNBUFFERED", "1"),
            Map.entry("PYTHONDONTWRITEBYTECODE", "1"));

    // Separators, pipes, redirection and command substitution.
    private static final Pattern SHELL_CONTROL = Pattern.compile("[;&|<>`\\n\\r]|\\$\\(");

    private static final long OUTPUT_DRAIN_SECONDS = 5;
    private static final int LOG_COMMAND_LIMIT = 200;

    private final Path initialWorkdir;
    private final AtomicReference<Path> currentWorkdir;
    private final Set<String> allowedExecutables;
    private final CommandEnvironment environment;
    private final ExecutorService ioExecutor;
    private final boolean windows;

    public SecureCommandExecutor(Path workdir, CommandEnvironment environment,
            Collection<String> extraAllowedExecutables, ExecutorService ioExecutor) {
        this.initialWorkdir = workdir.toAbsolutePath().normalize();
        this.currentWorkdir = new AtomicReference<>(initialWorkdir);
        Set<String> allowed = new HashSet<>(DEFAULT_ALLOWED_EXECUTABLES);
        if (extraAllowedExecutables != null) {
            allowed.addAll(extraAllowedExecutables);
        }
        this.allowedExecutables = Set.copyOf(allowed);
        this.environment = environment;
        this.ioExecutor = ioExecutor;
        this.windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }

    public Path getCurrentWorkdir() {
        return currentWorkdir.get();
    }

    public void resetWorkdir() {
        currentWorkdir.set(initialWorkdir);
    }

    public CommandResult execute(String command, Duration timeout) {
        return execute(command, timeout, Map.of());
    }

    /**
     * Executes {@code command} and returns its captured output.
     *
     * @throws CommandSyntaxException
     *             if the command cannot be tokenized or is empty
     * @throws ExecutableNotAllowedException
     *             if the executable is neither allow-listed nor a shell built-in,
     *             or a built-in is chained with further commands
     * @throws CommandTimeoutException
     *             if the process did not finish in time; the process tree is
     *             already destroyed
     * @throws DirectoryChangeException
     *             if an emulated {@code cd} targets an invalid directory
     */
    public CommandResult execute(String command, Duration timeout, Map<String, String> extraEnv) {
        List<String> argv = CommandLineTokenizer.tokenize(command);
        if (argv.isEmpty()) {
            throw new CommandSyntaxException("Empty command");
        }

        String executable = basename(argv.get(0));
        if ("cd".equals(executable)) {
            return changeDirectory(argv);
        }

        boolean builtin = SHELL_BUILTINS.contains(executable);
        if (!builtin && !allowedExecutables.contains(executable)) {
            throw new ExecutableNotAllowedException(executable,
                    "Executable '" + executable + "' is not allowed. Permitted executables: "
                            + String.join(", ", new TreeSet<>(allowedExecutables)));
        }

        if (builtin) {
            checkBuiltinCommand(command, executable, argv);
        }

        List<String> processArgs = builtin ? shellInvocation(command) : argv;
        return runProcess(command, processArgs, timeout, extraEnv);
    }

    private CommandResult runProcess(String command, List<String> processArgs, Duration timeout,
            Map<String, String> extraEnv) {
        Path workdir = currentWorkdir.get();
        ProcessBuilder pb = new ProcessBuilder(processArgs);
        pb.directory(workdir.toFile());
        Map<String, String> env = pb.environment();
        env.clear();
        env.putAll(buildEnvironment(extraEnv));

        log.debug("[Shell] Running '{}' in {}", truncate(command), workdir);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new CommandExecutionException("Failed to start command: " + e.getMessage(), e);
        }
        closeStdin(process);

        CompletableFuture<byte[]> stdout = CompletableFuture.supplyAsync(
                () -> readFully(process.getInputStream()), ioExecutor);
        CompletableFuture<byte[]> stderr = CompletableFuture.supplyAsync(
                () -> readFully(process.getErrorStream()), ioExecutor);

        long timeoutSeconds = Math.max(1, timeout.toSeconds());
        try {
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                destroyTree(process);
                log.warn("[Shell] Command timed out after {}s: {}", timeoutSeconds, truncate(command));
                throw new CommandTimeoutException(timeoutSeconds, command);
            }
            int exitCode = process.exitValue();
            return new CommandResult(decode(awaitOutput(stdout)), decode(awaitOutput(stderr)), exitCode);
        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            throw new CommandExecutionException("Command interrupted: " + command, e);
        }
    }

    private CommandResult changeDirectory(List<String> argv) {
        Path current = currentWorkdir.get();
        Path home = homeDirectory();
        Path target;
        if (argv.size() < 2 || "~".equals(argv.get(1)) || "-".equals(argv.get(1))) {
            target = home;
        } else {
            String arg = argv.get(1);
            if (arg.startsWith("~/")) {
                target = home.resolve(arg.substring(2));
            } else {
                Path requested = Paths.get(arg);
                target = requested.isAbsolute() ? requested : current.resolve(requested);
            }
        }
        target = target.toAbsolutePath().normalize();

        if (!Files.exists(target)) {
            throw new DirectoryChangeException("Directory does not exist: " + target);
        }
        if (!Files.isDirectory(target)) {
            throw new DirectoryChangeException("Path is not a directory: " + target);
        }
        currentWorkdir.set(target);
        log.debug("[Shell] Working directory changed to {}", target);
        return new CommandResult("", "Changed directory to: " + target, 0);
    }

    Map<String, String> buildEnvironment(Map<String, String> extraEnv) {
        Map<String, String> env = new LinkedHashMap<>(environment.getVariables());
        env.putAll(SECURE_DEFAULTS);
        if (!windows) {
            env.put("TERM", "dumb");
        }
        if (extraEnv != null) {
            env.putAll(extraEnv);
        }
        return env;
    }

    /**
     * Built-ins run through the shell, so the rest of the command line must not
     * start anything the allow-list has not seen.
     */
    private void checkBuiltinCommand(String command, String builtin, List<String> argv) {
        if (SHELL_CONTROL.matcher(command).find()) {
            throw new ExecutableNotAllowedException(builtin, "Shell built-in '" + builtin
                    + "' cannot be combined with other commands, redirection or substitution");
        }
        if ("source".equals(builtin)) {
            throw new ExecutableNotAllowedException(builtin, "Sourcing scripts is not allowed");
        }
        if ("exec".equals(builtin) && argv.size() > 1) {
            String target = argv.get(1).startsWith("-") ? argv.get(1) : basename(argv.get(1));
            if (!allowedExecutables.contains(target)) {
                throw new ExecutableNotAllowedException(target,
                        "Executable '" + target + "' is not allowed. Permitted executables: "
                                + String.join(", ", new TreeSet<>(allowedExecutables)));
            }
        }
    }

    private List<String> shellInvocation(String command) {
        if (windows) {
            return List.of("cmd.exe", "/c", command);
        }
        return List.of("/bin/sh", "-c", command);
    }

    private Path homeDirectory() {
        String home = environment.get("HOME");
        if (home == null || home.isBlank()) {
            home = System.getProperty("user.home");
        }
        return Paths.get(home);
    }

    private static void closeStdin(Process process) {
        try {
            OutputStream stdin = process.getOutputStream();
            stdin.close();
        } catch (IOException e) {
            log.debug("[Shell] Failed to close stdin: {}", e.getMessage());
        }
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static byte[] readFully(InputStream stream) {
        try (InputStream in = stream) {
            return in.readAllBytes();
        } catch (IOException e) {
            log.debug("[Shell] Output stream closed: {}", e.getMessage());
            return new byte[0];
        }
    }

    private static byte[] awaitOutput(CompletableFuture<byte[]> output) throws InterruptedException {
        try {
            return output.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Shell] Failed to collect process output: {}", e.getMessage());
            return new byte[0];
        }
    }

    // Malformed input is replaced with U+FFFD by the String constructor.
    private static String decode(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    static String basename(String executable) {
        int slash = Math.max(executable.lastIndexOf('/'), executable.lastIndexOf('\\'));
        return slash >= 0 ? executable.substring(slash + 1) : executable;
    }

    private static String truncate(String text) {
        if (text.length() <= LOG_COMMAND_LIMIT) {
            return text;
        }
        return text.substring(0, LOG_COMMAND_LIMIT) + "...";
    }
}
