package me.golemcore.coder.testsupport;

import me.golemcore.coder.domain.component.ToolComponent;
import me.golemcore.coder.domain.component.ToolContext;
import me.golemcore.coder.domain.model.ToolDefinition;
import me.golemcore.coder.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tool answering a fixed output, optionally after a delay.
 */
public class StubTool implements ToolComponent {

    private final String name;
    private final String output;
    private final long delayMillis;
    private final AtomicInteger executions = new AtomicInteger();

    public StubTool(String name, String output) {
        this(name, output, 0);
    }

    public StubTool(String name, String output, long delayMillis) {
        this.name = name;
        this.output = output;
        this.delayMillis = delayMillis;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(name)
                .description("Stub tool " + name)
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters) {
        executions.incrementAndGet();
        if (delayMillis <= 0) {
            return CompletableFuture.completedFuture(ToolResult.success(output));
        }
        return CompletableFuture.supplyAsync(() -> ToolResult.success(output),
                CompletableFuture.delayedExecutor(delayMillis, TimeUnit.MILLISECONDS));
    }

    public int getExecutions() {
        return executions.get();
    }
}
