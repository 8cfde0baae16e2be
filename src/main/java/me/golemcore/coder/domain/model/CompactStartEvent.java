package me.golemcore.coder.domain.model;

public record CompactStartEvent(long currentContextTokens, long threshold) implements AgentEvent {
}
