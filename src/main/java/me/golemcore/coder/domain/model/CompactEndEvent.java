package me.golemcore.coder.domain.model;

public record CompactEndEvent(long oldContextTokens, long newContextTokens, int summaryLength)
        implements AgentEvent {
}
