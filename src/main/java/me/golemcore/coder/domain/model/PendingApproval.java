package me.golemcore.coder.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * Tool call waiting for a human verdict.
 */
public record PendingApproval(String correlationId, String toolName, Map<String, Object> arguments,
        Instant createdAt) {
}
