package me.golemcore.coder.domain.model;

/**
 * Published by an approval channel (UI, bot, prompt) once the user answered.
 */
public record ApprovalResolvedEvent(String correlationId, ApprovalVerdict verdict, String message) {
}
