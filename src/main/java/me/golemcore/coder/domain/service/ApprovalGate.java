package me.golemcore.coder.domain.service;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.ApprovalDecision;
import me.golemcore.coder.domain.model.ApprovalResolvedEvent;
import me.golemcore.coder.domain.model.ApprovalVerdict;
import me.golemcore.coder.domain.model.PendingApproval;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.ApprovalChannelPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Correlation table connecting tool calls that wait for approval with the
 * external channel that answers them.
 *
 * <p>
 * Each pending entry holds a future that is completed exactly once: by
 * {@link #resolve}, by {@link #cancel}, or by the expiry sweep. Removal from the
 * table is the linearization point, so a second resolution of the same id finds
 * nothing and is a no-op.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code coder.approval.ttl-seconds} - Age after which an entry expires
 * <li>{@code coder.approval.sweep-interval-seconds} - Expiry sweep period
 * </ul>
 */
@Service
@Slf4j
public class ApprovalGate {

    public static final String EXPIRED_MESSAGE = "Approval request expired";

    private final Map<String, PendingEntry> pending = new ConcurrentHashMap<>();
    private final ApprovalChannelPort channel;
    private final Clock clock;
    private final Duration ttl;
    private final int sweepIntervalSeconds;

    private ScheduledExecutorService sweeper;

    public ApprovalGate(ApprovalChannelPort channel, CoderProperties properties, Clock clock) {
        this.channel = channel;
        this.clock = clock;
        CoderProperties.ApprovalProperties config = properties.getApproval();
        this.ttl = Duration.ofSeconds(config.getTtlSeconds());
        this.sweepIntervalSeconds = Math.max(1, config.getSweepIntervalSeconds());
    }

    @PostConstruct
    public void init() {
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "approval-expiry");
            t.setDaemon(true);
            return t;
        });
        sweeper.scheduleAtFixedRate(() -> {
            try {
                expire(clock.instant());
            } catch (RuntimeException e) { // NOSONAR - keep the sweeper alive
                log.error("[Approval] Expiry sweep failed", e);
            }
        }, sweepIntervalSeconds, sweepIntervalSeconds, TimeUnit.SECONDS);
    }

    @PreDestroy
    public void destroy() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            try {
                sweeper.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        pending.keySet().forEach(id -> cancel(id, "Shutting down"));
    }

    /**
     * Registers a pending approval and notifies the channel.
     *
     * @return future completed with the verdict
     * @throws IllegalStateException
     *             if the correlation id is already pending
     */
    public CompletableFuture<ApprovalDecision> requestApproval(String toolName, Map<String, Object> arguments,
            String correlationId) {
        Map<String, Object> argsCopy = arguments != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                : Map.of();
        PendingApproval approval = new PendingApproval(correlationId, toolName, argsCopy, clock.instant());
        PendingEntry entry = new PendingEntry(approval, new CompletableFuture<>());

        if (pending.putIfAbsent(correlationId, entry) != null) {
            throw new IllegalStateException("Approval already pending for correlation id " + correlationId);
        }
        log.info("[Approval] Waiting for approval {} of tool '{}'", correlationId, toolName);

        try {
            channel.onApprovalRequested(approval);
        } catch (RuntimeException e) {
            log.error("[Approval] Failed to notify approval channel, denying {}", correlationId, e);
            resolve(correlationId, ApprovalVerdict.NO, "Approval channel unavailable: " + e.getMessage());
        }
        return entry.future();
    }

    /**
     * Completes the waiter of {@code correlationId}. Unknown or already resolved
     * ids are ignored.
     *
     * @return true if this call resolved the approval
     */
    public boolean resolve(String correlationId, ApprovalVerdict verdict, String message) {
        if (correlationId == null) {
            return false;
        }
        PendingEntry entry = pending.remove(correlationId);
        if (entry == null) {
            log.debug("[Approval] Ignoring resolution of unknown or resolved id {}", correlationId);
            return false;
        }
        log.info("[Approval] {} resolved: {}", correlationId, verdict);
        entry.future().complete(new ApprovalDecision(verdict, message));
        return true;
    }

    /**
     * Resolves a pending approval as NO with the given reason.
     */
    public boolean cancel(String correlationId, String reason) {
        return resolve(correlationId, ApprovalVerdict.NO, reason);
    }

    /**
     * Resolves every entry older than the TTL as NO.
     *
     * @return number of expired entries
     */
    public int expire(Instant now) {
        Instant cutoff = now.minus(ttl);
        int expired = 0;
        for (Map.Entry<String, PendingEntry> e : pending.entrySet()) {
            PendingEntry entry = e.getValue();
            if (entry.approval().createdAt().isBefore(cutoff) && pending.remove(e.getKey(), entry)) {
                entry.future().complete(ApprovalDecision.no(EXPIRED_MESSAGE));
                expired++;
            }
        }
        if (expired > 0) {
            log.info("[Approval] Expired {} stale approval(s)", expired);
        }
        return expired;
    }

    @EventListener
    public void onApprovalResolved(ApprovalResolvedEvent event) {
        resolve(event.correlationId(), event.verdict(), event.message());
    }

    public Optional<PendingApproval> getPending(String correlationId) {
        PendingEntry entry = pending.get(correlationId);
        return entry != null ? Optional.of(entry.approval()) : Optional.empty();
    }

    public int pendingCount() {
        return pending.size();
    }

    private record PendingEntry(PendingApproval approval, CompletableFuture<ApprovalDecision> future) {
    }
}
