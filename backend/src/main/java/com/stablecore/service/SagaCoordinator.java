package com.stablecore.service;

import com.stablecore.auth.AuthContext;
import com.stablecore.auth.Role;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.model.PendingAction;
import com.stablecore.model.PendingActionStatus;
import com.stablecore.model.PendingActionType;
import com.stablecore.repo.PendingActionRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Drives multi-step actions across an external call.
 *
 * <pre>
 *   local debit committed -> open(): marker STARTED saved
 *   external call         -> await()
 *     ok                  -> handler.complete(),   COMPLETED
 *     failed              -> handler.compensate(), COMPENSATED
 *     compensation throws -> NEEDS_RECOVERY, owner resolves later
 * </pre>
 * Settlement always runs on the core thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SagaCoordinator {

    /** What to do when the external step of one action type settles. */
    public interface Handler {
        default void complete(PendingAction action) {}

        void compensate(PendingAction action);
    }

    private final PendingActionRepo repo;
    private final CoreExecutor executor;
    private final Clock clock;

    private final Map<PendingActionType, Handler> handlers = new EnumMap<>(PendingActionType.class);

    public void register(PendingActionType type, Handler handler) {
        handlers.put(type, handler);
    }

    /**
     * Persists a STARTED marker. If that fails the local debit is compensated straight away,
     * so the action never runs without a marker.
     */
    public PendingAction open(PendingActionType type, String accountId, String assetId,
                              BigInteger amount, Map<String, String> details) {
        Instant now = clock.instant();
        PendingAction marker = PendingAction.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .status(PendingActionStatus.STARTED)
                .accountId(accountId)
                .assetId(assetId)
                .amount(amount.toString())
                .details(details == null ? new LinkedHashMap<>() : new LinkedHashMap<>(details))
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            return repo.save(marker);
        } catch (RuntimeException e) {
            log.error("[saga] cannot persist {} marker for {}: {}", type, accountId, e.getMessage());
            Handler h = handlers.get(type);
            if (h != null) h.compensate(marker);
            throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED, "cannot record pending " + type + ": " + e.getMessage(), e);
        }
    }

    /**
     * Runs the external step and settles the marker on the core thread. The returned future
     * completes with the marker when the step succeeded, and fails with EXTERNAL_CALL_FAILED otherwise.
     */
    public CompletableFuture<PendingAction> await(PendingAction marker, Supplier<CompletableFuture<?>> external) {
        CompletableFuture<?> step;
        try {
            step = external.get();
        } catch (RuntimeException e) {
            step = CompletableFuture.failedFuture(e);
        }
        return step
                .handle((ok, err) -> err)
                .thenCompose(err -> executor.submit(() -> settle(marker, err)))
                .thenApply(settled -> {
                    if (settled.getStatus() == PendingActionStatus.COMPLETED) return settled;
                    throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED,
                            settled.getType() + " failed (" + settled.getStatus() + "): " + settled.getLastError());
                });
    }

    PendingAction settle(PendingAction marker, Throwable err) {
        Handler h = handlers.get(marker.getType());
        if (err == null) {
            if (h != null) h.complete(marker);
            return transition(marker, PendingActionStatus.COMPLETED, null);
        }
        String reason = CoreException.unwrap(err).getMessage();
        log.warn("[saga] {} {} failed for {}: {}", marker.getType(), marker.getId(), marker.getAccountId(), reason);
        if (h == null) {
            return transition(marker, PendingActionStatus.NEEDS_RECOVERY, reason);
        }
        try {
            h.compensate(marker);
        } catch (RuntimeException compErr) {
            log.error("[saga] compensation of {} {} failed: {}", marker.getType(), marker.getId(), compErr.getMessage());
            return transition(marker, PendingActionStatus.NEEDS_RECOVERY, reason + "; compensation: " + compErr.getMessage());
        }
        return transition(marker, PendingActionStatus.COMPENSATED, reason);
    }

    /**
     * Owner-only. Closes a NEEDS_RECOVERY marker, optionally running its compensation again first.
     * Must be called on the core thread.
     */
    public PendingAction resolve(AuthContext auth, String id, boolean recompensate) {
        auth.requireAny(Role.OWNER);
        PendingAction marker = repo.findById(id)
                .orElseThrow(() -> new CoreException(ErrorCode.INVALID_REQUEST, "no pending action " + id));
        if (marker.getStatus() != PendingActionStatus.NEEDS_RECOVERY) {
            throw CoreException.of(ErrorCode.INVALID_REQUEST, "pending action %s is %s", id, marker.getStatus());
        }
        if (recompensate) {
            Handler h = handlers.get(marker.getType());
            if (h == null) {
                throw CoreException.of(ErrorCode.INVALID_REQUEST, "%s has no automatic compensation", marker.getType());
            }
            h.compensate(marker);
        }
        log.info("[saga] {} {} resolved by {} (recompensate={})", marker.getType(), id, auth.getAccountId(), recompensate);
        return transition(marker, PendingActionStatus.RESOLVED, marker.getLastError());
    }

    public List<PendingAction> needingRecovery() {
        return repo.findByStatusOrderByCreatedAtAsc(PendingActionStatus.NEEDS_RECOVERY);
    }

    /** Markers left STARTED for longer than {@code age} lost their continuation; flag them. */
    public int escalateStuck(Duration age) {
        List<PendingAction> stuck = repo.findByStatusAndUpdatedAtBefore(PendingActionStatus.STARTED, clock.instant().minus(age));
        for (PendingAction p : stuck) {
            transition(p, PendingActionStatus.NEEDS_RECOVERY, "no settlement within " + age.toSeconds() + "s");
        }
        return stuck.size();
    }

    private PendingAction transition(PendingAction marker, PendingActionStatus next, String error) {
        if (!marker.getStatus().canMoveTo(next)) {
            throw CoreException.of(ErrorCode.INVALID_REQUEST,
                    "pending action %s cannot move from %s to %s", marker.getId(), marker.getStatus(), next);
        }
        marker.setStatus(next);
        marker.setLastError(error);
        marker.setUpdatedAt(clock.instant());
        return repo.save(marker);
    }
}
