package com.stablecore.service;

import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.model.PendingActionType;
import com.stablecore.web3.DepositReceipt;
import com.stablecore.web3.TransferGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Inbound value. Operations funded by a transfer claim the venue's receipt first and only
 * then credit anything; if the funded operation fails, exactly what was received goes back
 * to its sender under a DEPOSIT_REFUND marker.
 *
 * <pre>
 *   claim receipts (venue consumes each once) -> check sender and asset -> body
 *     body failed -> refund every claimed receipt, fail with the body's error
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepositIntake {

    private final TransferGateway gateway;
    private final SagaCoordinator saga;
    private final CoreExecutor executor;

    /** Single-receipt form of {@link #receiveAll}; {@code expectedAsset} may be null to accept any asset. */
    public <T> CompletableFuture<T> receive(String receiptId, String accountId, String expectedAsset,
                                            Function<DepositReceipt, CompletableFuture<T>> body) {
        Map<String, String> expected = new LinkedHashMap<>();
        expected.put(receiptId, expectedAsset);
        return receiveAll(expected, accountId, received -> body.apply(received.get(receiptId)));
    }

    /**
     * Claims every receipt in order, keyed receipt id to expected asset, then runs {@code body}
     * with the claimed receipts. A failed claim refunds the ones already claimed.
     */
    public <T> CompletableFuture<T> receiveAll(Map<String, String> expected, String accountId,
                                               Function<Map<String, DepositReceipt>, CompletableFuture<T>> body) {
        for (String id : expected.keySet()) {
            if (id == null || id.isBlank()) {
                return CompletableFuture.failedFuture(new CoreException(ErrorCode.INVALID_REQUEST, "deposit receipt id is required"));
            }
        }
        // filled strictly in sequence by the claim chain
        Map<String, DepositReceipt> received = new LinkedHashMap<>();
        CompletableFuture<Void> claims = CompletableFuture.completedFuture(null);
        for (Map.Entry<String, String> e : expected.entrySet()) {
            claims = claims.thenCompose(v -> claim(e.getKey(), accountId, e.getValue())
                    .thenAccept(r -> received.put(e.getKey(), r)));
        }
        return claims
                .thenCompose(v -> body.apply(Collections.unmodifiableMap(received)))
                .handle((ok, err) -> err == null
                        ? CompletableFuture.completedFuture(ok)
                        : this.<T>refundAll(List.copyOf(received.values()), err))
                .thenCompose(f -> f);
    }

    private CompletableFuture<DepositReceipt> claim(String receiptId, String accountId, String expectedAsset) {
        return gateway.claimDeposit(receiptId, accountId).thenCompose(r -> {
            String problem = mismatch(r, receiptId, accountId, expectedAsset);
            if (problem == null) return CompletableFuture.completedFuture(r);
            return this.<DepositReceipt>refundAll(List.of(r), new CoreException(ErrorCode.INVALID_REQUEST, problem));
        });
    }

    private static String mismatch(DepositReceipt r, String receiptId, String accountId, String expectedAsset) {
        if (!receiptId.equals(r.getReceiptId())) return "venue answered receipt " + r.getReceiptId() + " for " + receiptId;
        if (!accountId.equals(r.getSenderId())) return "deposit " + receiptId + " was sent by " + r.getSenderId();
        if (r.getAmount() == null || r.getAmount().signum() <= 0) return "deposit " + receiptId + " carries no funds";
        if (expectedAsset != null && !Objects.equals(expectedAsset, r.getAssetId())) {
            return "deposit " + receiptId + " is " + r.getAssetId() + ", expected " + expectedAsset;
        }
        return null;
    }

    /** Sends every receipt back to its sender and fails with {@code cause}. */
    private <T> CompletableFuture<T> refundAll(Collection<DepositReceipt> receipts, Throwable cause) {
        CoreException reason = CoreException.unwrap(cause);
        if (receipts.isEmpty()) return CompletableFuture.failedFuture(reason);
        CompletableFuture<?>[] refunds = receipts.stream()
                .map(r -> refund(r, reason))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(refunds).handle((ok, err) -> {
            throw reason;
        });
    }

    /** Never fails: a refund the venue rejects stays in NEEDS_RECOVERY for the owner. */
    private CompletableFuture<Void> refund(DepositReceipt r, CoreException reason) {
        return executor.submit(() -> saga.open(PendingActionType.DEPOSIT_REFUND, r.getSenderId(), r.getAssetId(), r.getAmount(),
                        Map.of("receipt_id", r.getReceiptId(), "reason", String.valueOf(reason.getMessage()))))
                .thenCompose(marker -> saga.await(marker, () -> gateway.transfer(r.getAssetId(), r.getSenderId(), r.getAmount())))
                .handle((ok, err) -> {
                    if (err != null) {
                        log.error("[deposit] refund of {} {} to {} failed: {}", r.getAmount(), r.getAssetId(), r.getSenderId(),
                                CoreException.unwrap(err).getMessage());
                    } else {
                        log.info("[deposit] refunded {} {} to {} after: {}", r.getAmount(), r.getAssetId(), r.getSenderId(),
                                reason.getMessage());
                    }
                    return null;
                });
    }
}
