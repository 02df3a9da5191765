package com.stablecore.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted marker of a multi-step action waiting on an external call. Holds just enough
 * to run the compensation if the external step fails or the process dies mid-flight.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("pending_actions")
public class PendingAction {

    @Id
    private String id;

    @Indexed
    private PendingActionType type;

    @Indexed
    private PendingActionStatus status;

    private String accountId;
    private String assetId;

    /** Smallest-unit amounts are stored as decimal strings. */
    private String amount;

    /** Extra amounts the compensation needs, e.g. collected commission. */
    @Builder.Default
    private Map<String, String> details = new LinkedHashMap<>();

    private String lastError;

    private Instant createdAt;
    private Instant updatedAt;
}
