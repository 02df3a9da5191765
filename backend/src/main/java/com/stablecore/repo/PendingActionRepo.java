package com.stablecore.repo;

import com.stablecore.model.PendingAction;
import com.stablecore.model.PendingActionStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface PendingActionRepo extends MongoRepository<PendingAction, String> {
    List<PendingAction> findByStatusOrderByCreatedAtAsc(PendingActionStatus status);

    List<PendingAction> findByStatusAndUpdatedAtBefore(PendingActionStatus status, Instant before);
}
