package com.stablecore.repo;

import com.stablecore.model.LedgerEvent;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface LedgerEventRepo extends MongoRepository<LedgerEvent, String> {
    List<LedgerEvent> findTop100ByAccountIdOrderByTsDesc(String accountId);
}
