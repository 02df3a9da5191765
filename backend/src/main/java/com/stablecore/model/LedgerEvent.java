package com.stablecore.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("ledger_events")
public class LedgerEvent {

    @Id
    private String id;

    private String standard;
    private String version;

    @Indexed
    private String event;

    @Indexed
    private String accountId;

    private Map<String, Object> data;

    @Indexed
    private Instant ts;
}
