package com.stablecore.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stablecore.market.MarketEvent;
import com.stablecore.model.LedgerEvent;
import com.stablecore.repo.LedgerEventRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes committed ledger events to the log as one JSON line each and stores them.
 * Called only after a transition committed; a storage failure is logged, never rolled back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerEventPublisher {

    public static final String STANDARD = "stable-core";
    public static final String VERSION = "1.0.0";

    private final LedgerEventRepo repo;
    private final ObjectMapper mapper;
    private final Clock clock;

    public void publishAll(List<MarketEvent> events) {
        events.forEach(e -> publish(e.getName(), e.getData()));
    }

    public void publish(String event, Map<String, Object> data) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("standard", STANDARD);
        envelope.put("version", VERSION);
        envelope.put("event", event);
        envelope.put("data", List.of(data));
        try {
            log.info("EVENT_JSON:{}", mapper.writeValueAsString(envelope));
        } catch (JsonProcessingException e) {
            log.warn("[events] cannot serialize {} event: {}", event, e.getMessage());
        }

        Object account = data.get("account_id");
        LedgerEvent row = LedgerEvent.builder()
                .standard(STANDARD)
                .version(VERSION)
                .event(event)
                .accountId(account == null ? null : account.toString())
                .data(data)
                .ts(clock.instant())
                .build();
        try {
            repo.save(row);
        } catch (DataAccessException e) {
            log.error("[events] failed to store {} event for {}: {}", event, account, e.getMessage());
        }
    }

    /** Key/value pairs to an event payload; amounts are rendered as decimal strings. */
    public static Map<String, Object> data(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            Object v = kv[i + 1];
            m.put(String.valueOf(kv[i]), v instanceof BigInteger || v instanceof BigDecimal ? v.toString() : v);
        }
        return m;
    }
}
