package com.stablecore.market;

import lombok.Value;

import java.util.Map;

/** Event staged during a session, published only after the session commits. */
@Value
public class MarketEvent {
    String name;
    Map<String, Object> data;
}
