package com.stablecore.market;

public enum AccrualMode {
    /** Per-millisecond rate compounded over the elapsed interval. */
    COMPOUND,
    /** apr * elapsed / year. */
    SIMPLE
}
