package com.stablecore.auth;

public enum Role {
    OWNER,
    GUARDIAN,
    /** Guardian allowed to force-close insolvent accounts. */
    LIQUIDATOR
}
