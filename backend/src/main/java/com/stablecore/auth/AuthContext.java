package com.stablecore.auth;

import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import lombok.Value;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Caller identity plus its resolved roles. Privileged operations receive this explicitly.
 */
@Value
public class AuthContext {
    String accountId;
    Set<Role> roles;

    public static AuthContext of(String accountId, Role... roles) {
        EnumSet<Role> set = EnumSet.noneOf(Role.class);
        set.addAll(Arrays.asList(roles));
        return new AuthContext(accountId, set);
    }

    public boolean has(Role role) {
        return roles.contains(role);
    }

    /** Passes when the caller holds at least one of the given roles. */
    public void requireAny(Role... required) {
        for (Role r : required) {
            if (roles.contains(r)) return;
        }
        throw new CoreException(ErrorCode.UNAUTHORIZED,
                accountId + " lacks role " + Arrays.toString(required));
    }
}
