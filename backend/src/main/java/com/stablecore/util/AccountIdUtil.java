package com.stablecore.util;

import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Simple validators/normalizers for account and asset identifiers.
 */
public final class AccountIdUtil {
    private AccountIdUtil(){}

    private static final Pattern ID = Pattern.compile("^[a-z0-9][a-z0-9._-]{1,63}$");

    public static String normalize(String id) {
        if (id == null) throw new CoreException(ErrorCode.INVALID_REQUEST, "account id is null");
        String v = id.trim().toLowerCase(Locale.ROOT);
        if (!ID.matcher(v).matches()) {
            throw new CoreException(ErrorCode.INVALID_REQUEST, "invalid account id: " + id);
        }
        return v;
    }
}
