package com.stablecore.auth;

import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.util.AccountIdUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Identifies the caller from a bearer token and resolves its roles from the configured
 * owner/guardian roster.
 */
@Component
@RequiredArgsConstructor
public class AuthContextResolver {

    public static final String HEADER = HttpHeaders.AUTHORIZATION;
    private static final String BEARER = "Bearer ";

    private final AppProps props;
    private final AccessTokenVerifier tokens;

    /** {@code authorization} is the raw header value, {@code Bearer <token>}. */
    public AuthContext resolve(String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER)) {
            throw new CoreException(ErrorCode.UNAUTHORIZED, "missing or invalid authorization header");
        }
        return forAccount(tokens.verify(authorization.substring(BEARER.length()).trim()));
    }

    /** Roles of an already authenticated account. */
    public AuthContext forAccount(String rawAccountId) {
        String id = AccountIdUtil.normalize(rawAccountId);
        AppProps.Auth auth = props.getAuth();
        EnumSet<Role> roles = EnumSet.noneOf(Role.class);
        if (auth.getOwner() != null && id.equals(auth.getOwner().toLowerCase(Locale.ROOT))) {
            roles.add(Role.OWNER);
        }
        if (contains(auth.getGuardians(), id)) roles.add(Role.GUARDIAN);
        if (contains(auth.getLiquidators(), id)) {
            roles.add(Role.GUARDIAN);
            roles.add(Role.LIQUIDATOR);
        }
        return new AuthContext(id, roles);
    }

    private static boolean contains(List<String> ids, String id) {
        return ids != null && ids.stream().anyMatch(g -> g.toLowerCase(Locale.ROOT).equals(id));
    }
}
