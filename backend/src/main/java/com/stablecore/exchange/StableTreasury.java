package com.stablecore.exchange;

import com.stablecore.auth.AuthContext;
import com.stablecore.auth.Role;
import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accepted stable tokens that convert 1:1 into the stable asset, and how much of each is held.
 * Mutated only on the core thread.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StableTreasury {

    public static final int MAX_DECIMALS = 37;

    private final AppProps props;

    private final Map<String, Token> tokens = new LinkedHashMap<>();

    @Data
    @AllArgsConstructor
    public static class Token {
        private String id;
        private int decimals;
        private boolean enabled;
        private BigInteger balance;

        Token copy() {
            return new Token(id, decimals, enabled, balance);
        }
    }

    @PostConstruct
    void bootstrap() {
        for (AppProps.TreasuryToken t : props.getExchange().getTreasuryTokens()) {
            put(t.getId(), t.getDecimals());
        }
        if (!tokens.isEmpty()) log.info("[treasury] accepting {}", tokens.keySet());
    }

    public void add(AuthContext auth, String tokenId, int decimals) {
        auth.requireAny(Role.OWNER);
        if (tokens.containsKey(tokenId)) {
            throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "token " + tokenId + " is already accepted");
        }
        put(tokenId, decimals);
        log.info("[treasury] {} added {} with {} decimals", auth.getAccountId(), tokenId, decimals);
    }

    public void enable(AuthContext auth, String tokenId) {
        setEnabled(auth, tokenId, true);
    }

    public void disable(AuthContext auth, String tokenId) {
        setEnabled(auth, tokenId, false);
    }

    public List<Token> list() {
        List<Token> out = new ArrayList<>();
        tokens.values().forEach(t -> out.add(t.copy()));
        return out;
    }

    /** Copy of an enabled token, or ASSET_DISABLED / UNKNOWN_ASSET. */
    public Token requireEnabled(String tokenId) {
        Token t = find(tokenId);
        if (!t.isEnabled()) throw new CoreException(ErrorCode.ASSET_DISABLED, "token " + tokenId + " is disabled");
        return t.copy();
    }

    public void deposit(String tokenId, BigInteger amount) {
        Token t = find(tokenId);
        t.setBalance(t.getBalance().add(amount));
    }

    public void withdraw(String tokenId, BigInteger amount) {
        Token t = find(tokenId);
        if (t.getBalance().compareTo(amount) < 0) {
            throw CoreException.of(ErrorCode.INSUFFICIENT_BALANCE,
                    "treasury holds %s %s, cannot release %s", t.getBalance(), tokenId, amount);
        }
        t.setBalance(t.getBalance().subtract(amount));
    }

    private void setEnabled(AuthContext auth, String tokenId, boolean enabled) {
        auth.requireAny(Role.OWNER);
        Token t = find(tokenId);
        if (t.isEnabled() == enabled) {
            throw CoreException.of(ErrorCode.INVALID_REQUEST, "token %s is already %s", tokenId, enabled ? "enabled" : "disabled");
        }
        t.setEnabled(enabled);
        log.info("[treasury] {} {} {}", auth.getAccountId(), enabled ? "enabled" : "disabled", tokenId);
    }

    private void put(String tokenId, int decimals) {
        if (tokenId == null || tokenId.isBlank()) {
            throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "token id is required");
        }
        if (decimals <= 0 || decimals > MAX_DECIMALS) {
            throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "decimal value is out of bounds: " + decimals);
        }
        tokens.put(tokenId, new Token(tokenId, decimals, true, BigInteger.ZERO));
    }

    private Token find(String tokenId) {
        Token t = tokens.get(tokenId);
        if (t == null) throw new CoreException(ErrorCode.UNKNOWN_ASSET, "token " + tokenId + " is not accepted");
        return t;
    }
}
