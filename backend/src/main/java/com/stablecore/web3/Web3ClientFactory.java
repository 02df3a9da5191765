package com.stablecore.web3;

import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.web3.exception.RetryableRpcException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One Web3j client per configured RPC url of a network. Reads rotate over the urls and
 * fail over on rate limits and transport errors; a failing url sits out its penalty window.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Web3ClientFactory {

    private static final List<String> TRANSPORT_HINTS = List.of(
            "429", "rate limit", "too many requests", "timeout", "connection", "refused", "unexpected end of stream");

    private final AppProps props;
    private final Clock clock;

    /** A read against one endpoint. */
    @FunctionalInterface
    public interface RpcCall<T> {
        T call(Web3j web3, String endpoint) throws Exception;
    }

    private final class Endpoint {
        final String url;
        final Web3j web3j;
        volatile Instant skipUntil = Instant.EPOCH;

        Endpoint(String url) {
            this.url = url;
            this.web3j = Web3j.build(new HttpService(url));
        }

        boolean usable() {
            return clock.instant().isAfter(skipUntil);
        }

        void sitOut(long seconds) {
            skipUntil = clock.instant().plusSeconds(seconds);
        }
    }

    private final Map<String, List<Endpoint>> rings = new ConcurrentHashMap<>();
    private final Map<String, Integer> cursor = new ConcurrentHashMap<>();

    /**
     * Runs {@code fn} on the network's endpoints starting after the last one used.
     * Retryable failures move to the next endpoint after a backoff; anything else fails at once.
     * Every failure surfaces as EXTERNAL_CALL_FAILED.
     */
    public <T> T executeWithFailover(String network, RpcCall<T> fn) {
        AppProps.Network cfg = props.require(network);
        List<Endpoint> ring = ring(network, cfg);
        if (ring.isEmpty()) {
            throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED, "no RPC urls configured for network " + network);
        }
        int size = ring.size();
        int first = cursor.compute(network, (k, v) -> v == null ? 0 : (v + 1) % size);

        Exception last = null;
        for (int attempt = 0; attempt < size; attempt++) {
            int idx = (first + attempt) % size;
            Endpoint ep = ring.get(idx);
            if (!ep.usable()) continue;
            try {
                T out = fn.call(ep.web3j, ep.url);
                cursor.put(network, idx);
                return out;
            } catch (CoreException e) {
                throw e;
            } catch (Exception e) {
                if (!(e instanceof RetryableRpcException) && !isRetryableTransport(e.getMessage())) {
                    log.error("[web3] {} failed on {}: {}", network, ep.url, e.toString());
                    throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED, "rpc call failed: " + e.getMessage(), e);
                }
                last = e;
                log.warn("[web3] {} endpoint {} sits out {}s: {}", network, ep.url, cfg.getPenaltySec(), e.getMessage());
                ep.sitOut(cfg.getPenaltySec());
            }
            pause(backoff(cfg, attempt));
        }
        throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED, "all RPC endpoints failed for network " + network, last);
    }

    /** Doubles from the base delay, capped. */
    static Duration backoff(AppProps.Network cfg, int attempt) {
        long delay = cfg.getBackoffMs() << Math.min(attempt, 4);
        return Duration.ofMillis(Math.min(delay, cfg.getMaxBackoffMs()));
    }

    /** A missing message counts as transport trouble. */
    static boolean isRetryableTransport(String message) {
        if (message == null || message.isEmpty()) return true;
        String m = message.toLowerCase(Locale.ROOT);
        return TRANSPORT_HINTS.stream().anyMatch(m::contains);
    }

    private static void pause(Duration d) {
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED, "interrupted during rpc failover", ie);
        }
    }

    private List<Endpoint> ring(String network, AppProps.Network cfg) {
        return rings.computeIfAbsent(network, net -> {
            List<String> urls = cfg.getRpcUrls();
            if (urls == null || urls.isEmpty()) return List.of();
            List<Endpoint> list = new ArrayList<>(urls.size());
            for (String u : urls) list.add(new Endpoint(u));
            log.info("[web3] {} RPC endpoints for {}: {}", list.size(), net, urls);
            return list;
        });
    }
}
