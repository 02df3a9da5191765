package com.stablecore.web3;

import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.oracle.PriceOracle;
import com.stablecore.oracle.PriceQuote;
import com.stablecore.web3.exception.RetryableRpcException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Reads quotes from the on-chain price feed with RPC failover.
 *
 * The feed exposes {@code getPrice(string assetId) -> (uint256 multiplier, uint8 decimals, uint64 timestamp)};
 * an all-zero answer means the feed has no price for that asset. All reads of one batch run
 * inside a single {@link Web3ClientFactory#executeWithFailover} so a batch never mixes endpoints.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Web3PriceOracle implements PriceOracle, DisposableBean {

    private final Web3ClientFactory factory;
    private final AppProps props;

    private final ExecutorService io = Executors.newFixedThreadPool(2, r -> {
        Thread t = new Thread(r, "oracle-io");
        t.setDaemon(true);
        return t;
    });

    @Override
    public CompletableFuture<List<PriceQuote>> fetch(Collection<String> assetIds) {
        List<String> ids = new ArrayList<>(assetIds);
        AppProps.Oracle cfg = props.getOracle();
        return CompletableFuture
                .supplyAsync(() -> factory.executeWithFailover(cfg.getNetwork(),
                        (web3, endpoint) -> readBatch(web3, endpoint, cfg.getContract(), ids)), io)
                .orTimeout(cfg.getTimeoutMs(), TimeUnit.MILLISECONDS);
    }

    private List<PriceQuote> readBatch(Web3j web3, String endpoint, String contract, List<String> ids) throws Exception {
        if (contract == null || contract.isBlank()) {
            throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED, "oracle contract is not configured");
        }
        List<PriceQuote> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            PriceQuote q = readOne(web3, endpoint, contract, id);
            if (q != null) out.add(q);
        }
        log.debug("[oracle] {} of {} quotes read via {}", out.size(), ids.size(), endpoint);
        return out;
    }

    private PriceQuote readOne(Web3j web3, String endpoint, String contract, String assetId) throws Exception {
        Function fn = new Function("getPrice",
                Collections.singletonList(new Utf8String(assetId)),
                Arrays.asList(new TypeReference<Uint256>() {}, new TypeReference<Uint8>() {}, new TypeReference<Uint64>() {}));

        EthCall call = web3.ethCall(
                Transaction.createEthCallTransaction(null, contract, FunctionEncoder.encode(fn)),
                DefaultBlockParameterName.LATEST).send();

        if (call.hasError() && isRateLimited(call.getError().getMessage())) {
            throw new RetryableRpcException(endpoint, "rate-limited on getPrice(" + assetId + "): " + call.getError().getMessage());
        }
        if (call.isReverted() || call.hasError()) {
            throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED,
                    "getPrice(" + assetId + ") reverted: " + (call.hasError() ? call.getError().getMessage() : call.getRevertReason()));
        }

        List<Type> decoded = FunctionReturnDecoder.decode(call.getValue(), fn.getOutputParameters());
        if (decoded.size() != 3) {
            throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED, "unexpected getPrice answer for " + assetId);
        }
        BigInteger multiplier = (BigInteger) decoded.get(0).getValue();
        int decimals = ((BigInteger) decoded.get(1).getValue()).intValue();
        long timestamp = ((BigInteger) decoded.get(2).getValue()).longValue();
        if (multiplier.signum() == 0 && timestamp == 0) return null;

        return PriceQuote.builder()
                .assetId(assetId)
                .multiplier(multiplier)
                .decimals(decimals)
                .observedAt(Instant.ofEpochSecond(timestamp))
                .build();
    }

    private boolean isRateLimited(String msg) {
        if (msg == null) return false;
        String m = msg.toLowerCase(Locale.ROOT);
        return m.contains("429") || m.contains("rate limit") || m.contains("too many requests");
    }

    @Override
    public void destroy() {
        io.shutdownNow();
    }
}
