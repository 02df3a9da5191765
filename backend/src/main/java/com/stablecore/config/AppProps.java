package com.stablecore.config;

import com.stablecore.market.AccrualMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "app")
@Data
public class AppProps {
    private Oracle oracle = new Oracle();
    private Exchange exchange = new Exchange();
    private Market market = new Market();
    private Auth auth = new Auth();
    private Venue venue = new Venue();
    private Polling snapshot = new Polling();
    private Polling recovery = new Polling();
    private Map<String, Network> network;

    public Network require(String networkName) {
        Network n = (network != null) ? network.get(networkName) : null;
        if (n == null) throw new IllegalArgumentException("Unknown network: " + networkName);
        return n;
    }

    @Data
    public static class Network {
        private List<String> rpcUrls;
        private String chainId;
        /** How long a failing endpoint is skipped. */
        private long penaltySec = 20;
        private long backoffMs = 400;
        private long maxBackoffMs = 5000;
    }

    @Data
    public static class Polling {
        private String cron = "0 0/10 * * * ?";
        /** Markers left in STARTED longer than this are escalated for recovery. */
        private long stuckAfterSec = 900;
    }

    @Data
    public static class Oracle {
        /** Key into {@link AppProps#network} holding the RPC endpoints. */
        private String network = "mainnet";
        private String contract;
        /** A quote is stale once now - observedAt reaches this window. */
        private long recencyWindowSec = 90;
        private long timeoutMs = 10_000;
        /** Fixed peg quote of the stable asset: one whole unit (10^18) equals one reference unit. */
        private String stableMultiplier = "10000";
        private int stableDecimals = 22;
    }

    @Data
    public static class Exchange {
        private String nativeAssetId = "native";
        private int nativeDecimals = 24;
        private int stableDecimals = 18;
        private Spread spread = new Spread();
        /** Commission rates in parts per million, keyed by accepted asset id. */
        private Map<String, CommissionRates> commission = new LinkedHashMap<>();
        private long defaultCommissionPpm = 100;
        private int minCollateralRatio = 100;
        private int maxCollateralRatio = 1000;
        private List<TreasuryToken> treasuryTokens = new ArrayList<>();
    }

    @Data
    public static class Spread {
        /** FIXED or ADAPTIVE. */
        private String mode = "FIXED";
        private int fixedBps = 10;
        private BigDecimal min = new BigDecimal("0.001");
        private BigDecimal max = new BigDecimal("0.005");
        private BigDecimal scaler = new BigDecimal("0.1");
        /** Traded notional (reference units) at which the adaptive response reaches half of max - min. */
        private BigDecimal saturation = new BigDecimal("1000000");
    }

    @Data
    public static class CommissionRates {
        private long depositPpm = 100;
        private long withdrawPpm = 100;
    }

    @Data
    public static class TreasuryToken {
        private String id;
        private int decimals;
    }

    @Data
    public static class Market {
        private String stableAssetId = "stable";
        /** System account holding the stable asset's supply-side bookkeeping. */
        private String issuerAccount = "stable-core.issuer";
        private BigDecimal liquidationIncentive = new BigDecimal("0.05");
        private int maxAssetsPerAccount = 20;
        private AccrualMode accrualMode = AccrualMode.COMPOUND;
        private List<AssetDef> assets = new ArrayList<>();
    }

    @Data
    public static class AssetDef {
        private String id;
        private int decimals;
        private boolean enabled = true;
        private BigDecimal baseRate = BigDecimal.ZERO;
        private BigDecimal slope1 = BigDecimal.ZERO;
        private BigDecimal slope2 = BigDecimal.ZERO;
        private BigDecimal kink = new BigDecimal("0.8");
        private BigDecimal reserveFactor = new BigDecimal("0.1");
        private BigDecimal collateralFactor = new BigDecimal("0.6");
        private boolean canDeposit = true;
        private boolean canWithdraw = true;
        private boolean canUseAsCollateral = true;
        private boolean canBorrow = true;
    }

    @Data
    public static class Auth {
        /** HMAC key of the bearer tokens; callers are identified by the token subject. */
        private String jwtSecret;
        /** When set, tokens must carry this issuer. */
        private String jwtIssuer;
        private String owner;
        private List<String> guardians = new ArrayList<>();
        /** Guardians additionally allowed to force-close insolvent accounts. */
        private List<String> liquidators = new ArrayList<>();
    }

    @Data
    public static class Venue {
        private String baseUrl = "http://localhost:8081";
        private int connectTimeoutSec = 5;
        private int readTimeoutSec = 15;
    }
}
