package com.whalewatch.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Monitor configuration bound from the {@code monitor.*} namespace.
 *
 * <p>Defaults mirror a production deployment watching a handful of accounts over two
 * pooled connections. Every duration accepts Spring's duration syntax ({@code 30s}, {@code 24h}).
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {

    @Valid
    private List<Entity> entities = new ArrayList<>();

    /** Perpetual coins to watch. Empty means every non-spot coin. */
    private List<String> watchedAssets = new ArrayList<>();

    /** Fills with size times price below this are ignored. */
    @NotNull
    private BigDecimal minNotional = new BigDecimal("100");

    @Valid
    private Rules rules = new Rules();

    @Valid
    private Window window = new Window();

    @Valid
    private Dedup dedup = new Dedup();

    @Valid
    private Aggregation aggregation = new Aggregation();

    @Valid
    private Queue queue = new Queue();

    @Valid
    private Pool pool = new Pool();

    @Valid
    private Transport transport = new Transport();

    @Valid
    private Delivery delivery = new Delivery();

    @Valid
    private Status status = new Status();

    @Getter
    @Setter
    public static class Entity {
        @NotBlank
        private String id;

        private String label;
        private boolean active = true;
        private BigDecimal singleThreshold;
        private BigDecimal cumulativeThreshold;
    }

    @Getter
    @Setter
    public static class Rules {
        private Rule single = new Rule(new BigDecimal("10000"));
        private Rule cumulative = new Rule(new BigDecimal("50000"));
    }

    @Getter
    @Setter
    public static class Rule {
        private boolean enabled = true;

        @NotNull
        private BigDecimal threshold;

        public Rule() {}

        public Rule(BigDecimal threshold) {
            this.threshold = threshold;
        }
    }

    @Getter
    @Setter
    public static class Window {
        private Duration length = Duration.ofHours(24);

        /** Fixed anchor for window boundaries, in epoch millis. Must not change across restarts. */
        private long anchorEpochMs = 0L;

        private Duration ttlMargin = Duration.ofHours(1);

        @Min(1)
        private int maxSamples = 100;
    }

    @Getter
    @Setter
    public static class Dedup {
        /** Added to the window length so a marker always outlives the window it protects. */
        private Duration ttlMargin = Duration.ofHours(1);

        /** Claim with a single SET NX instead of a separate check and mark. */
        private boolean atomicClaim = true;
    }

    @Getter
    @Setter
    public static class Aggregation {
        private Duration quiescence = Duration.ofSeconds(3);
    }

    @Getter
    @Setter
    public static class Queue {
        @Min(1)
        private int capacity = 10_000;

        private Duration offerTimeout = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class Pool {
        @Min(1)
        private int size = 2;

        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration subscribeTimeout = Duration.ofSeconds(45);

        @Min(1)
        private int subscribeAttempts = 3;

        private Duration backoffBase = Duration.ofSeconds(3);
        private Duration backoffMax = Duration.ofSeconds(30);

        /** Pause after each successful subscription. */
        private Duration subscriptionDelay = Duration.ofSeconds(5);

        /** Start offset between consecutive slots. */
        private Duration slotStagger = Duration.ofSeconds(10);

        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private Duration warnStaleness = Duration.ofMinutes(3);
        private Duration criticalStaleness = Duration.ofMinutes(5);

        @Min(0)
        private int failureCeiling = 8;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double successFloor = 0.5;

        @Min(1)
        private int maxReconnectAttempts = 5;

        private Duration unsubscribeTimeout = Duration.ofSeconds(5);
        private Duration closeTimeout = Duration.ofSeconds(3);

        /** Upper bound for the whole initial subscribe pass of one mode. */
        private Duration startTimeout = Duration.ofMinutes(2);

        @Valid
        private Fallback fallback = new Fallback();
    }

    /** Conservative settings for the single-connection degraded mode. */
    @Getter
    @Setter
    public static class Fallback {
        private Duration connectTimeout = Duration.ofSeconds(60);
        private Duration subscribeTimeout = Duration.ofSeconds(60);
        private Duration subscriptionDelay = Duration.ofSeconds(8);
    }

    @Getter
    @Setter
    public static class Transport {
        /** {@code websocket} (pooled persistent stream) or {@code polling}. */
        @NotBlank
        private String strategy = "websocket";

        @NotBlank
        private String wsUrl = "wss://api.hyperliquid.xyz/ws";

        @NotBlank
        private String infoUrl = "https://api.hyperliquid.xyz/info";

        private Duration pingInterval = Duration.ofSeconds(50);
        private Duration pollInterval = Duration.ofSeconds(15);
        private Duration httpTimeout = Duration.ofSeconds(10);
        private List<String> channels = new ArrayList<>(List.of("userFills", "userNonFundingLedgerUpdates"));
    }

    @Getter
    @Setter
    public static class Delivery {
        /** Blank selects the log-only sink. */
        private String webhookUrl = "";

        private Duration timeout = Duration.ofSeconds(5);

        @Min(1)
        private int maxAttempts = 3;

        private Duration retryDelay = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class Status {
        private Duration updateInterval = Duration.ofSeconds(30);
        private Duration reportInterval = Duration.ofMinutes(5);
    }
}
