package com.whalewatch.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.whalewatch.config.MonitorProperties;
import com.whalewatch.domain.enums.EventKind;
import com.whalewatch.domain.model.CanonicalEvent;
import com.whalewatch.transport.RawPayload;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps provider payloads to {@link CanonicalEvent}s.
 *
 * <p>Two channels are understood: {@code userFills} (trades) and
 * {@code userNonFundingLedgerUpdates} (spot transfers). Snapshot payloads, spot-index coins,
 * unwatched assets, fills under the notional floor and payloads addressed to another user are
 * skipped. A malformed entry is logged and skipped without affecting its siblings.
 */
@Component
public class EventNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EventNormalizer.class);

    public static final String CHANNEL_FILLS = "userFills";
    public static final String CHANNEL_LEDGER = "userNonFundingLedgerUpdates";

    private static final long MILLIS_THRESHOLD = 1_000_000_000_000L;
    private static final Set<String> TRANSFER_TYPES = Set.of("spotTransfer", "send");

    private final Set<String> watchedAssets;
    private final BigDecimal minNotional;

    public EventNormalizer(MonitorProperties monitorProperties) {
        this.watchedAssets = monitorProperties.getWatchedAssets().stream()
                .map(asset -> asset.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.minNotional = monitorProperties.getMinNotional();
    }

    public List<CanonicalEvent> normalize(RawPayload payload) {
        JsonNode data = payload.data();
        if (data == null || !data.isObject()) {
            log.debug("Ignoring non-object payload on {}", payload.channel());
            return Collections.emptyList();
        }
        if (data.path("isSnapshot").asBoolean(false)) {
            log.debug("Skipping snapshot payload on {} for {}", payload.channel(), payload.subscribedEntityId());
            return Collections.emptyList();
        }

        String entityId = payload.subscribedEntityId();
        String user = data.path("user").asText(null);
        if (user != null && !user.equalsIgnoreCase(entityId)) {
            log.debug("Payload for {} arrived on subscription of {}, skipping", user, entityId);
            return Collections.emptyList();
        }

        if (CHANNEL_FILLS.equals(payload.channel())) {
            return normalizeFills(data.path("fills"), entityId, payload.receivedAt());
        }
        if (CHANNEL_LEDGER.equals(payload.channel())) {
            return normalizeLedger(data.path("nonFundingLedgerUpdates"), entityId, payload.receivedAt());
        }
        log.debug("Unhandled channel {}", payload.channel());
        return Collections.emptyList();
    }

    private List<CanonicalEvent> normalizeFills(JsonNode fills, String entityId, long observedAt) {
        if (!fills.isArray()) {
            return Collections.emptyList();
        }
        List<CanonicalEvent> events = new ArrayList<>();
        for (JsonNode fill : fills) {
            try {
                CanonicalEvent event = toFillEvent(fill, entityId, observedAt);
                if (event != null) {
                    events.add(event);
                }
            } catch (RuntimeException e) {
                log.warn("Dropping malformed fill for {}: {} ({})", entityId, fill, e.getMessage());
            }
        }
        return events;
    }

    private CanonicalEvent toFillEvent(JsonNode fill, String entityId, long observedAt) {
        String coin = fill.path("coin").asText("");
        if (coin.isEmpty() || coin.startsWith("@") || !isWatched(coin)) {
            return null;
        }

        BigDecimal size = new BigDecimal(fill.path("sz").asText()).abs();
        BigDecimal price = new BigDecimal(fill.path("px").asText());
        if (size.signum() == 0 || size.multiply(price).compareTo(minNotional) < 0) {
            return null;
        }

        String sourceId = fillSourceId(fill);
        if (sourceId == null) {
            throw new IllegalArgumentException("fill has neither hash nor tid");
        }

        return CanonicalEvent.builder()
                .entityId(entityId)
                .kind("B".equals(fill.path("side").asText()) ? EventKind.TRADE_BUY : EventKind.TRADE_SELL)
                .amount(size)
                .price(price)
                .asset(coin.toUpperCase(Locale.ROOT))
                .sourceId(sourceId)
                .orderId(fill.hasNonNull("oid") ? fill.get("oid").asText() : null)
                .fillId(fill.hasNonNull("tid") ? fill.get("tid").asText() : null)
                .occurredAt(toMillis(fill.path("time").asLong(observedAt)))
                .observedAt(observedAt)
                .build();
    }

    private List<CanonicalEvent> normalizeLedger(JsonNode updates, String entityId, long observedAt) {
        if (!updates.isArray()) {
            return Collections.emptyList();
        }
        List<CanonicalEvent> events = new ArrayList<>();
        for (JsonNode update : updates) {
            try {
                CanonicalEvent event = toTransferEvent(update, entityId, observedAt);
                if (event != null) {
                    events.add(event);
                }
            } catch (RuntimeException e) {
                log.warn("Dropping malformed ledger update for {}: {} ({})", entityId, update, e.getMessage());
            }
        }
        return events;
    }

    private CanonicalEvent toTransferEvent(JsonNode update, String entityId, long observedAt) {
        JsonNode delta = update.path("delta");
        if (!TRANSFER_TYPES.contains(delta.path("type").asText())) {
            return null;
        }
        String token = delta.path("token").asText("");
        if (token.isEmpty() || !isWatched(token)) {
            return null;
        }

        EventKind kind;
        if (entityId.equalsIgnoreCase(delta.path("destination").asText())) {
            kind = EventKind.TRANSFER_IN;
        } else if (entityId.equalsIgnoreCase(delta.path("user").asText())) {
            kind = EventKind.TRANSFER_OUT;
        } else {
            return null;
        }

        String hash = update.path("hash").asText(null);
        if (isBlankHash(hash)) {
            throw new IllegalArgumentException("ledger update has no hash");
        }

        return CanonicalEvent.builder()
                .entityId(entityId)
                .kind(kind)
                .amount(new BigDecimal(delta.path("amount").asText()).abs())
                .asset(token.toUpperCase(Locale.ROOT))
                .sourceId(hash)
                .occurredAt(toMillis(update.path("time").asLong(observedAt)))
                .observedAt(observedAt)
                .build();
    }

    private boolean isWatched(String asset) {
        return watchedAssets.isEmpty() || watchedAssets.contains(asset.toUpperCase(Locale.ROOT));
    }

    private static String fillSourceId(JsonNode fill) {
        String hash = fill.path("hash").asText(null);
        if (!isBlankHash(hash)) {
            return hash;
        }
        return fill.hasNonNull("tid") ? fill.get("tid").asText() : null;
    }

    /** Absent, empty, or an all-zero hex string. */
    static boolean isBlankHash(String hash) {
        if (hash == null || hash.isBlank()) {
            return true;
        }
        String digits = hash.startsWith("0x") ? hash.substring(2) : hash;
        return digits.chars().allMatch(c -> c == '0');
    }

    /** Provider times above 1e12 are already milliseconds; anything smaller is seconds. */
    static long toMillis(long time) {
        return time > MILLIS_THRESHOLD ? time : time * 1000L;
    }
}
