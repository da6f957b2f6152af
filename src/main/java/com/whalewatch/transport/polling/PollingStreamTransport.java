package com.whalewatch.transport.polling;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whalewatch.exception.TransportException;
import com.whalewatch.ingest.EventNormalizer;
import com.whalewatch.transport.RawPayload;
import com.whalewatch.transport.RawPayloadHandler;
import com.whalewatch.transport.StreamTransport;
import com.whalewatch.transport.SubscriptionHandle;
import com.whalewatch.transport.TransportListener;
import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport that polls the info endpoint for each subscribed entity and emits only fills and
 * ledger updates not seen before.
 *
 * <p>Each entity keeps one cursor per feed (latest item time seen) and a bounded set of recently
 * emitted item ids, so an item is emitted once even when the next poll window overlaps the previous
 * one. New fills are wrapped as a {@code userFills} payload and new ledger updates as a
 * {@code userNonFundingLedgerUpdates} payload, the same shapes the stream transport delivers.
 *
 * <p>A successful poll counts as activity; a failed one is reported to the listener and leaves the
 * cursor unchanged so the next poll retries the same range.
 */
public class PollingStreamTransport implements StreamTransport {

    private static final Logger log = LoggerFactory.getLogger(PollingStreamTransport.class);

    private static final int SEEN_LIMIT = 2_000;

    private final int slot;
    private final InfoApiClient infoApiClient;
    private final TransportListener listener;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final long pollIntervalMs;
    private final Supplier<ScheduledExecutorService> schedulerFactory;

    private final Map<String, EntityCursor> cursors = new ConcurrentHashMap<>();
    private volatile ScheduledExecutorService scheduler;

    public PollingStreamTransport(
            int slot,
            InfoApiClient infoApiClient,
            TransportListener listener,
            ObjectMapper objectMapper,
            Clock clock,
            Duration pollInterval) {
        this(slot, infoApiClient, listener, objectMapper, clock, pollInterval, () ->
                Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread thread = new Thread(r, "poll-slot-" + slot);
                    thread.setDaemon(true);
                    return thread;
                }));
    }

    public PollingStreamTransport(
            int slot,
            InfoApiClient infoApiClient,
            TransportListener listener,
            ObjectMapper objectMapper,
            Clock clock,
            Duration pollInterval,
            Supplier<ScheduledExecutorService> schedulerFactory) {
        this.slot = slot;
        this.infoApiClient = infoApiClient;
        this.listener = listener;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.pollIntervalMs = pollInterval.toMillis();
        this.schedulerFactory = schedulerFactory;
    }

    /** The timeout is enforced by the HTTP client's own connect/read timeouts. */
    @Override
    public void connect(Duration timeout) {
        infoApiClient.probe();
        if (scheduler == null) {
            scheduler = schedulerFactory.get();
        }
        listener.onActivity();
        log.info("Slot {} polling transport ready (interval {}ms)", slot, pollIntervalMs);
    }

    /**
     * Runs one poll synchronously so that unreachable or rejected entities fail the subscribe call,
     * then schedules periodic polls.
     */
    @Override
    public SubscriptionHandle subscribe(String entityId, RawPayloadHandler onEvent) {
        ScheduledExecutorService current = scheduler;
        if (current == null) {
            throw new TransportException("Slot " + slot + " is not connected");
        }
        String user = entityId.toLowerCase(Locale.ROOT);
        EntityCursor cursor = new EntityCursor(user, onEvent, clock.millis());
        poll(cursor);

        cursor.task = current.scheduleWithFixedDelay(
                () -> pollSafely(cursor), pollIntervalMs, pollIntervalMs, TimeUnit.MILLISECONDS);
        cursors.put(user, cursor);
        return new SubscriptionHandle(
                entityId, List.of(EventNormalizer.CHANNEL_FILLS, EventNormalizer.CHANNEL_LEDGER));
    }

    @Override
    public void unsubscribe(SubscriptionHandle handle) {
        EntityCursor cursor = cursors.remove(handle.entityId().toLowerCase(Locale.ROOT));
        if (cursor != null && cursor.task != null) {
            cursor.task.cancel(false);
        }
    }

    @Override
    public void close() {
        cursors.values().forEach(cursor -> {
            if (cursor.task != null) {
                cursor.task.cancel(false);
            }
        });
        cursors.clear();
        ScheduledExecutorService current = scheduler;
        scheduler = null;
        if (current != null) {
            current.shutdownNow();
        }
    }

    @Override
    public boolean isOpen() {
        return scheduler != null;
    }

    private void pollSafely(EntityCursor cursor) {
        try {
            poll(cursor);
        } catch (TransportException e) {
            log.warn("Slot {} poll failed for {}: {}", slot, cursor.user, e.getMessage());
            listener.onError(e);
        } catch (RuntimeException e) {
            log.error("Slot {} unexpected poll failure for {}", slot, cursor.user, e);
            listener.onError(e);
        }
    }

    private void poll(EntityCursor cursor) {
        long now = clock.millis();
        JsonNode fills = infoApiClient.userFillsByTime(cursor.user, cursor.fills.since, now);
        JsonNode ledger = infoApiClient.userNonFundingLedgerUpdates(cursor.user, cursor.ledger.since, now);
        listener.onActivity();

        emit(cursor, cursor.fills, fills, now);
        emit(cursor, cursor.ledger, ledger, now);
    }

    private void emit(EntityCursor cursor, FeedCursor feed, JsonNode items, long now) {
        if (items == null || !items.isArray() || items.isEmpty()) {
            return;
        }

        ArrayNode fresh = objectMapper.createArrayNode();
        long maxTime = feed.since;
        for (JsonNode item : items) {
            if (feed.markSeen(feed.kind.idOf(item))) {
                fresh.add(item);
            }
            maxTime = Math.max(maxTime, item.path("time").asLong(0L));
        }
        feed.since = maxTime;

        if (fresh.isEmpty()) {
            return;
        }
        ObjectNode data = objectMapper.createObjectNode();
        data.put("user", cursor.user);
        data.put("isSnapshot", false);
        data.set(feed.kind.arrayField, fresh);
        log.debug("Slot {} polled {} new {} items for {}", slot, fresh.size(), feed.kind.channel, cursor.user);
        cursor.handler.onPayload(new RawPayload(feed.kind.channel, cursor.user, data, now));
    }

    private enum Feed {
        FILLS(EventNormalizer.CHANNEL_FILLS, "fills") {
            @Override
            String idOf(JsonNode fill) {
                if (fill.hasNonNull("tid")) {
                    return fill.get("tid").asText();
                }
                return fill.path("hash").asText() + "|" + fill.path("time").asText() + "|" + fill.path("oid").asText();
            }
        },
        LEDGER(EventNormalizer.CHANNEL_LEDGER, "nonFundingLedgerUpdates") {
            @Override
            String idOf(JsonNode update) {
                return update.path("hash").asText() + "|" + update.path("time").asText() + "|"
                        + update.path("delta").path("type").asText();
            }
        };

        private final String channel;
        private final String arrayField;

        Feed(String channel, String arrayField) {
            this.channel = channel;
            this.arrayField = arrayField;
        }

        abstract String idOf(JsonNode item);
    }

    /** Cursor and recently emitted ids of one feed of one entity. */
    private static final class FeedCursor {
        private final Feed kind;
        private final Set<String> seen = new LinkedHashSet<>();
        private volatile long since;

        private FeedCursor(Feed kind, long since) {
            this.kind = kind;
            this.since = since;
        }

        synchronized boolean markSeen(String id) {
            if (!seen.add(id)) {
                return false;
            }
            if (seen.size() > SEEN_LIMIT) {
                Iterator<String> oldest = seen.iterator();
                oldest.next();
                oldest.remove();
            }
            return true;
        }
    }

    /** Poll state for one entity; touched only by the slot's scheduler thread and the subscribing thread. */
    private static final class EntityCursor {
        private final String user;
        private final RawPayloadHandler handler;
        private final FeedCursor fills;
        private final FeedCursor ledger;
        private volatile ScheduledFuture<?> task;

        private EntityCursor(String user, RawPayloadHandler handler, long since) {
            this.user = user;
            this.handler = handler;
            this.fills = new FeedCursor(Feed.FILLS, since);
            this.ledger = new FeedCursor(Feed.LEDGER, since);
        }
    }
}
