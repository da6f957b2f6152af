package com.whalewatch.unit.aggregation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.whalewatch.aggregation.OrderAggregationBuffer;
import com.whalewatch.domain.enums.EventKind;
import com.whalewatch.domain.model.AggregatedEvent;
import com.whalewatch.domain.model.CanonicalEvent;
import com.whalewatch.unit.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for OrderAggregationBuffer. Timers are captured from a mocked scheduler and fired by
 * hand so quiescence can be tested without sleeping.
 */
class OrderAggregationBufferTest {

    private static final Duration QUIESCENCE = Duration.ofSeconds(3);
    private static final String ENTITY = "0xwhale";

    private MutableClock clock;
    private ScheduledExecutorService scheduler;
    private List<Runnable> timers;
    private List<Long> timerDelays;
    private List<ScheduledFuture<?>> futures;
    private List<AggregatedEvent> emitted;
    private OrderAggregationBuffer buffer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        scheduler = mock(ScheduledExecutorService.class);
        timers = new ArrayList<>();
        timerDelays = new ArrayList<>();
        futures = new ArrayList<>();
        emitted = new ArrayList<>();

        when(scheduler.schedule(any(Runnable.class), anyLong(), eq(TimeUnit.MILLISECONDS)))
                .thenAnswer(invocation -> {
                    timers.add(invocation.getArgument(0));
                    timerDelays.add(invocation.getArgument(1));
                    ScheduledFuture<?> future = mock(ScheduledFuture.class);
                    futures.add(future);
                    return future;
                });

        buffer = new OrderAggregationBuffer(QUIESCENCE, emitted::add, clock, scheduler);
    }

    private CanonicalEvent fill(String sourceId, String orderId, String size, String price) {
        return CanonicalEvent.builder()
                .entityId(ENTITY)
                .kind(EventKind.TRADE_BUY)
                .amount(new BigDecimal(size))
                .price(price == null ? null : new BigDecimal(price))
                .asset("HYPE")
                .sourceId(sourceId)
                .orderId(orderId)
                .occurredAt(clock.millis())
                .observedAt(clock.millis())
                .build();
    }

    private void fireLatestTimer() {
        timers.get(timers.size() - 1).run();
    }

    @Nested
    @DisplayName("Singletons")
    class Singletons {

        @Test
        @DisplayName("Event without order id is emitted immediately")
        void noOrderIdBypassesBuffer() {
            buffer.accept(fill("h1", null, "10", "25"));

            assertThat(emitted).hasSize(1);
            assertThat(emitted.get(0).getConstituentCount()).isEqualTo(1);
            assertThat(emitted.get(0).getSourceId()).isEqualTo("h1");
            assertThat(timers).isEmpty();
            assertThat(buffer.getPendingCount()).isZero();
        }

        @Test
        @DisplayName("Single fill of an order is emitted after quiescence as count 1")
        void singleFillAfterQuiet() {
            buffer.accept(fill("h1", "o1", "10", "25"));
            assertThat(emitted).isEmpty();

            clock.advance(QUIESCENCE);
            fireLatestTimer();

            assertThat(emitted).hasSize(1);
            assertThat(emitted.get(0).getConstituentCount()).isEqualTo(1);
            assertThat(emitted.get(0).getWeightedAvgPrice()).isEqualByComparingTo("25");
        }
    }

    @Nested
    @DisplayName("Burst Aggregation")
    class BurstAggregation {

        @Test
        @DisplayName("Fills of one order collapse into one event with summed size and weighted price")
        void collapsesBurst() {
            buffer.accept(fill("h1", "o1", "100", "10"));
            clock.advance(Duration.ofMillis(500));
            buffer.accept(fill("h2", "o1", "300", "12"));
            clock.advance(Duration.ofMillis(500));
            buffer.accept(fill("h3", "o1", "100", "14"));

            clock.advance(QUIESCENCE);
            fireLatestTimer();

            assertThat(emitted).hasSize(1);
            AggregatedEvent event = emitted.get(0);
            assertThat(event.getConstituentCount()).isEqualTo(3);
            assertThat(event.getAmount()).isEqualByComparingTo("500");
            // (100*10 + 300*12 + 100*14) / 500
            assertThat(event.getWeightedAvgPrice()).isEqualByComparingTo("12");
            assertThat(event.getSourceId()).isEqualTo("h1");
            assertThat(event.getConstituentSourceIds()).containsExactly("h1", "h2", "h3");
            assertThat(buffer.getPendingCount()).isZero();
        }

        @Test
        @DisplayName("Each new fill cancels the previous timer")
        void newFillCancelsTimer() {
            buffer.accept(fill("h1", "o1", "1", "10"));
            buffer.accept(fill("h2", "o1", "1", "10"));

            verify(futures.get(0)).cancel(false);
            assertThat(timerDelays).containsExactly(3000L, 3000L);
        }

        @Test
        @DisplayName("Early timer re-arms for the remaining quiet time")
        void earlyTimerRearms() {
            buffer.accept(fill("h1", "o1", "1", "10"));
            clock.advance(Duration.ofSeconds(1));

            fireLatestTimer();

            assertThat(emitted).isEmpty();
            assertThat(timerDelays).containsExactly(3000L, 2000L);

            clock.advance(Duration.ofSeconds(2));
            fireLatestTimer();
            assertThat(emitted).hasSize(1);
        }

        @Test
        @DisplayName("Different orders aggregate independently")
        void ordersIndependent() {
            buffer.accept(fill("h1", "o1", "1", "10"));
            buffer.accept(fill("h2", "o2", "2", "20"));
            assertThat(buffer.getPendingCount()).isEqualTo(2);

            clock.advance(QUIESCENCE);
            timers.forEach(Runnable::run);

            assertThat(emitted).extracting(AggregatedEvent::getOrderId).containsExactlyInAnyOrder("o1", "o2");
        }

        @Test
        @DisplayName("Redelivered fill with the same trade id is counted once")
        void redeliveredFillCountedOnce() {
            CanonicalEvent first = fill("h1", "o1", "6000", "25").toBuilder().fillId("t1").build();
            buffer.accept(first);
            clock.advance(Duration.ofMillis(200));
            buffer.accept(first);

            assertThat(timers).hasSize(1);
            clock.advance(QUIESCENCE);
            fireLatestTimer();

            assertThat(emitted).hasSize(1);
            assertThat(emitted.get(0).getAmount()).isEqualByComparingTo("6000");
            assertThat(emitted.get(0).getConstituentCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Fills sharing a transaction hash but not a trade id are both counted")
        void sharedHashDistinctTradeIds() {
            buffer.accept(fill("h1", "o1", "100", "10").toBuilder().fillId("t1").build());
            buffer.accept(fill("h1", "o1", "100", "10").toBuilder().fillId("t2").build());

            clock.advance(QUIESCENCE);
            fireLatestTimer();

            assertThat(emitted.get(0).getConstituentCount()).isEqualTo(2);
            assertThat(emitted.get(0).getAmount()).isEqualByComparingTo("200");
        }

        @Test
        @DisplayName("Missing price on any fill leaves the average unset")
        void missingPriceNoAverage() {
            buffer.accept(fill("h1", "o1", "1", "10"));
            buffer.accept(fill("h2", "o1", "1", null));

            clock.advance(QUIESCENCE);
            fireLatestTimer();

            assertThat(emitted.get(0).getWeightedAvgPrice()).isNull();
            assertThat(emitted.get(0).getAmount()).isEqualByComparingTo("2");
        }
    }

    @Nested
    @DisplayName("Shutdown")
    class Shutdown {

        @Test
        @DisplayName("Pending orders are dropped, not flushed")
        void dropsPending() {
            buffer.accept(fill("h1", "o1", "1", "10"));
            buffer.accept(fill("h2", "o2", "1", "10"));

            assertThat(buffer.shutdown()).isEqualTo(2);

            assertThat(emitted).isEmpty();
            assertThat(buffer.getPendingCount()).isZero();
            verify(scheduler).shutdownNow();
        }

        @Test
        @DisplayName("Events after shutdown are ignored")
        void ignoresAfterShutdown() {
            buffer.shutdown();

            buffer.accept(fill("h1", null, "1", "10"));

            assertThat(emitted).isEmpty();
        }
    }
}
