package com.whalewatch.domain.model;

import com.whalewatch.domain.enums.Direction;
import com.whalewatch.domain.enums.EventKind;
import java.math.BigDecimal;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * One logical trade or transfer: either a burst of fills sharing an order id collapsed by the
 * aggregation buffer, or a singleton event that carried no order id.
 *
 * <p>The wrapped event holds the summed size and the size-weighted average price. Its
 * {@code sourceId} is the first constituent's, which is the id the rule engine deduplicates on.
 */
@Getter
@ToString
public class AggregatedEvent {

    private final CanonicalEvent event;
    private final int constituentCount;
    private final BigDecimal weightedAvgPrice;
    private final List<String> constituentSourceIds;

    public AggregatedEvent(
            CanonicalEvent event, int constituentCount, BigDecimal weightedAvgPrice, List<String> constituentSourceIds) {
        this.event = event;
        this.constituentCount = constituentCount;
        this.weightedAvgPrice = weightedAvgPrice;
        this.constituentSourceIds = List.copyOf(constituentSourceIds);
    }

    public static AggregatedEvent singleton(CanonicalEvent event) {
        return new AggregatedEvent(event, 1, event.getPrice(), List.of(event.getSourceId()));
    }

    public String getEntityId() {
        return event.getEntityId();
    }

    public String getSourceId() {
        return event.getSourceId();
    }

    public EventKind getKind() {
        return event.getKind();
    }

    public Direction getDirection() {
        return event.getDirection();
    }

    public BigDecimal getAmount() {
        return event.getAmount();
    }

    public String getAsset() {
        return event.getAsset();
    }

    public String getOrderId() {
        return event.getOrderId();
    }

    public long getOccurredAt() {
        return event.getOccurredAt();
    }
}
