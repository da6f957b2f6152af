package com.whalewatch.engine;

import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Snapshot of rule engine counters and live window totals keyed by entity label. */
@Getter
@Builder
public class EngineStats {

    private final int totalEntities;
    private final int activeEntities;
    private final int activeRules;
    private final long eventsProcessed;
    private final long duplicatesDropped;
    private final long unknownEntityDropped;
    private final long singleAlerts;
    private final long cumulativeAlerts;
    private final long deliveryFailures;
    private final Map<String, WindowTotals> windowTotals;

    public record WindowTotals(BigDecimal in, BigDecimal out) {}
}
