package com.whalewatch.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * An account (address) being watched. Loaded once from configuration and never mutated.
 *
 * <p>Per-entity thresholds are optional; when absent the global rule threshold applies.
 */
@Getter
@Builder
@ToString
public class WatchedEntity {

    private final String id;
    private final String label;
    private final boolean active;
    private final BigDecimal singleThreshold;
    private final BigDecimal cumulativeThreshold;

    public BigDecimal singleThresholdOr(BigDecimal globalThreshold) {
        return singleThreshold != null ? singleThreshold : globalThreshold;
    }

    public BigDecimal cumulativeThresholdOr(BigDecimal globalThreshold) {
        return cumulativeThreshold != null ? cumulativeThreshold : globalThreshold;
    }
}
