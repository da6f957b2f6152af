package com.whalewatch.domain.model;

import com.whalewatch.domain.enums.Direction;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted rolling total for one (entity, direction) pair.
 *
 * <p>Stored as JSON in Redis under {@code whalewatch:window:{entityId}:{direction}}.
 * {@code cumulativeAmount} is a running sum of every accepted amount since {@code windowStart};
 * {@code samples} keeps only the most recent entries for diagnostics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WindowCounter {

    private String entityId;
    private Direction direction;
    private long windowStart;
    private BigDecimal cumulativeAmount;

    @Builder.Default
    private List<WindowSample> samples = new ArrayList<>();

    private long updatedAt;

    public static WindowCounter empty(String entityId, Direction direction, long windowStart) {
        return WindowCounter.builder()
                .entityId(entityId)
                .direction(direction)
                .windowStart(windowStart)
                .cumulativeAmount(BigDecimal.ZERO)
                .samples(new ArrayList<>())
                .build();
    }
}
