package com.whalewatch.domain.model;

import com.whalewatch.domain.enums.Direction;
import com.whalewatch.domain.enums.EventKind;
import com.whalewatch.domain.enums.RuleType;
import java.math.BigDecimal;
import java.util.Locale;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A threshold breach raised by the rule engine. Written once and handed to the delivery sink.
 *
 * <p>{@code cumulativeAmount} is set for cumulative alerts only.
 */
@Getter
@Builder
@ToString
public class Alert {

    private final String entityId;
    private final String entityLabel;
    private final RuleType ruleType;
    private final EventKind kind;
    private final Direction direction;
    private final String asset;
    private final BigDecimal triggeringAmount;
    private final BigDecimal cumulativeAmount;
    private final BigDecimal threshold;
    private final String sourceId;
    private final String orderId;
    private final int constituentCount;
    private final BigDecimal weightedAvgPrice;
    private final long occurredAt;

    @Builder.Default
    private final long createdAt = System.currentTimeMillis();

    /** Wire name such as {@code single_transfer_in} or {@code cumulative_trade_out}. */
    public String getAlertType() {
        return (ruleType.name() + "_" + kind.getCategory() + "_" + direction.name()).toLowerCase(Locale.ROOT);
    }
}
