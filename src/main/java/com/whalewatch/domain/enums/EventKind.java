package com.whalewatch.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kind of activity observed for a watched entity.
 */
@Getter
@RequiredArgsConstructor
public enum EventKind {
    /** Tokens received by the entity. */
    TRANSFER_IN(Direction.IN, "transfer"),

    /** Tokens sent by the entity. */
    TRANSFER_OUT(Direction.OUT, "transfer"),

    /** Derivative fill on the buy (long) side. */
    TRADE_BUY(Direction.IN, "trade"),

    /** Derivative fill on the sell (short) side. */
    TRADE_SELL(Direction.OUT, "trade");

    private final Direction direction;
    private final String category;
}
