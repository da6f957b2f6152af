package com.whalewatch.domain.model;

import com.whalewatch.domain.enums.Direction;
import com.whalewatch.domain.enums.EventKind;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Provider-independent shape of one observed fill or transfer.
 *
 * <p>{@code amount} is the size in asset units. {@code price} is present for fills only.
 * Timestamps are epoch milliseconds: {@code occurredAt} from the provider, {@code observedAt}
 * when this process received the payload.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class CanonicalEvent {

    private final String entityId;
    private final EventKind kind;
    private final BigDecimal amount;
    private final BigDecimal price;
    private final String asset;
    private final String sourceId;
    private final String orderId;
    /** Exchange-assigned id of a single fill ({@code tid}); null for transfers. */
    private final String fillId;
    private final long occurredAt;
    private final long observedAt;

    public Direction getDirection() {
        return kind.getDirection();
    }

    /**
     * Identity of this exact fill within its order. The transaction hash alone is not enough, since
     * several fills of one order can share it.
     */
    public String fillIdentity() {
        if (fillId != null && !fillId.isBlank()) {
            return fillId;
        }
        return sourceId + "|" + occurredAt + "|" + amount + "|" + price;
    }

    public boolean hasOrderId() {
        return orderId != null && !orderId.isBlank();
    }

    /** Size times price, or the plain amount for transfers. */
    public BigDecimal notional() {
        return price != null ? amount.multiply(price) : amount;
    }
}
