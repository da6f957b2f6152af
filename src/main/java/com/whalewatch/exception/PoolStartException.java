package com.whalewatch.exception;

import java.util.Map;
import lombok.Getter;

/** Neither the pooled nor the fallback subscribe pass reached the success floor. */
@Getter
public class PoolStartException extends BaseException {

    private final double successRate;

    public PoolStartException(String message, double successRate) {
        super(ErrorCode.POOL_START_FAILED, message, Map.of("successRate", successRate), null);
        this.successRate = successRate;
    }
}
