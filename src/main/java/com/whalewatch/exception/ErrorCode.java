package com.whalewatch.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    NOT_FOUND("NOT_FOUND", 404),
    TRANSPORT_TIMEOUT("TRANSPORT_TIMEOUT", 504),
    TRANSPORT_UNAUTHORIZED("TRANSPORT_UNAUTHORIZED", 502),
    TRANSPORT_ERROR("TRANSPORT_ERROR", 502),
    POOL_START_FAILED("POOL_START_FAILED", 503),
    STORE_UNAVAILABLE("STORE_UNAVAILABLE", 503),
    DELIVERY_FAILED("DELIVERY_FAILED", 502),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
