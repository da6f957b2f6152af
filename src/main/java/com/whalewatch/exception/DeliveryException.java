package com.whalewatch.exception;

public class DeliveryException extends BaseException {

    public DeliveryException(String message, Throwable cause) {
        super(ErrorCode.DELIVERY_FAILED, message, cause);
    }
}
