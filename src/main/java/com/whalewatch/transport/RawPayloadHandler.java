package com.whalewatch.transport;

@FunctionalInterface
public interface RawPayloadHandler {

    void onPayload(RawPayload payload);
}
