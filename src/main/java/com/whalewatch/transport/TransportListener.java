package com.whalewatch.transport;

/**
 * Connection-level callbacks a transport reports to its owner. Activity covers every inbound
 * frame or successful poll, including keep-alive replies.
 */
public interface TransportListener {

    void onActivity();

    void onError(Throwable error);
}
