package com.whalewatch.delivery;

import com.whalewatch.domain.model.Alert;

/**
 * Downstream receiver of alerts. Implementations own their retry policy; the rule engine calls
 * {@link #send} once per alert and only records the outcome.
 */
public interface DeliverySink {

    /**
     * @return true if the alert was accepted downstream
     */
    boolean send(Alert alert);
}
