package com.whalewatch.delivery;

import com.whalewatch.domain.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Used when no webhook is configured: alerts only reach the log. */
public class LoggingDeliverySink implements DeliverySink {

    private static final Logger log = LoggerFactory.getLogger(LoggingDeliverySink.class);

    @Override
    public boolean send(Alert alert) {
        log.info(
                "[ALERT] {} {} {} {} (cumulative={}, threshold={}, source={})",
                alert.getAlertType(),
                alert.getEntityLabel(),
                alert.getTriggeringAmount(),
                alert.getAsset(),
                alert.getCumulativeAmount(),
                alert.getThreshold(),
                alert.getSourceId());
        return true;
    }
}
