package io.agentrelay.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingNotificationSink implements NotificationSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void notify(String from, String to, String summary) {
        log.info("notify to={} from={} summary={}", to, from, summary);
    }
}
