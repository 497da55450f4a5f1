package io.agentrelay.observability;

/**
 * Real-time delivery hint for a recipient. Fire-and-forget: the bus logs and counts failures
 * but never rolls back a delivery because of them.
 */
@FunctionalInterface
public interface NotificationSink {
    void notify(String from, String to, String summary);
}
