package io.agentrelay;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

public final class ManualClock extends Clock {
    private volatile long nowMs;

    public ManualClock(long startMs) {
        this.nowMs = startMs;
    }

    public void advance(long deltaMs) {
        nowMs += deltaMs;
    }

    public void set(long valueMs) {
        nowMs = valueMs;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public long millis() {
        return nowMs;
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(nowMs);
    }
}
