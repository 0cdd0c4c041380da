package org.dgov.support;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock whose time only moves when a test says so.
 */
public class MutableClock extends Clock {

    private volatile Instant now;

    public MutableClock(long epochSeconds) {
        this.now = Instant.ofEpochSecond(epochSeconds);
    }

    public void setTime(long epochSeconds) {
        this.now = Instant.ofEpochSecond(epochSeconds);
    }

    public void advance(long seconds) {
        this.now = now.plusSeconds(seconds);
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
    public Instant instant() {
        return now;
    }
}
