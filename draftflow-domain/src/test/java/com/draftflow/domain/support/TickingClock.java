package com.draftflow.domain.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * TickingClock - 测试用可手动推进的时钟
 */
public class TickingClock extends Clock {

    private Instant current;
    private final ZoneId zone;

    public TickingClock(LocalDateTime start) {
        this(start.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    }

    private TickingClock(Instant current, ZoneId zone) {
        this.current = current;
        this.zone = zone;
    }

    public void advance(Duration duration) {
        current = current.plus(duration);
    }

    public void set(LocalDateTime time) {
        current = time.atZone(zone).toInstant();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new TickingClock(current, zone);
    }

    @Override
    public Instant instant() {
        return current;
    }
}
