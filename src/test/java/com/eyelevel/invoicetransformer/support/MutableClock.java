package com.eyelevel.invoicetransformer.support;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A UTC clock that tests move by hand.
 */
public final class MutableClock extends Clock {

    private volatile Instant instant;

    public MutableClock(final LocalDateTime start) {
        this.instant = start.toInstant(ZoneOffset.UTC);
    }

    public void set(final LocalDateTime time) {
        this.instant = time.toInstant(ZoneOffset.UTC);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(final ZoneId zone) {
        throw new UnsupportedOperationException("MutableClock is fixed to UTC");
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
