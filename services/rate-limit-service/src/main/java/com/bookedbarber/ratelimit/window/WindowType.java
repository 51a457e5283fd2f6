package com.bookedbarber.ratelimit.window;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Fixed calendar windows in UTC. Buckets roll over at the top of the hour and at midnight.
 */
public enum WindowType {
    HOURLY("hourly", DateTimeFormatter.ofPattern("yyyy-MM-dd-HH"), ChronoUnit.HOURS),
    DAILY("daily", DateTimeFormatter.ofPattern("yyyy-MM-dd"), ChronoUnit.DAYS);

    private final String code;
    private final DateTimeFormatter suffixFormat;
    private final ChronoUnit unit;

    WindowType(String code, DateTimeFormatter suffixFormat, ChronoUnit unit) {
        this.code = code;
        this.suffixFormat = suffixFormat.withZone(ZoneOffset.UTC);
        this.unit = unit;
    }

    public String code() {
        return code;
    }

    public long windowSeconds() {
        return unit.getDuration().toSeconds();
    }

    public String bucketSuffix(Instant now) {
        return suffixFormat.format(now);
    }

    public Instant bucketStart(Instant now) {
        return ZonedDateTime.ofInstant(now, ZoneOffset.UTC).truncatedTo(unit).toInstant();
    }

    public Instant nextBoundary(Instant now) {
        return bucketStart(now).plus(unit.getDuration());
    }

    /**
     * Time left in the current bucket, at least one second.
     */
    public Duration untilReset(Instant now) {
        Duration remaining = Duration.between(now, nextBoundary(now));
        return remaining.compareTo(Duration.ofSeconds(1)) < 0 ? Duration.ofSeconds(1) : remaining;
    }
}
