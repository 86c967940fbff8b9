package com.example.ingestionservice.source;

import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Inclusive time range to fetch. Backfills use whole UTC days,
 * incremental syncs use [last_sync, now].
 */
@Getter
public final class FetchWindow {

    private final Instant from;
    private final Instant to;

    private FetchWindow(Instant from, Instant to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to are required");
        }
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from " + from + " is after to " + to);
        }
        this.from = from;
        this.to = to;
    }

    public static FetchWindow of(Instant from, Instant to) {
        return new FetchWindow(from, to);
    }

    /**
     * First instant of {@code startDate} to the last millisecond of {@code endDate}, UTC.
     */
    public static FetchWindow ofDays(LocalDate startDate, LocalDate endDate) {
        return new FetchWindow(
                startDate.atStartOfDay(ZoneOffset.UTC).toInstant(),
                endDate.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusMillis(1));
    }

    public LocalDate fromDate() {
        return from.atZone(ZoneOffset.UTC).toLocalDate();
    }

    public LocalDate toDate() {
        return to.atZone(ZoneOffset.UTC).toLocalDate();
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(from) && !instant.isAfter(to);
    }

    @Override
    public String toString() {
        return "[" + from + ", " + to + "]";
    }
}
