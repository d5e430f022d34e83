package com.basketgov.timeline;

import com.basketgov.error.InvalidRequestException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;

/**
 * Position in a basket timeline, encoded as {@code "{ts}:{id}"} where
 * {@code ts} is an ISO-8601 instant. The instant itself contains colons, so
 * the id is taken after the last one.
 */
public record TimelineCursor(Instant ts, long id) implements Comparable<TimelineCursor> {

    private static final Comparator<TimelineCursor> ORDER =
        Comparator.comparing(TimelineCursor::ts).thenComparingLong(TimelineCursor::id);

    public static TimelineCursor parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        int split = raw.lastIndexOf(':');
        if (split <= 0 || split == raw.length() - 1) {
            throw new InvalidRequestException("Malformed timeline cursor: " + raw);
        }
        try {
            Instant ts = Instant.parse(raw.substring(0, split));
            long id = Long.parseLong(raw.substring(split + 1));
            return new TimelineCursor(ts, id);
        } catch (DateTimeParseException | NumberFormatException ex) {
            throw new InvalidRequestException("Malformed timeline cursor: " + raw);
        }
    }

    public String encode() {
        return ts + ":" + id;
    }

    @Override
    public int compareTo(TimelineCursor other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return encode();
    }
}
