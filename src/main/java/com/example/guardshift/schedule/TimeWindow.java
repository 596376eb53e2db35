package com.example.guardshift.schedule;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Half-open {@code [start, end)} interval of wall-clock time.
 */
public record TimeWindow(LocalDateTime start, LocalDateTime end) {

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Window start must be before end: " + start + " - " + end);
        }
    }

    public boolean overlaps(LocalDateTime otherStart, LocalDateTime otherEnd) {
        return start.isBefore(otherEnd) && end.isAfter(otherStart);
    }
}
