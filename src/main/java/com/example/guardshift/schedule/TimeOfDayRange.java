package com.example.guardshift.schedule;

import java.time.LocalTime;
import java.util.Objects;

/**
 * A daily {@code [start, end)} window on the clock face. When {@code start > end} the window
 * wraps midnight; when {@code start == end} it is empty.
 */
public record TimeOfDayRange(LocalTime start, LocalTime end) {

    public TimeOfDayRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public static TimeOfDayRange of(String start, String end) {
        return new TimeOfDayRange(LocalTime.parse(start), LocalTime.parse(end));
    }

    public boolean wrapsMidnight() {
        return start.isAfter(end);
    }

    public boolean contains(LocalTime time) {
        if (wrapsMidnight()) {
            return !time.isBefore(start) || time.isBefore(end);
        }
        return !time.isBefore(start) && time.isBefore(end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
