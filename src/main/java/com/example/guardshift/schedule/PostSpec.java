package com.example.guardshift.schedule;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A post and the part of the day it must be staffed. A {@code null} coverage window means 24/7.
 */
public record PostSpec(String name, TimeOfDayRange coverage) {

    public PostSpec {
        Objects.requireNonNull(name, "name");
    }

    public static PostSpec allDay(String name) {
        return new PostSpec(name, null);
    }

    public boolean isAlwaysStaffed() {
        return coverage == null;
    }

    public boolean requiresCoverageAt(LocalDateTime slotStart) {
        return coverage == null || coverage.contains(slotStart.toLocalTime());
    }
}
