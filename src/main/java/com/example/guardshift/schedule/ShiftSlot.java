package com.example.guardshift.schedule;

import java.time.Duration;
import java.time.LocalDateTime;

public record ShiftSlot(String post, LocalDateTime start, LocalDateTime end, boolean night) {

    public double durationHours() {
        return Duration.between(start, end).toSeconds() / 3600.0;
    }
}
