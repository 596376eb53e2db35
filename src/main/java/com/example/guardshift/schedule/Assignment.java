package com.example.guardshift.schedule;

import java.time.LocalDateTime;

public record Assignment(String guard, String post, LocalDateTime shiftStart, LocalDateTime shiftEnd, boolean night) {

    static Assignment of(String guard, ShiftSlot slot) {
        return new Assignment(guard, slot.post(), slot.start(), slot.end(), slot.night());
    }

    public boolean overlaps(Assignment other) {
        return shiftStart.isBefore(other.shiftEnd) && shiftEnd.isAfter(other.shiftStart);
    }
}
