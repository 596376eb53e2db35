package com.example.guardshift.exception;

import java.time.LocalDateTime;

/**
 * Raised when no guard in the rotation can take a slot. Aborts the whole request.
 */
public class UnfillableSlotException extends ScheduleGenerationException {

    private final String post;
    private final LocalDateTime slotStart;
    private final LocalDateTime slotEnd;

    public UnfillableSlotException(String post, LocalDateTime slotStart, LocalDateTime slotEnd) {
        super(ScheduleErrorCode.UNFILLABLE_SLOT,
                "No eligible guard for post '" + post + "' between " + slotStart + " and " + slotEnd
                        + ". Try relaxing some constraints or adding more guards.",
                post, slotStart, slotEnd);
        this.post = post;
        this.slotStart = slotStart;
        this.slotEnd = slotEnd;
    }

    public String getPost() {
        return post;
    }

    public LocalDateTime getSlotStart() {
        return slotStart;
    }

    public LocalDateTime getSlotEnd() {
        return slotEnd;
    }
}
