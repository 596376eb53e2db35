package com.example.guardshift.schedule;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a guard may take a slot: the guard must not be unavailable at any point of the
 * slot, and a night slot must not push the guard past the consecutive-night cap.
 * <p>
 * Overlap with the same guard's assignments on other posts is not checked.
 */
public class ConstraintChecker {

    public enum Rejection {
        UNAVAILABLE,
        NIGHT_CAP
    }

    private final Map<String, List<TimeWindow>> unavailability;
    private final int maxConsecutiveNights;

    public ConstraintChecker(Map<String, List<TimeWindow>> unavailability, int maxConsecutiveNights) {
        if (maxConsecutiveNights < 1) {
            throw new IllegalArgumentException("maxConsecutiveNights must be positive: " + maxConsecutiveNights);
        }
        this.unavailability = unavailability == null ? Map.of() : unavailability;
        this.maxConsecutiveNights = maxConsecutiveNights;
    }

    public static ConstraintChecker forRequest(ScheduleRequest request) {
        return new ConstraintChecker(request.unavailability(), request.maxConsecutiveNights());
    }

    public boolean isEligible(String guard, ShiftSlot slot, GuardState state) {
        return rejectionReason(guard, slot, state).isEmpty();
    }

    public Optional<Rejection> rejectionReason(String guard, ShiftSlot slot, GuardState state) {
        for (TimeWindow window : unavailability.getOrDefault(guard, List.of())) {
            if (window.overlaps(slot.start(), slot.end())) {
                return Optional.of(Rejection.UNAVAILABLE);
            }
        }
        if (slot.night() && state.getConsecutiveNights() >= maxConsecutiveNights) {
            return Optional.of(Rejection.NIGHT_CAP);
        }
        return Optional.empty();
    }
}
