package com.example.guardshift.schedule;

import com.example.guardshift.exception.ScheduleErrorCode;
import com.example.guardshift.exception.ScheduleGenerationException;
import com.example.guardshift.exception.UnfillableSlotException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one generation: either every required slot is filled, or the first failure reason.
 * Partial schedules are never returned.
 */
public record ScheduleResult(
        boolean success,
        List<Assignment> assignments,
        ScheduleMetadata metadata,
        ScheduleErrorCode errorCode,
        String error,
        Map<String, Object> details) {

    public static ScheduleResult success(List<Assignment> assignments, ScheduleMetadata metadata) {
        return new ScheduleResult(true, List.copyOf(assignments), metadata, null, null, Map.of());
    }

    public static ScheduleResult failure(ScheduleErrorCode code, String error) {
        return new ScheduleResult(false, List.of(), null, code, error, Map.of());
    }

    public static ScheduleResult failure(ScheduleGenerationException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (ex instanceof UnfillableSlotException unfillable) {
            details.put("post", unfillable.getPost());
            details.put("slot_start", unfillable.getSlotStart());
            details.put("slot_end", unfillable.getSlotEnd());
        }
        return new ScheduleResult(false, List.of(), null, ex.getCode(), ex.getMessage(), Map.copyOf(details));
    }
}
