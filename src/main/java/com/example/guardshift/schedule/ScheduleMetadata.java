package com.example.guardshift.schedule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ScheduleMetadata(
        int totalAssignments,
        int uniqueGuards,
        int uniquePosts,
        double scheduleDurationHours,
        int skippedSlots,
        Map<String, GuardWorkload> guardWorkload) {

    public ScheduleMetadata {
        guardWorkload = guardWorkload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(guardWorkload));
    }
}
