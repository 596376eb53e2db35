package com.example.guardshift.schedule;

import com.example.guardshift.exception.ScheduleErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleGenerationResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("assignments") List<ShiftAssignmentDto> assignments,
        @JsonProperty("metadata") Metadata metadata,
        @JsonProperty("error") String error,
        @JsonProperty("error_code") String errorCode,
        @JsonProperty("details") Map<String, Object> details) {

    public static ScheduleGenerationResponse from(ScheduleResult result, LocalDateTime generatedAt) {
        if (!result.success()) {
            Map<String, Object> details = new LinkedHashMap<>();
            result.details().forEach((key, value) -> details.put(key,
                    value instanceof LocalDateTime time ? ScheduleService.formatDateTime(time) : value));
            return failure(result.errorCode(), result.error(), details);
        }
        List<ShiftAssignmentDto> assignments = result.assignments().stream()
                .map(ShiftAssignmentDto::from)
                .toList();
        return new ScheduleGenerationResponse(true, assignments, Metadata.from(result.metadata(), generatedAt),
                null, null, null);
    }

    public static ScheduleGenerationResponse failure(ScheduleErrorCode code, String error, Map<String, ?> details) {
        return new ScheduleGenerationResponse(false, null, null, error,
                code == null ? null : code.name(),
                details == null || details.isEmpty() ? null : new LinkedHashMap<>(details));
    }

    public static ScheduleGenerationResponse failure(String error, Map<String, ?> details) {
        return failure(null, error, details);
    }

    public record Metadata(
            @JsonProperty("total_assignments") int totalAssignments,
            @JsonProperty("unique_guards") int uniqueGuards,
            @JsonProperty("unique_posts") int uniquePosts,
            @JsonProperty("schedule_duration_hours") double scheduleDurationHours,
            @JsonProperty("skipped_slots") int skippedSlots,
            @JsonProperty("generated_at") String generatedAt,
            @JsonProperty("guard_workload") Map<String, Workload> guardWorkload) {

        static Metadata from(ScheduleMetadata metadata, LocalDateTime generatedAt) {
            Map<String, Workload> workload = new LinkedHashMap<>();
            metadata.guardWorkload().forEach((guard, w) ->
                    workload.put(guard, new Workload(w.totalShifts(), w.nightShifts(), w.totalHours())));
            return new Metadata(
                    metadata.totalAssignments(),
                    metadata.uniqueGuards(),
                    metadata.uniquePosts(),
                    metadata.scheduleDurationHours(),
                    metadata.skippedSlots(),
                    ScheduleService.formatDateTime(generatedAt),
                    workload);
        }
    }

    public record Workload(
            @JsonProperty("total_shifts") int totalShifts,
            @JsonProperty("night_shifts") int nightShifts,
            @JsonProperty("total_hours") double totalHours) {
    }
}
