package com.example.guardshift.schedule;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ShiftAssignmentDto(
        @JsonProperty("guard_id") String guardId,
        @JsonProperty("post_id") String postId,
        @JsonProperty("shift_start_time") String shiftStartTime,
        @JsonProperty("shift_end_time") String shiftEndTime) {

    public static ShiftAssignmentDto from(Assignment assignment) {
        return new ShiftAssignmentDto(
                assignment.guard(),
                assignment.post(),
                ScheduleService.formatDateTime(assignment.shiftStart()),
                ScheduleService.formatDateTime(assignment.shiftEnd()));
    }
}
