package com.example.guardshift.schedule;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.List;
import java.util.Map;

/**
 * JSON body of {@code POST /schedule}. Every field is required; unknown fields are rejected.
 */
public record ScheduleGenerationRequest(
        @JsonProperty("schedule_start_datetime") @NotBlank String scheduleStartDatetime,
        @JsonProperty("schedule_end_datetime") @NotBlank String scheduleEndDatetime,
        @JsonProperty("guards") @NotNull List<String> guards,
        @JsonProperty("posts") @NotNull List<@NotNull @Valid PostPayload> posts,
        @JsonProperty("unavailability") @NotNull Map<String, List<@NotNull @Valid UnavailabilityWindow>> unavailability,
        @JsonProperty("shift_lengths") @NotNull @Valid ShiftLengths shiftLengths,
        @JsonProperty("night_time_range") @NotNull @Valid NightTimeRange nightTimeRange,
        @JsonProperty("max_consecutive_nights") @NotNull Integer maxConsecutiveNights) {

    static final String TIME_PATTERN = "^([01]\\d|2[0-3]):[0-5]\\d$";

    public record UnavailabilityWindow(
            @JsonProperty("start") @NotBlank String start,
            @JsonProperty("end") @NotBlank String end) {
    }

    public record ShiftLengths(
            @JsonProperty("day_shift_hours") @NotNull Double dayShiftHours,
            @JsonProperty("night_shift_hours") @NotNull Double nightShiftHours) {
    }

    public record NightTimeRange(
            @JsonProperty("start") @NotBlank @Pattern(regexp = TIME_PATTERN, message = "Invalid time format. Use HH:MM format.") String start,
            @JsonProperty("end") @NotBlank @Pattern(regexp = TIME_PATTERN, message = "Invalid time format. Use HH:MM format.") String end) {
    }
}
