package com.example.guardshift.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * A post in the request body: either a bare name ({@code "Main Gate"}) or an object with
 * optional required hours ({@code {"name": "Lobby", "is_24_7": false, "required_hours_start": "08:00",
 * "required_hours_end": "20:00"}}).
 */
public class PostPayload {

    @NotBlank
    private final String name;
    private final boolean alwaysStaffed;
    @Pattern(regexp = ScheduleGenerationRequest.TIME_PATTERN, message = "Invalid time format. Use HH:MM format.")
    private final String requiredHoursStart;
    @Pattern(regexp = ScheduleGenerationRequest.TIME_PATTERN, message = "Invalid time format. Use HH:MM format.")
    private final String requiredHoursEnd;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public PostPayload(@JsonProperty("name") String name,
                       @JsonProperty("is_24_7") Boolean alwaysStaffed,
                       @JsonProperty("required_hours_start") String requiredHoursStart,
                       @JsonProperty("required_hours_end") String requiredHoursEnd) {
        this.name = name;
        this.alwaysStaffed = alwaysStaffed == null || alwaysStaffed;
        this.requiredHoursStart = requiredHoursStart;
        this.requiredHoursEnd = requiredHoursEnd;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PostPayload named(String name) {
        return new PostPayload(name, true, null, null);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("is_24_7")
    public boolean isAlwaysStaffed() {
        return alwaysStaffed;
    }

    @JsonProperty("required_hours_start")
    public String getRequiredHoursStart() {
        return requiredHoursStart;
    }

    @JsonProperty("required_hours_end")
    public String getRequiredHoursEnd() {
        return requiredHoursEnd;
    }
}
