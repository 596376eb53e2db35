package com.example.guardshift.validation;

import com.example.guardshift.config.SchedulerSettings;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Checks that an {@code HH:MM} time of day sits on the configured minute grid and suggests the
 * nearest grid value when it does not. Halfway values round up; rounding past 23:xx wraps to 00.
 */
@Component
public class TimeGridValidator {

    private static final int MINUTES_PER_DAY = 24 * 60;

    private final int gridMinutes;

    @Autowired
    public TimeGridValidator(SchedulerSettings settings) {
        this(settings.getTimeGridMinutes());
    }

    TimeGridValidator(int gridMinutes) {
        if (gridMinutes <= 0 || 60 % gridMinutes != 0) {
            throw new IllegalArgumentException("Time grid must divide an hour evenly: " + gridMinutes);
        }
        this.gridMinutes = gridMinutes;
    }

    public TimeValidationResponse validate(String raw) {
        if (raw == null || raw.indexOf(':') < 0) {
            return TimeValidationResponse.invalid("Invalid time format. Use HH:MM format");
        }
        String[] parts = raw.trim().split(":", -1);
        if (parts.length != 2) {
            return TimeValidationResponse.invalid("Invalid time format. Use HH:MM format");
        }
        int hour;
        int minute;
        try {
            hour = Integer.parseInt(parts[0].trim());
            minute = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            return TimeValidationResponse.invalid("Invalid time format. Use HH:MM format with numbers");
        }
        if (hour < 0 || hour > 23) {
            return TimeValidationResponse.invalid("Hour must be between 00 and 23");
        }
        if (minute < 0 || minute > 59) {
            return TimeValidationResponse.invalid("Minute must be between 00 and 59");
        }
        if (minute % gridMinutes == 0) {
            return TimeValidationResponse.ok();
        }
        int rounded = (minute + gridMinutes / 2) / gridMinutes * gridMinutes;
        int total = (hour * 60 + rounded) % MINUTES_PER_DAY;
        String closest = String.format("%02d:%02d", total / 60, total % 60);
        return TimeValidationResponse.offGrid(closest, "Minutes must be a multiple of " + gridMinutes);
    }
}
