package com.example.guardshift.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class SchedulerSettings {
    private final int maxGuards;
    private final int maxPosts;
    private final double minShiftHours;
    private final double maxShiftHours;
    private final int maxHorizonDays;
    private final long timeoutSeconds;
    private final int timeGridMinutes;

    public SchedulerSettings(
            @Value("${shift.limits.max-guards:50}") int maxGuards,
            @Value("${shift.limits.max-posts:20}") int maxPosts,
            @Value("${shift.limits.min-shift-hours:0.5}") double minShiftHours,
            @Value("${shift.limits.max-shift-hours:24}") double maxShiftHours,
            @Value("${shift.limits.max-horizon-days:365}") int maxHorizonDays,
            @Value("${shift.schedule.timeout-seconds:30}") long timeoutSeconds,
            @Value("${shift.validation.time-grid-minutes:30}") int timeGridMinutes) {
        this.maxGuards = maxGuards;
        this.maxPosts = maxPosts;
        this.minShiftHours = minShiftHours;
        this.maxShiftHours = maxShiftHours;
        this.maxHorizonDays = maxHorizonDays;
        this.timeoutSeconds = timeoutSeconds;
        this.timeGridMinutes = timeGridMinutes;
    }

    public int getMaxGuards() { return maxGuards; }
    public int getMaxPosts() { return maxPosts; }
    public double getMinShiftHours() { return minShiftHours; }
    public double getMaxShiftHours() { return maxShiftHours; }
    public int getMaxHorizonDays() { return maxHorizonDays; }
    public long getTimeoutSeconds() { return timeoutSeconds; }
    public int getTimeGridMinutes() { return timeGridMinutes; }
}
