package com.example.guardshift.schedule;

import com.example.guardshift.exception.ScheduleGenerationException;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fully validated, immutable input of one schedule generation.
 * <p>
 * Guard and post order is significant: guards seed every rotation queue in the given order,
 * and posts are filled in the given order.
 */
public record ScheduleRequest(
        LocalDateTime horizonStart,
        LocalDateTime horizonEnd,
        List<String> guards,
        List<PostSpec> posts,
        Map<String, List<TimeWindow>> unavailability,
        double dayShiftHours,
        double nightShiftHours,
        TimeOfDayRange nightWindow,
        int maxConsecutiveNights) {

    private static final double MAX_SHIFT_HOURS = 24.0;

    public ScheduleRequest {
        if (horizonStart == null || horizonEnd == null) {
            throw ScheduleGenerationException.invalidRequest("Schedule start and end are required");
        }
        if (!horizonEnd.isAfter(horizonStart)) {
            throw ScheduleGenerationException.invalidHorizon(
                    "Schedule end time must be after start time", horizonStart, horizonEnd);
        }
        if (guards == null || guards.isEmpty()) {
            throw ScheduleGenerationException.emptyRoster("At least one guard is required");
        }
        if (posts == null || posts.isEmpty()) {
            throw ScheduleGenerationException.emptyRoster("At least one post is required");
        }
        guards = List.copyOf(guards);
        posts = List.copyOf(posts);
        requireUnique(guards, "Guard");
        requireUnique(posts.stream().map(PostSpec::name).toList(), "Post");
        requireShiftHours(dayShiftHours, "Day");
        requireShiftHours(nightShiftHours, "Night");
        if (nightWindow == null) {
            throw ScheduleGenerationException.invalidRequest("Night time range is required");
        }
        if (maxConsecutiveNights < 1) {
            throw ScheduleGenerationException.invalidRequest(
                    "Maximum consecutive nights must be at least 1", maxConsecutiveNights);
        }
        unavailability = copyUnavailability(unavailability, guards);
    }

    public Duration dayShift() {
        return hoursToDuration(dayShiftHours);
    }

    public Duration nightShift() {
        return hoursToDuration(nightShiftHours);
    }

    public Duration horizon() {
        return Duration.between(horizonStart, horizonEnd);
    }

    public List<TimeWindow> unavailabilityOf(String guard) {
        return unavailability.getOrDefault(guard, List.of());
    }

    static Duration hoursToDuration(double hours) {
        return Duration.ofSeconds(Math.round(hours * 3600));
    }

    private static void requireUnique(List<String> names, String label) {
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw ScheduleGenerationException.invalidRequest(label + " names must not be blank");
            }
            if (!seen.add(name)) {
                throw ScheduleGenerationException.invalidRequest(label + " names must be unique: " + name, name);
            }
        }
    }

    private static void requireShiftHours(double hours, String label) {
        if (!(hours > 0) || hours > MAX_SHIFT_HOURS || hoursToDuration(hours).isZero()) {
            throw ScheduleGenerationException.invalidRequest(
                    label + " shift hours must be greater than 0 and at most 24", hours);
        }
    }

    private static Map<String, List<TimeWindow>> copyUnavailability(Map<String, List<TimeWindow>> raw,
                                                                    List<String> roster) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, List<TimeWindow>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<TimeWindow>> entry : raw.entrySet()) {
            if (!roster.contains(entry.getKey())) {
                throw ScheduleGenerationException.invalidRequest(
                        "Unavailability given for unknown guard: " + entry.getKey(), entry.getKey());
            }
            List<TimeWindow> windows = new ArrayList<>(entry.getValue() == null ? List.of() : entry.getValue());
            windows.sort(Comparator.comparing(TimeWindow::start).thenComparing(TimeWindow::end));
            copy.put(entry.getKey(), List.copyOf(windows));
        }
        return Collections.unmodifiableMap(copy);
    }
}
