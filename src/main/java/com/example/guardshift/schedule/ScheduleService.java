package com.example.guardshift.schedule;

import com.example.guardshift.config.SchedulerSettings;
import com.example.guardshift.exception.ScheduleGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

@Service
public class ScheduleService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);
    private static final DateTimeFormatter OUTPUT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final SchedulerSettings settings;

    public ScheduleService(SchedulerSettings settings) {
        this.settings = settings;
    }

    /**
     * Runs the assembler for one request. Generation failures come back as a failed result, never
     * as an exception.
     */
    public ScheduleResult generate(ScheduleRequest request) {
        long startedAt = System.nanoTime();
        try {
            ScheduleResult result = new AssignmentAssembler(request).assemble();
            warnCrossPostOverlaps(result.assignments());
            logger.info("Schedule generated: {} assignments, {} guards, {} posts, {}h horizon in {} ms",
                    result.metadata().totalAssignments(), request.guards().size(), request.posts().size(),
                    result.metadata().scheduleDurationHours(), (System.nanoTime() - startedAt) / 1_000_000);
            return result;
        } catch (ScheduleGenerationException e) {
            logger.warn("Schedule generation failed [{}]: {}", e.getCode(), e.getMessage());
            return ScheduleResult.failure(e);
        }
    }

    @Async("scheduleExecutor")
    public CompletableFuture<ScheduleResult> generateAsync(ScheduleRequest request) {
        return CompletableFuture.completedFuture(generate(request));
    }

    /**
     * Converts the JSON payload into an engine request, applying the configured limits.
     *
     * @throws ScheduleGenerationException when the payload is out of range or inconsistent
     */
    public ScheduleRequest toRequest(ScheduleGenerationRequest payload) {
        LocalDateTime start = parseDateTime(payload.scheduleStartDatetime(), "schedule_start_datetime");
        LocalDateTime end = parseDateTime(payload.scheduleEndDatetime(), "schedule_end_datetime");
        if (end.isAfter(start) && Duration.between(start, end).compareTo(Duration.ofDays(settings.getMaxHorizonDays())) > 0) {
            throw ScheduleGenerationException.invalidHorizon(
                    "Schedule period must not exceed " + settings.getMaxHorizonDays() + " days", start, end);
        }

        List<String> guards = normalizeNames(payload.guards(), "Guard");
        if (guards.size() > settings.getMaxGuards()) {
            throw ScheduleGenerationException.invalidRequest(
                    "Maximum " + settings.getMaxGuards() + " guards allowed", guards.size());
        }
        List<PostSpec> posts = new ArrayList<>();
        for (PostPayload post : payload.posts()) {
            posts.add(toPostSpec(post));
        }
        normalizeNames(posts.stream().map(PostSpec::name).toList(), "Post");
        if (posts.size() > settings.getMaxPosts()) {
            throw ScheduleGenerationException.invalidRequest(
                    "Maximum " + settings.getMaxPosts() + " posts allowed", posts.size());
        }

        double dayHours = requireShiftHours(payload.shiftLengths().dayShiftHours(), "Day");
        double nightHours = requireShiftHours(payload.shiftLengths().nightShiftHours(), "Night");
        if (payload.maxConsecutiveNights() < 1) {
            throw ScheduleGenerationException.invalidRequest(
                    "Maximum consecutive nights must be at least 1", payload.maxConsecutiveNights());
        }

        TimeOfDayRange nightWindow = TimeOfDayRange.of(
                payload.nightTimeRange().start(), payload.nightTimeRange().end());

        return new ScheduleRequest(start, end, guards, posts, toUnavailability(payload.unavailability(), guards),
                dayHours, nightHours, nightWindow, payload.maxConsecutiveNights());
    }

    static String formatDateTime(LocalDateTime value) {
        return value == null ? null : OUTPUT_FORMAT.format(value);
    }

    /**
     * Parses an ISO-8601 date-time. A trailing offset or {@code Z} is accepted and dropped; all
     * comparisons are made on naive wall-clock values.
     */
    static LocalDateTime parseDateTime(String raw, String field) {
        try {
            return LocalDateTime.from(DateTimeFormatter.ISO_DATE_TIME.parse(raw.trim()));
        } catch (DateTimeParseException e) {
            throw ScheduleGenerationException.invalidRequest(
                    "Invalid datetime format for " + field + ". Use ISO 8601 format.", raw);
        }
    }

    /**
     * Same-guard assignments on different posts that overlap in time. The engine does not forbid
     * them, so they are reported instead.
     */
    static List<String> findCrossPostOverlaps(List<Assignment> assignments) {
        Map<String, List<Assignment>> byGuard = assignments.stream()
                .collect(Collectors.groupingBy(Assignment::guard, LinkedHashMap::new, Collectors.toList()));
        List<String> overlaps = new ArrayList<>();
        byGuard.forEach((guard, list) -> {
            List<Assignment> sorted = new ArrayList<>(list);
            sorted.sort(Comparator.comparing(Assignment::shiftStart));
            for (int i = 0; i < sorted.size(); i++) {
                for (int j = i + 1; j < sorted.size() && sorted.get(j).shiftStart().isBefore(sorted.get(i).shiftEnd()); j++) {
                    Assignment a = sorted.get(i);
                    Assignment b = sorted.get(j);
                    if (!a.post().equals(b.post()) && a.overlaps(b)) {
                        overlaps.add(guard + " on " + a.post() + " and " + b.post() + " at " + b.shiftStart());
                    }
                }
            }
        });
        return overlaps;
    }

    private void warnCrossPostOverlaps(List<Assignment> assignments) {
        List<String> overlaps = findCrossPostOverlaps(assignments);
        if (!overlaps.isEmpty()) {
            logger.warn("{} cross-post double bookings in generated schedule, first: {}",
                    overlaps.size(), overlaps.get(0));
        }
    }

    private PostSpec toPostSpec(PostPayload post) {
        String name = post.getName() == null ? "" : post.getName().trim();
        if (post.isAlwaysStaffed()) {
            return PostSpec.allDay(name);
        }
        if (post.getRequiredHoursStart() == null || post.getRequiredHoursEnd() == null) {
            throw ScheduleGenerationException.invalidRequest(
                    "Post \"" + name + "\" must have both start and end times when not 24/7", name);
        }
        return new PostSpec(name, TimeOfDayRange.of(post.getRequiredHoursStart(), post.getRequiredHoursEnd()));
    }

    private List<String> normalizeNames(List<String> raw, String label) {
        Set<String> names = new LinkedHashSet<>();
        for (String value : raw) {
            String name = value == null ? "" : value.trim();
            if (name.isEmpty()) {
                throw ScheduleGenerationException.invalidRequest(label + " names must not be blank");
            }
            if (!names.add(name)) {
                throw ScheduleGenerationException.invalidRequest(label + " names must be unique: " + name, name);
            }
        }
        return new ArrayList<>(names);
    }

    private double requireShiftHours(double hours, String label) {
        if (hours < settings.getMinShiftHours() || hours > settings.getMaxShiftHours()) {
            throw ScheduleGenerationException.invalidRequest(
                    label + " shift hours must be between " + settings.getMinShiftHours()
                            + " and " + settings.getMaxShiftHours(), hours);
        }
        return hours;
    }

    private Map<String, List<TimeWindow>> toUnavailability(
            Map<String, List<ScheduleGenerationRequest.UnavailabilityWindow>> raw, List<String> guards) {
        Map<String, List<TimeWindow>> result = new LinkedHashMap<>();
        raw.forEach((rawGuard, windows) -> {
            String guard = rawGuard == null ? "" : rawGuard.trim();
            if (!guards.contains(guard)) {
                logger.warn("Ignoring unavailability for guard not on the roster: {}", rawGuard);
                return;
            }
            List<TimeWindow> parsed = result.computeIfAbsent(guard, k -> new ArrayList<>());
            if (windows == null) {
                return;
            }
            for (ScheduleGenerationRequest.UnavailabilityWindow window : windows) {
                LocalDateTime start = parseDateTime(window.start(), "unavailability start");
                LocalDateTime end = parseDateTime(window.end(), "unavailability end");
                if (!start.isBefore(end)) {
                    throw ScheduleGenerationException.invalidRequest(
                            "Unavailability window for " + guard + " must end after it starts", guard, start, end);
                }
                parsed.add(new TimeWindow(start, end));
            }
        });
        return result;
    }
}
