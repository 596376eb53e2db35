package com.example.guardshift.schedule;

import com.example.guardshift.exception.ScheduleGenerationException;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Breaks a horizon into contiguous day/night slots for one post.
 * <p>
 * A slot is a night slot when its start time of day lies in the night window; its length is then
 * the night shift length, otherwise the day shift length. The last slot is cut at the horizon end.
 */
public class TimeSlotGenerator {

    private final LocalDateTime horizonStart;
    private final LocalDateTime horizonEnd;
    private final Duration dayShift;
    private final Duration nightShift;
    private final TimeOfDayRange nightWindow;

    public TimeSlotGenerator(LocalDateTime horizonStart,
                             LocalDateTime horizonEnd,
                             Duration dayShift,
                             Duration nightShift,
                             TimeOfDayRange nightWindow) {
        Objects.requireNonNull(horizonStart, "horizonStart");
        Objects.requireNonNull(horizonEnd, "horizonEnd");
        if (!horizonEnd.isAfter(horizonStart)) {
            throw ScheduleGenerationException.invalidHorizon(
                    "Schedule end time must be after start time", horizonStart, horizonEnd);
        }
        requirePositive(dayShift, "dayShift");
        requirePositive(nightShift, "nightShift");
        this.horizonStart = horizonStart;
        this.horizonEnd = horizonEnd;
        this.dayShift = dayShift;
        this.nightShift = nightShift;
        this.nightWindow = Objects.requireNonNull(nightWindow, "nightWindow");
    }

    public static TimeSlotGenerator forRequest(ScheduleRequest request) {
        return new TimeSlotGenerator(request.horizonStart(), request.horizonEnd(),
                request.dayShift(), request.nightShift(), request.nightWindow());
    }

    public boolean isNight(LocalDateTime slotStart) {
        return nightWindow.contains(slotStart.toLocalTime());
    }

    /**
     * Lazy slot sequence for {@code post}. Every call to {@code iterator()} starts again from the
     * horizon start, so the sequence can be walked any number of times.
     */
    public Iterable<ShiftSlot> slotsFor(String post) {
        Objects.requireNonNull(post, "post");
        return () -> new SlotIterator(post);
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    private final class SlotIterator implements Iterator<ShiftSlot> {
        private final String post;
        private LocalDateTime cursor = horizonStart;

        private SlotIterator(String post) {
            this.post = post;
        }

        @Override
        public boolean hasNext() {
            return cursor.isBefore(horizonEnd);
        }

        @Override
        public ShiftSlot next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            boolean night = isNight(cursor);
            LocalDateTime next = cursor.plus(night ? nightShift : dayShift);
            LocalDateTime end = next.isAfter(horizonEnd) ? horizonEnd : next;
            ShiftSlot slot = new ShiftSlot(post, cursor, end, night);
            cursor = next;
            return slot;
        }
    }
}
