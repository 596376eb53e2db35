package com.example.guardshift.schedule;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConstraintCheckerTest {

    private static final ShiftSlot DAY_SLOT = slot("2024-01-01T08:00", "2024-01-01T16:00", false);
    private static final ShiftSlot NIGHT_SLOT = slot("2024-01-01T22:00", "2024-01-02T06:00", true);

    @Test
    void isEligible_rejectsAnyOverlapWithUnavailability() {
        ConstraintChecker checker = new ConstraintChecker(Map.of(
                "G1", List.of(window("2024-01-01T15:59", "2024-01-01T18:00"))), 1);

        assertThat(checker.isEligible("G1", DAY_SLOT, new GuardState())).isFalse();
        assertThat(checker.rejectionReason("G1", DAY_SLOT, new GuardState()))
                .contains(ConstraintChecker.Rejection.UNAVAILABLE);
        assertThat(checker.isEligible("G2", DAY_SLOT, new GuardState())).isTrue();
    }

    @Test
    void isEligible_allowsWindowsThatOnlyTouchSlotBoundaries() {
        ConstraintChecker checker = new ConstraintChecker(Map.of("G1", List.of(
                window("2024-01-01T00:00", "2024-01-01T08:00"),
                window("2024-01-01T16:00", "2024-01-01T20:00"))), 1);

        assertThat(checker.isEligible("G1", DAY_SLOT, new GuardState())).isTrue();
    }

    @Test
    void isEligible_rejectsWindowCoveringWholeSlot() {
        ConstraintChecker checker = new ConstraintChecker(Map.of(
                "G1", List.of(window("2023-12-31T00:00", "2024-01-03T00:00"))), 1);

        assertThat(checker.isEligible("G1", NIGHT_SLOT, new GuardState())).isFalse();
    }

    @Test
    void isEligible_enforcesConsecutiveNightCapOnNightSlotsOnly() {
        ConstraintChecker checker = new ConstraintChecker(Map.of(), 2);
        GuardState state = new GuardState();

        state.record(slot("2024-01-01T22:00", "2024-01-02T06:00", true));
        assertThat(checker.isEligible("G1", NIGHT_SLOT, state)).isTrue();

        state.record(slot("2024-01-02T22:00", "2024-01-03T06:00", true));
        assertThat(state.getConsecutiveNights()).isEqualTo(2);
        assertThat(checker.rejectionReason("G1", NIGHT_SLOT, state))
                .contains(ConstraintChecker.Rejection.NIGHT_CAP);
        assertThat(checker.isEligible("G1", DAY_SLOT, state)).isTrue();
    }

    @Test
    void guardState_resetsConsecutiveNightsOnDayShift() {
        GuardState state = new GuardState();
        state.record(NIGHT_SLOT);
        state.record(DAY_SLOT);

        assertThat(state.getConsecutiveNights()).isZero();
        assertThat(state.getNightShifts()).isEqualTo(1);
        assertThat(state.getTotalShifts()).isEqualTo(2);
        assertThat(state.getTotalHours()).isEqualTo(16.0);
    }

    private static ShiftSlot slot(String start, String end, boolean night) {
        return new ShiftSlot("P1", LocalDateTime.parse(start), LocalDateTime.parse(end), night);
    }

    private static TimeWindow window(String start, String end) {
        return new TimeWindow(LocalDateTime.parse(start), LocalDateTime.parse(end));
    }
}
