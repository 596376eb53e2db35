package com.example.guardshift.schedule;

/**
 * Running per-guard counters for one request, shared by all posts.
 */
public class GuardState {

    private int consecutiveNights;
    private int totalShifts;
    private int nightShifts;
    private double totalHours;

    public int getConsecutiveNights() {
        return consecutiveNights;
    }

    public int getTotalShifts() {
        return totalShifts;
    }

    public int getNightShifts() {
        return nightShifts;
    }

    public double getTotalHours() {
        return totalHours;
    }

    void record(ShiftSlot slot) {
        if (slot.night()) {
            consecutiveNights++;
            nightShifts++;
        } else {
            consecutiveNights = 0;
        }
        totalShifts++;
        totalHours += slot.durationHours();
    }

    GuardWorkload toWorkload() {
        return new GuardWorkload(totalShifts, nightShifts, Math.round(totalHours * 10) / 10.0);
    }
}
