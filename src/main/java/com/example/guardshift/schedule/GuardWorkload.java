package com.example.guardshift.schedule;

public record GuardWorkload(int totalShifts, int nightShifts, double totalHours) {
}
