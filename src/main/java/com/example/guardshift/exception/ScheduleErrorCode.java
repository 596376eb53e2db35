package com.example.guardshift.exception;

/**
 * Discriminated failure reasons surfaced by schedule generation.
 */
public enum ScheduleErrorCode {
    /** Horizon end is not after its start, or the horizon exceeds the configured limit. */
    INVALID_HORIZON,
    /** No guards or no posts supplied. */
    EMPTY_ROSTER,
    /** Every guard was rejected for one slot. */
    UNFILLABLE_SLOT,
    /** Malformed or out-of-range request data. */
    INVALID_REQUEST,
    /** Generation exceeded the wall-clock budget of the service. */
    TIMEOUT
}
