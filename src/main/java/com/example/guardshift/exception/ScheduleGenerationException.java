package com.example.guardshift.exception;

import java.util.Arrays;

public class ScheduleGenerationException extends RuntimeException {

    private final ScheduleErrorCode code;
    private final Object[] parameters;

    public ScheduleGenerationException(ScheduleErrorCode code, String message, Object... parameters) {
        super(message);
        this.code = code;
        this.parameters = parameters == null ? new Object[0] : parameters;
    }

    public ScheduleErrorCode getCode() {
        return code;
    }

    /**
     * Values that triggered the failure, in the order the message mentions them.
     */
    public String describeParameters() {
        return Arrays.toString(parameters);
    }

    public static ScheduleGenerationException invalidHorizon(String message, Object... parameters) {
        return new ScheduleGenerationException(ScheduleErrorCode.INVALID_HORIZON, message, parameters);
    }

    public static ScheduleGenerationException emptyRoster(String message) {
        return new ScheduleGenerationException(ScheduleErrorCode.EMPTY_ROSTER, message);
    }

    public static ScheduleGenerationException invalidRequest(String message, Object... parameters) {
        return new ScheduleGenerationException(ScheduleErrorCode.INVALID_REQUEST, message, parameters);
    }
}
