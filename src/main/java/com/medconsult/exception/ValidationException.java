package com.medconsult.exception;

import com.medconsult.dto.CommandResult;

/** Malformed date/time input or inverted ranges. */
public class ValidationException extends SchedulingException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public CommandResult.Type getResultType() {
        return CommandResult.Type.VALIDATION_ERROR;
    }
}
