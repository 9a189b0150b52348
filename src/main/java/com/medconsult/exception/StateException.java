package com.medconsult.exception;

import com.medconsult.dto.CommandResult;

/** Illegal transition, or an edit of a past, booked or ineligible slot. */
public class StateException extends SchedulingException {

    public StateException(String message) {
        super(message);
    }

    @Override
    public CommandResult.Type getResultType() {
        return CommandResult.Type.STATE_ERROR;
    }
}
