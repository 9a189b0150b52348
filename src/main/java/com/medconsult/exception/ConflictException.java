package com.medconsult.exception;

import com.medconsult.dto.CommandResult;

/** The slot is held by an active appointment or was just taken. */
public class ConflictException extends SchedulingException {

    public ConflictException(String message) {
        super(message);
    }

    @Override
    public CommandResult.Type getResultType() {
        return CommandResult.Type.CONFLICT;
    }
}
