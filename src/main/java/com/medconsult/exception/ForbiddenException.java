package com.medconsult.exception;

import com.medconsult.dto.CommandResult;

public class ForbiddenException extends SchedulingException {

    public ForbiddenException(String message) {
        super(message);
    }

    @Override
    public CommandResult.Type getResultType() {
        return CommandResult.Type.FORBIDDEN;
    }
}
