package com.medconsult.exception;

import com.medconsult.dto.CommandResult;

public class NotFoundException extends SchedulingException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public CommandResult.Type getResultType() {
        return CommandResult.Type.NOT_FOUND;
    }
}
