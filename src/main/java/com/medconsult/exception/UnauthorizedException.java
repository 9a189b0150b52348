package com.medconsult.exception;

import com.medconsult.dto.CommandResult;

/** No usable identity came with the request. */
public class UnauthorizedException extends SchedulingException {

    public UnauthorizedException(String message) {
        super(message);
    }

    @Override
    public CommandResult.Type getResultType() {
        return CommandResult.Type.UNAUTHORIZED;
    }
}
