package com.medconsult.exception;

import com.medconsult.dto.CommandResult;

/**
 * A call to the payment provider failed. Callers record the failure on the
 * payment rather than letting it escape the command.
 */
public class ExternalServiceException extends SchedulingException {

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    public ExternalServiceException(String message) {
        super(message);
    }

    @Override
    public CommandResult.Type getResultType() {
        return CommandResult.Type.EXTERNAL_SERVICE_ERROR;
    }
}
