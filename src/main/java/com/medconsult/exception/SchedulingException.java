package com.medconsult.exception;

import com.medconsult.dto.CommandResult;

/**
 * Base of every failure a scheduling command can report. Each subtype maps to
 * one {@link CommandResult.Type} at the REST boundary.
 */
public abstract class SchedulingException extends RuntimeException {

    protected SchedulingException(String message) {
        super(message);
    }

    protected SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract CommandResult.Type getResultType();
}
