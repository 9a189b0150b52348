package com.medconsult.controller;

import com.medconsult.dto.CommandResult;
import com.medconsult.exception.SchedulingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Command boundary: every scheduling failure leaves as a {@link CommandResult}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SchedulingException.class)
    public ResponseEntity<CommandResult> handleScheduling(SchedulingException e) {
        log.info("Command rejected: {} - {}", e.getResultType(), e.getMessage());
        return respond(CommandResult.of(e.getResultType(), e.getMessage()));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<CommandResult> handleIntegrity(DataIntegrityViolationException e) {
        log.warn("Constraint violation at command boundary: {}", e.getMostSpecificCause().getMessage());
        return respond(CommandResult.of(CommandResult.Type.CONFLICT, "Slot just taken. Pick another."));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<CommandResult> handleMalformed(Exception e) {
        log.info("Malformed command: {}", e.getMessage());
        return respond(CommandResult.of(CommandResult.Type.VALIDATION_ERROR, "Malformed request."));
    }

    static ResponseEntity<CommandResult> respond(CommandResult result) {
        return ResponseEntity.status(result.getType().getHttpStatus()).body(result);
    }
}
