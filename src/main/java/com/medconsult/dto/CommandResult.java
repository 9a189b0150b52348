package com.medconsult.dto;

import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured outcome of a scheduling command. The presentation layer renders
 * it; no command answers with anything else.
 */
public final class CommandResult {

    public enum Type {
        OK(HttpStatus.OK),
        CREATED(HttpStatus.CREATED),
        PARTIAL(HttpStatus.OK),
        VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
        UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
        FORBIDDEN(HttpStatus.FORBIDDEN),
        NOT_FOUND(HttpStatus.NOT_FOUND),
        CONFLICT(HttpStatus.CONFLICT),
        STATE_ERROR(HttpStatus.UNPROCESSABLE_ENTITY),
        EXTERNAL_SERVICE_ERROR(HttpStatus.BAD_GATEWAY);

        private final HttpStatus httpStatus;

        Type(HttpStatus httpStatus) {
            this.httpStatus = httpStatus;
        }

        public HttpStatus getHttpStatus() {
            return httpStatus;
        }

        public boolean isSuccess() {
            return httpStatus.is2xxSuccessful();
        }
    }

    private final Type type;
    private final String message;
    private final Map<String, Object> payload;

    private CommandResult(Type type, String message, Map<String, Object> payload) {
        this.type = type;
        this.message = message;
        this.payload = payload == null ? Collections.emptyMap() : new LinkedHashMap<>(payload);
    }

    public Type getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public boolean isSuccess() {
        return type.isSuccess();
    }

    public static CommandResult ok(String message) {
        return new CommandResult(Type.OK, message, null);
    }

    public static CommandResult ok(String message, Map<String, Object> payload) {
        return new CommandResult(Type.OK, message, payload);
    }

    public static CommandResult of(Type type, String message) {
        return new CommandResult(type, message, null);
    }

    public static CommandResult of(Type type, String message, Map<String, Object> payload) {
        return new CommandResult(type, message, payload);
    }

    public static CommandResult data(String key, Object value) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(key, value);
        return new CommandResult(Type.OK, null, p);
    }
}
