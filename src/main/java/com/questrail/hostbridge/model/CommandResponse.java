package com.questrail.hostbridge.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * CommandResponse
 * -----------------------------------------------------------------------------
 * The only two wire-visible outcomes of a command.
 *
 * <pre>
 *   { "status": "success", "result": { ... } }
 *   { "status": "error",   "message": "...", "kind": "..." }
 * </pre>
 *
 * <p>Only TCP-originated commands ever have their response written back.</p>
 */
public sealed interface CommandResponse
        permits CommandResponse.Success, CommandResponse.Failure
{
    String STATUS_SUCCESS = "success";
    String STATUS_ERROR = "error";

    String status();

    boolean isSuccess();

    static Success success(Map<String, Object> result) {
        return new Success(result);
    }

    static Failure failure(ErrorKind kind, String message) {
        return new Failure(kind, message);
    }

    record Success(Map<String, Object> result) implements CommandResponse {
        public Success {
            result = result == null
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(result));
        }

        @Override
        public String status() {
            return STATUS_SUCCESS;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(ErrorKind kind, String message) implements CommandResponse {
        public Failure {
            Objects.requireNonNull(kind, "kind");
            message = message == null || message.isBlank() ? kind.wireName() : message;
        }

        @Override
        public String status() {
            return STATUS_ERROR;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
