package com.configline.backend.error;

import java.util.List;

/**
 * Base type of every error the engine reports to its callers. All of them are recoverable:
 * reload and retry, fix the input, or ask for a different role.
 */
public abstract class ConfiglineException extends RuntimeException {

    private final ErrorCode code;
    private final List<String> details;

    protected ConfiglineException(ErrorCode code, String message, List<String> details) {
        super(message);
        this.code = code;
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    public ErrorCode getCode() { return code; }
    public List<String> getDetails() { return details; }
}
