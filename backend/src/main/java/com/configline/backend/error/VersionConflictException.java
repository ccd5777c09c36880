package com.configline.backend.error;

import java.util.List;

/**
 * Optimistic concurrency lost: the stored version is not the one the caller read.
 */
public class VersionConflictException extends ConfiglineException {

    private final int expectedVersion;

    public VersionConflictException(String entity, int expectedVersion) {
        super(ErrorCode.VERSION_CONFLICT,
                entity + " was edited by another user (expected version " + expectedVersion + "). Please reload.",
                List.of());
        this.expectedVersion = expectedVersion;
    }

    public int getExpectedVersion() { return expectedVersion; }
}
