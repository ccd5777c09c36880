package com.configline.backend.error;

import java.util.List;

public class ForbiddenException extends ConfiglineException {
    public ForbiddenException(String message) {
        this(ErrorCode.FORBIDDEN, message);
    }

    public ForbiddenException(ErrorCode code, String message) {
        super(code, message, List.of());
    }
}
