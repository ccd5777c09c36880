package com.configline.backend.error;

import java.util.List;

public class BadRequestException extends ConfiglineException {
    public BadRequestException(String message) {
        this(ErrorCode.BAD_REQUEST, message, List.of());
    }

    public BadRequestException(ErrorCode code, String message) {
        this(code, message, List.of());
    }

    public BadRequestException(ErrorCode code, String message, List<String> details) {
        super(code, message, details);
    }
}
