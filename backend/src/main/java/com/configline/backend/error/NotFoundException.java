package com.configline.backend.error;

import java.util.List;

public class NotFoundException extends ConfiglineException {
    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message, List.of());
    }
}
