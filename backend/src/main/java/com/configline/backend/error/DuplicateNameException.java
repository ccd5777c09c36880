package com.configline.backend.error;

import java.util.List;

public class DuplicateNameException extends ConfiglineException {
    public DuplicateNameException(String message) {
        super(ErrorCode.DUPLICATE_NAME, message, List.of());
    }
}
