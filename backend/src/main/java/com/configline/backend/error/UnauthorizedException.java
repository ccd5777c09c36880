package com.configline.backend.error;

import java.util.List;

public class UnauthorizedException extends ConfiglineException {
    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message, List.of());
    }
}
