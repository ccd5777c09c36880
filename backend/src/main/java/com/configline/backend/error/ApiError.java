package com.configline.backend.error;

import java.util.List;

public record ApiError(String code, String message, List<String> details) {
    public static ApiError of(String code, String message) {
        return new ApiError(code, message, List.of());
    }

    public static ApiError of(ConfiglineException e) {
        return new ApiError(e.getCode().name(), e.getMessage(), e.getDetails());
    }
}
