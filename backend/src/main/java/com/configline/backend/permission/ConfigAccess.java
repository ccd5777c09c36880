package com.configline.backend.permission;

public enum ConfigAccess {
    NONE,
    EDITOR,
    MAINTAINER;

    public boolean satisfies(ConfigAccess required) {
        return this.ordinal() >= required.ordinal();
    }
}
