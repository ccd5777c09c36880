package com.configline.backend.permission;

import java.util.Locale;

public enum ConfigMemberRole {
    EDITOR,
    MAINTAINER;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConfigMemberRole fromWire(String s) {
        return ConfigMemberRole.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
