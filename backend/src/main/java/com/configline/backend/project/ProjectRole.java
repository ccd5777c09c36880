package com.configline.backend.project;

public enum ProjectRole {
    VIEWER,
    EDITOR,
    MAINTAINER,
    OWNER,
    ADMIN;

    public boolean canManageConfigs() {
        return this == MAINTAINER || this == OWNER || this == ADMIN;
    }
}
