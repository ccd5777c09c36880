package com.configline.backend.permission;

import com.configline.backend.project.ProjectRole;

import java.util.Optional;

/** Pure access rules; no I/O. */
public final class PermissionPolicy {
    private PermissionPolicy() {}

    /**
     * Value, overrides and description need an editor. Schema, members, the base-schema flag and
     * deletion need a maintainer.
     */
    public static ConfigAccess requiredAccess(ChangeSet changes) {
        if (changes.schema() || changes.useBaseSchema() || changes.members() || changes.delete()) {
            return ConfigAccess.MAINTAINER;
        }
        if (changes.value() || changes.overrides() || changes.description()) {
            return ConfigAccess.EDITOR;
        }
        return ConfigAccess.NONE;
    }

    /**
     * Committing a new version, directly or by approving a proposal, needs at least editor access
     * even when nothing would change.
     */
    public static ConfigAccess requiredForCommit(ChangeSet changes) {
        ConfigAccess required = requiredAccess(changes);
        return required.satisfies(ConfigAccess.EDITOR) ? required : ConfigAccess.EDITOR;
    }

    public static ConfigAccess accessOf(Optional<ProjectRole> projectRole, Optional<ConfigMemberRole> configRole) {
        if (projectRole.map(ProjectRole::canManageConfigs).orElse(false)) {
            return ConfigAccess.MAINTAINER;
        }
        if (configRole.orElse(null) == ConfigMemberRole.MAINTAINER) {
            return ConfigAccess.MAINTAINER;
        }
        if (configRole.orElse(null) == ConfigMemberRole.EDITOR || projectRole.orElse(null) == ProjectRole.EDITOR) {
            return ConfigAccess.EDITOR;
        }
        return ConfigAccess.NONE;
    }

    public static boolean canApply(ConfigAccess actual, ChangeSet changes) {
        return actual.satisfies(requiredForCommit(changes));
    }
}
