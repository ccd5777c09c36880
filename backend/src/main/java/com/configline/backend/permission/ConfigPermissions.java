package com.configline.backend.permission;

import com.configline.backend.configs.ConfigMemberEntity;
import com.configline.backend.configs.ConfigMemberRepository;
import com.configline.backend.error.ErrorCode;
import com.configline.backend.error.ForbiddenException;
import com.configline.backend.project.Emails;
import com.configline.backend.project.ProjectDirectory;
import com.configline.backend.project.ProjectRole;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/** Resolves a user's access to a config from project and config membership. */
@Service
public class ConfigPermissions {

    private final ProjectDirectory directory;
    private final ConfigMemberRepository members;

    public ConfigPermissions(ProjectDirectory directory, ConfigMemberRepository members) {
        this.directory = directory;
        this.members = members;
    }

    public ConfigAccess accessOf(String projectId, UUID configId, String email) {
        String normalized = Emails.normalize(email);
        Optional<ProjectRole> projectRole = directory.roleOf(projectId, normalized);
        Optional<ConfigMemberRole> configRole = configId == null
                ? Optional.empty()
                : members.findByConfig_IdAndEmail(configId, normalized).map(ConfigMemberEntity::getRole);
        return PermissionPolicy.accessOf(projectRole, configRole);
    }

    public ProjectRole requireProjectMember(String projectId, String email) {
        return directory.roleOf(projectId, Emails.normalize(email))
                .orElseThrow(() -> new ForbiddenException("Not a member of this project"));
    }

    public void requireAccess(String projectId, UUID configId, String email, ChangeSet changes) {
        ConfigAccess actual = accessOf(projectId, configId, email);
        if (!PermissionPolicy.canApply(actual, changes)) {
            ConfigAccess required = PermissionPolicy.requiredForCommit(changes);
            throw new ForbiddenException(ErrorCode.FORBIDDEN,
                    "This change requires " + required.name().toLowerCase(Locale.ROOT) + " access");
        }
    }
}
