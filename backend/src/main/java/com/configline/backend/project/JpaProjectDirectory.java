package com.configline.backend.project;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@Transactional(readOnly = true)
public class JpaProjectDirectory implements ProjectDirectory {

    private final ProjectRepository projects;
    private final ProjectMemberRepository members;
    private final ProjectEnvironmentRepository environments;
    private final SdkKeyRepository sdkKeys;

    public JpaProjectDirectory(
            ProjectRepository projects,
            ProjectMemberRepository members,
            ProjectEnvironmentRepository environments,
            SdkKeyRepository sdkKeys
    ) {
        this.projects = projects;
        this.members = members;
        this.environments = environments;
        this.sdkKeys = sdkKeys;
    }

    @Override
    public Optional<ProjectSettings> settings(String projectId) {
        return projects.findById(projectId)
                .map(p -> new ProjectSettings(p.getId(), p.isRequireProposals(), p.isAllowSelfApprovals()));
    }

    @Override
    public Optional<ProjectRole> roleOf(String projectId, String normalizedEmail) {
        return members.findByProjectIdAndEmail(projectId, Emails.normalize(normalizedEmail))
                .map(ProjectMemberEntity::getRole);
    }

    @Override
    public List<String> environmentIds(String projectId) {
        return environments.findByProjectIdOrderByOrderingAsc(projectId).stream()
                .map(ProjectEnvironmentEntity::getId)
                .toList();
    }

    @Override
    public Optional<SdkScope> resolveSdkKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) return Optional.empty();
        return sdkKeys.findByKeyHash(SdkKeys.hash(rawKey.trim()))
                .map(k -> new SdkScope(k.getProjectId(), k.getEnvironmentId()));
    }
}
