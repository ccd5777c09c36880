package com.configline.backend;

import com.configline.backend.project.ProjectEntity;
import com.configline.backend.project.ProjectEnvironmentEntity;
import com.configline.backend.project.ProjectEnvironmentRepository;
import com.configline.backend.project.ProjectMemberEntity;
import com.configline.backend.project.ProjectMemberRepository;
import com.configline.backend.project.ProjectRepository;
import com.configline.backend.project.ProjectRole;
import com.configline.backend.project.SdkKeyEntity;
import com.configline.backend.project.SdkKeyRepository;
import org.springframework.stereotype.Component;

import java.util.UUID;

/** Seeds an isolated project per test; project management itself lives outside this service. */
@Component
public class TestProjects {

    public static final String OWNER = "owner@example.com";
    public static final String MAINTAINER = "maintainer@example.com";
    public static final String EDITOR = "editor@example.com";
    public static final String EDITOR_2 = "editor2@example.com";
    public static final String VIEWER = "viewer@example.com";

    public record Seeded(String projectId, String prodEnv, String stagingEnv, String sdkKey) {}

    private final ProjectRepository projects;
    private final ProjectMemberRepository members;
    private final ProjectEnvironmentRepository environments;
    private final SdkKeyRepository sdkKeys;

    public TestProjects(
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

    public Seeded create(boolean requireProposals, boolean allowSelfApprovals) {
        String id = "p-" + UUID.randomUUID().toString().substring(0, 8);
        projects.save(new ProjectEntity(id, id, requireProposals, allowSelfApprovals));
        members.save(new ProjectMemberEntity(id, OWNER, ProjectRole.OWNER));
        members.save(new ProjectMemberEntity(id, MAINTAINER, ProjectRole.MAINTAINER));
        members.save(new ProjectMemberEntity(id, EDITOR, ProjectRole.EDITOR));
        members.save(new ProjectMemberEntity(id, EDITOR_2, ProjectRole.EDITOR));
        members.save(new ProjectMemberEntity(id, VIEWER, ProjectRole.VIEWER));
        environments.save(new ProjectEnvironmentEntity(id + "-prod", id, "Production", 0));
        environments.save(new ProjectEnvironmentEntity(id + "-staging", id, "Staging", 1));
        String rawKey = "sdk_" + UUID.randomUUID();
        sdkKeys.save(new SdkKeyEntity(rawKey, id, id + "-prod"));
        return new Seeded(id, id + "-prod", id + "-staging", rawKey);
    }
}
