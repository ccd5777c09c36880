package com.configline.backend.project;

import jakarta.persistence.*;

import java.util.UUID;

@Entity
@Table(name = "project_members",
        uniqueConstraints = @UniqueConstraint(name = "uk_project_member", columnNames = {"project_id", "email"}))
public class ProjectMemberEntity {

    @Id
    @Column(nullable = false)
    private UUID id;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(nullable = false, length = 320)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ProjectRole role;

    protected ProjectMemberEntity() {}

    public ProjectMemberEntity(String projectId, String email, ProjectRole role) {
        this.id = UUID.randomUUID();
        this.projectId = projectId;
        this.email = Emails.normalize(email);
        this.role = role;
    }

    public UUID getId() { return id; }
    public String getProjectId() { return projectId; }
    public String getEmail() { return email; }
    public ProjectRole getRole() { return role; }
}
