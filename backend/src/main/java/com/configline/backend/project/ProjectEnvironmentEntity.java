package com.configline.backend.project;

import jakarta.persistence.*;

@Entity
@Table(name = "project_environments")
public class ProjectEnvironmentEntity {

    @Id
    @Column(nullable = false, length = 64)
    private String id;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false)
    private int ordering;

    protected ProjectEnvironmentEntity() {}

    public ProjectEnvironmentEntity(String id, String projectId, String name, int ordering) {
        this.id = id;
        this.projectId = projectId;
        this.name = name;
        this.ordering = ordering;
    }

    public String getId() { return id; }
    public String getProjectId() { return projectId; }
    public String getName() { return name; }
    public int getOrdering() { return ordering; }
}
