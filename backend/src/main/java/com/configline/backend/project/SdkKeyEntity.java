package com.configline.backend.project;

import jakarta.persistence.*;

import java.util.UUID;

@Entity
@Table(name = "sdk_keys")
public class SdkKeyEntity {

    @Id
    @Column(nullable = false)
    private UUID id;

    @Column(name = "key_hash", nullable = false, unique = true, length = 64)
    private String keyHash;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(name = "environment_id", nullable = false, length = 64)
    private String environmentId;

    protected SdkKeyEntity() {}

    public SdkKeyEntity(String rawKey, String projectId, String environmentId) {
        this.id = UUID.randomUUID();
        this.keyHash = SdkKeys.hash(rawKey);
        this.projectId = projectId;
        this.environmentId = environmentId;
    }

    public UUID getId() { return id; }
    public String getKeyHash() { return keyHash; }
    public String getProjectId() { return projectId; }
    public String getEnvironmentId() { return environmentId; }
}
