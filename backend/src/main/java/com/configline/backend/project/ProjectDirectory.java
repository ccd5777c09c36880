package com.configline.backend.project;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the surrounding product: who belongs to which project, project flags,
 * environments and SDK keys. Project/workspace management lives elsewhere.
 */
public interface ProjectDirectory {

    Optional<ProjectSettings> settings(String projectId);

    Optional<ProjectRole> roleOf(String projectId, String normalizedEmail);

    List<String> environmentIds(String projectId);

    Optional<SdkScope> resolveSdkKey(String rawKey);

    default boolean environmentBelongsTo(String projectId, String environmentId) {
        return environmentIds(projectId).contains(environmentId);
    }
}
