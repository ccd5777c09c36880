package com.configline.backend.configs;

import com.configline.backend.override.ReferenceResolver;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** Resolves references to the stored base value, never a variant or a pending proposal. */
@Component
public class RepositoryReferenceResolver implements ReferenceResolver {

    private final ConfigRepository configs;

    public RepositoryReferenceResolver(ConfigRepository configs) {
        this.configs = configs;
    }

    @Override
    public Optional<JsonNode> resolve(String projectId, String configName) {
        return configs.findByProjectIdAndName(projectId, configName).map(c -> Json.orNull(c.getValue()));
    }
}
