package com.configline.backend.override;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/** Looks up the currently stored base value of a config. */
@FunctionalInterface
public interface ReferenceResolver {

    Optional<JsonNode> resolve(String projectId, String configName);

    ReferenceResolver NONE = (projectId, configName) -> Optional.empty();
}
