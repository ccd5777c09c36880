package com.configline.backend.configs;

import java.util.UUID;

/** Published inside the writing transaction; listeners act after commit. */
public record ConfigChangedEvent(String projectId, UUID configId, String configName, boolean deleted) {}
