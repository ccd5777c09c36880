package com.configline.backend.audit;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/** One committed transition. {@code configId} stays set after the config itself is gone. */
public record AuditRecord(AuditType type, String actorId, String projectId, UUID configId, JsonNode payload) {}
