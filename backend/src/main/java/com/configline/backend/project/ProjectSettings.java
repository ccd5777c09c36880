package com.configline.backend.project;

public record ProjectSettings(String projectId, boolean requireProposals, boolean allowSelfApprovals) {}
