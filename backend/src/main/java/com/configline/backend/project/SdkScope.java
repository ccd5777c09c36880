package com.configline.backend.project;

public record SdkScope(String projectId, String environmentId) {}
