package com.configline.backend.replication;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A config as an SDK sees it in one environment: the effective stored value and the overrides
 * with every reference already replaced by a literal.
 */
public record SdkConfig(String name, JsonNode value, JsonNode overrides, int version) {}
