package com.configline.backend.configs;

import com.configline.backend.error.BadRequestException;
import com.configline.backend.error.ErrorCode;
import com.configline.backend.override.ConfigOverride;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.SpecVersionDetector;
import com.networknt.schema.ValidationMessage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Checks a value and every override value against a JSON Schema. Schemas without a
 * {@code $schema} keyword are read as draft 7.
 */
@Component
public class SchemaValidator {

    public void validate(JsonNode schema, JsonNode value, List<ConfigOverride> overrides) {
        if (schema == null || schema.isNull()) return;

        JsonSchema compiled = compile(schema);
        List<String> errors = new ArrayList<>();
        collect(compiled, value, "value", errors);
        for (int i = 0; i < overrides.size(); i++) {
            collect(compiled, overrides.get(i).value(), "overrides[" + i + "].value", errors);
        }
        if (!errors.isEmpty()) {
            throw new BadRequestException(ErrorCode.SCHEMA_VIOLATION,
                    "Value does not match the config schema", errors);
        }
    }

    /** Rejects schemas the validator cannot load. */
    public void checkSchema(JsonNode schema) {
        if (schema == null || schema.isNull()) return;
        compile(schema);
    }

    private static JsonSchema compile(JsonNode schema) {
        if (!schema.isObject()) {
            throw new BadRequestException(ErrorCode.SCHEMA_VIOLATION, "Schema must be a JSON object");
        }
        try {
            SpecVersion.VersionFlag flag = schema.has("$schema")
                    ? SpecVersionDetector.detect(schema)
                    : SpecVersion.VersionFlag.V7;
            return JsonSchemaFactory.getInstance(flag).getSchema(schema);
        } catch (JsonSchemaException e) {
            throw new BadRequestException(ErrorCode.SCHEMA_VIOLATION, "Invalid JSON schema: " + e.getMessage());
        }
    }

    private static void collect(JsonSchema schema, JsonNode node, String at, List<String> out) {
        JsonNode target = node == null ? NullNode.getInstance() : node;
        Set<ValidationMessage> msgs = schema.validate(target);
        for (ValidationMessage m : msgs) {
            out.add(at + ": " + m.getMessage());
        }
    }
}
