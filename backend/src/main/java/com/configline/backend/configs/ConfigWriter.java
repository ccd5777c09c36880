package com.configline.backend.configs;

import com.configline.backend.audit.AuditRecord;
import com.configline.backend.audit.AuditSink;
import com.configline.backend.audit.AuditType;
import com.configline.backend.error.BadRequestException;
import com.configline.backend.error.ErrorCode;
import com.configline.backend.override.ConfigOverride;
import com.configline.backend.override.OverrideCodec;
import com.configline.backend.override.OverrideReferenceValidator;
import com.configline.backend.permission.ChangeSet;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Validates and applies content changes. Shared by direct edits and proposal approval, so both
 * paths run the same checks, the same version compare-and-swap and the same audit records.
 * Permission checks and proposal cascades stay with the callers.
 */
@Component
@Transactional(propagation = Propagation.MANDATORY)
public class ConfigWriter {

    private final VersionStore store;
    private final ConfigVariantRepository variants;
    private final ConfigMemberRepository members;
    private final SchemaValidator schemas;
    private final AuditSink audit;
    private final ApplicationEventPublisher events;
    private final ObjectMapper om;

    public ConfigWriter(
            VersionStore store,
            ConfigVariantRepository variants,
            ConfigMemberRepository members,
            SchemaValidator schemas,
            AuditSink audit,
            ApplicationEventPublisher events,
            ObjectMapper om
    ) {
        this.store = store;
        this.variants = variants;
        this.members = members;
        this.schemas = schemas;
        this.audit = audit;
        this.events = events;
        this.om = om;
    }

    public ConfigMembers currentMembers(UUID configId) {
        return ConfigMembers.fromEntities(members.findByConfig_IdOrderByEmailAsc(configId));
    }

    /**
     * Checks overrides, reference locality and the schema for one value/schema/overrides triple.
     * Returns the decoded overrides.
     */
    public List<ConfigOverride> validateContent(String projectId, JsonNode value, JsonNode schema, JsonNode overrides) {
        List<ConfigOverride> decoded = OverrideCodec.decodeStrict(Json.orEmptyArray(overrides));
        OverrideReferenceValidator.validate(projectId, decoded);
        schemas.checkSchema(Json.schemaOrNull(schema));
        schemas.validate(Json.schemaOrNull(schema), Json.orNull(value), decoded);
        return decoded;
    }

    /** Validates the config as it would look after {@code change}, including base-schema variants. */
    public void validateConfigChange(ConfigEntity current, ConfigChange change) {
        JsonNode value = change.value() != null ? change.value() : current.getValue();
        JsonNode schema = change.schemaChanged() ? change.schema() : current.getSchema();
        JsonNode overrides = change.overrides() != null ? change.overrides() : current.getOverrides();
        validateContent(current.getProjectId(), value, schema, overrides);
        if (change.members() != null) change.members().validated();

        if (change.schemaChanged()) {
            for (ConfigVariantEntity v : variants.findByConfig_IdOrderByEnvironmentIdAsc(current.getId())) {
                if (!v.isUseBaseSchema()) continue;
                List<ConfigOverride> vo = OverrideCodec.decodeLenient(v.getOverrides());
                try {
                    schemas.validate(Json.schemaOrNull(schema), Json.orNull(v.getValue()), vo);
                } catch (BadRequestException e) {
                    throw new BadRequestException(ErrorCode.SCHEMA_VIOLATION,
                            "Variant for environment '" + v.getEnvironmentId() + "' does not match the new schema",
                            e.getDetails());
                }
            }
        }
    }

    public void validateVariantChange(ConfigEntity config, ConfigVariantEntity current, VariantChange change) {
        JsonNode value = change.value() != null ? change.value() : current.getValue();
        JsonNode ownSchema = change.schemaChanged() ? change.schema() : current.getSchema();
        JsonNode overrides = change.overrides() != null ? change.overrides() : current.getOverrides();
        boolean useBase = change.useBaseSchema() != null ? change.useBaseSchema() : current.isUseBaseSchema();
        validateContent(config.getProjectId(), value, useBase ? config.getSchema() : ownSchema, overrides);
        if (useBase) schemas.checkSchema(Json.schemaOrNull(ownSchema));
    }

    /**
     * Claims the next version, applies the change and records it.
     *
     * @param extra merged into the audit payload (proposal id, restored version)
     */
    public ConfigEntity applyConfigChange(UUID configId, int expectedVersion, ConfigChange change,
                                          ChangeSet changed, String actorId, ObjectNode extra) {
        ConfigMembers before = change.members() != null ? currentMembers(configId) : null;
        ConfigEntity c = store.claimConfig(configId, expectedVersion);

        if (change.value() != null) c.setValue(change.value());
        if (change.schemaChanged()) c.setSchema(Json.schemaOrNull(change.schema()));
        if (change.overrides() != null) c.setOverrides(change.overrides());
        if (change.description() != null) c.setDescription(change.description());

        ConfigMembers after = change.members() != null ? change.members().validated() : null;
        c = store.commit(c, after, actorId);

        ObjectNode payload = basePayload(c, extra);
        payload.set("changed", changedFields(changed));
        audit.append(new AuditRecord(AuditType.CONFIG_UPDATED, actorId, c.getProjectId(), c.getId(), payload));

        if (after != null && !after.equals(before)) {
            ObjectNode mp = basePayload(c, extra);
            mp.set("before", before.toJson());
            mp.set("after", after.toJson());
            audit.append(new AuditRecord(AuditType.CONFIG_MEMBERS_CHANGED, actorId, c.getProjectId(), c.getId(), mp));
        }
        events.publishEvent(new ConfigChangedEvent(c.getProjectId(), c.getId(), c.getName(), false));
        return c;
    }

    public ConfigVariantEntity applyVariantChange(UUID variantId, int expectedVersion, VariantChange change,
                                                  ChangeSet changed, String actorId, ObjectNode extra) {
        ConfigVariantEntity v = store.claimVariant(variantId, expectedVersion);

        if (change.value() != null) v.setValue(change.value());
        if (change.schemaChanged()) v.setSchema(Json.schemaOrNull(change.schema()));
        if (change.overrides() != null) v.setOverrides(change.overrides());
        if (change.useBaseSchema() != null) v.setUseBaseSchema(change.useBaseSchema());
        v = store.commit(v, actorId);

        ConfigEntity c = v.getConfig();
        ObjectNode payload = basePayload(c, extra);
        payload.put("variantId", v.getId().toString());
        payload.put("environmentId", v.getEnvironmentId());
        payload.put("variantVersion", v.getVersion());
        payload.set("changed", changedFields(changed));
        audit.append(new AuditRecord(AuditType.CONFIG_VARIANT_UPDATED, actorId, c.getProjectId(), c.getId(), payload));
        events.publishEvent(new ConfigChangedEvent(c.getProjectId(), c.getId(), c.getName(), false));
        return v;
    }

    public void deleteConfig(ConfigEntity c, int expectedVersion, String actorId, ObjectNode extra) {
        String projectId = c.getProjectId();
        UUID id = c.getId();
        String name = c.getName();
        ObjectNode payload = basePayload(c, extra);

        store.deleteConfig(id, expectedVersion);

        audit.append(new AuditRecord(AuditType.CONFIG_DELETED, actorId, projectId, id, payload));
        events.publishEvent(new ConfigChangedEvent(projectId, id, name, true));
    }

    private ObjectNode basePayload(ConfigEntity c, ObjectNode extra) {
        ObjectNode p = om.createObjectNode();
        p.put("configId", c.getId().toString());
        p.put("name", c.getName());
        p.put("version", c.getVersion());
        if (extra != null) p.setAll(extra);
        return p;
    }

    private ArrayNode changedFields(ChangeSet cs) {
        List<String> names = new ArrayList<>();
        if (cs.value()) names.add("value");
        if (cs.overrides()) names.add("overrides");
        if (cs.description()) names.add("description");
        if (cs.schema()) names.add("schema");
        if (cs.useBaseSchema()) names.add("useBaseSchema");
        if (cs.members()) names.add("members");
        ArrayNode arr = om.createArrayNode();
        names.forEach(arr::add);
        return arr;
    }
}
