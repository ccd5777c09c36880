package com.configline.backend.configs;

import com.configline.backend.audit.AuditRecord;
import com.configline.backend.audit.AuditSink;
import com.configline.backend.audit.AuditType;
import com.configline.backend.configs.ConfigDtos.*;
import com.configline.backend.error.BadRequestException;
import com.configline.backend.error.ErrorCode;
import com.configline.backend.error.ForbiddenException;
import com.configline.backend.error.NotFoundException;
import com.configline.backend.override.EvaluationResult;
import com.configline.backend.override.OverrideCodec;
import com.configline.backend.override.OverrideEvaluator;
import com.configline.backend.permission.ChangeSet;
import com.configline.backend.permission.ConfigAccess;
import com.configline.backend.permission.ConfigPermissions;
import com.configline.backend.permission.PermissionPolicy;
import com.configline.backend.project.Emails;
import com.configline.backend.project.ProjectDirectory;
import com.configline.backend.project.ProjectSettings;
import com.configline.backend.proposal.ProposalCascade;
import com.configline.backend.proposal.RejectionReason;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

@Service
@Transactional
public class ConfigService {
    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_-]{1,100}");

    private final ConfigRepository configs;
    private final ConfigVariantRepository variants;
    private final ConfigVersionRepository versions;
    private final ConfigVariantVersionRepository variantVersions;
    private final VersionStore store;
    private final ConfigWriter writer;
    private final ConfigPermissions permissions;
    private final ProjectDirectory directory;
    private final ProposalCascade cascade;
    private final RepositoryReferenceResolver resolver;
    private final AuditSink audit;
    private final ApplicationEventPublisher events;
    private final ObjectMapper om;

    public ConfigService(
            ConfigRepository configs,
            ConfigVariantRepository variants,
            ConfigVersionRepository versions,
            ConfigVariantVersionRepository variantVersions,
            VersionStore store,
            ConfigWriter writer,
            ConfigPermissions permissions,
            ProjectDirectory directory,
            ProposalCascade cascade,
            RepositoryReferenceResolver resolver,
            AuditSink audit,
            ApplicationEventPublisher events,
            ObjectMapper om
    ) {
        this.configs = configs;
        this.variants = variants;
        this.versions = versions;
        this.variantVersions = variantVersions;
        this.store = store;
        this.writer = writer;
        this.permissions = permissions;
        this.directory = directory;
        this.cascade = cascade;
        this.resolver = resolver;
        this.audit = audit;
        this.events = events;
        this.om = om;
    }

    // ---- reads ----

    @Transactional(readOnly = true)
    public List<ConfigSummary> list(String projectId, String userEmail) {
        permissions.requireProjectMember(projectId, userEmail);
        return configs.findByProjectIdOrderByNameAsc(projectId).stream()
                .map(c -> new ConfigSummary(c.getId(), c.getName(), c.getDescription(), c.getVersion(), c.getUpdatedAt()))
                .toList();
    }

    @Transactional(readOnly = true)
    public ConfigView get(String projectId, String name, String userEmail) {
        permissions.requireProjectMember(projectId, userEmail);
        return toView(load(projectId, name));
    }

    @Transactional(readOnly = true)
    public List<ConfigVersionView> versions(String projectId, String name, String userEmail) {
        permissions.requireProjectMember(projectId, userEmail);
        ConfigEntity c = load(projectId, name);
        return versions.findByConfigIdOrderByVersionDesc(c.getId()).stream().map(ConfigService::toVersionView).toList();
    }

    @Transactional(readOnly = true)
    public ConfigVersionView version(String projectId, String name, int version, String userEmail) {
        permissions.requireProjectMember(projectId, userEmail);
        ConfigEntity c = load(projectId, name);
        return versions.findByConfigIdAndVersion(c.getId(), version)
                .map(ConfigService::toVersionView)
                .orElseThrow(() -> new NotFoundException("Config version " + version + " not found"));
    }

    @Transactional(readOnly = true)
    public List<VariantVersionView> variantVersions(String projectId, String name, String environmentId,
                                                    String userEmail) {
        permissions.requireProjectMember(projectId, userEmail);
        ConfigVariantEntity v = loadVariant(load(projectId, name), environmentId);
        return variantVersions.findByVariantIdOrderByVersionDesc(v.getId()).stream()
                .map(vv -> toVariantVersionView(vv, v.getEnvironmentId()))
                .toList();
    }

    @Transactional(readOnly = true)
    public VariantVersionView variantVersion(String projectId, String name, String environmentId, int version,
                                             String userEmail) {
        permissions.requireProjectMember(projectId, userEmail);
        ConfigVariantEntity v = loadVariant(load(projectId, name), environmentId);
        return variantVersions.findByVariantIdAndVersion(v.getId(), version)
                .map(vv -> toVariantVersionView(vv, v.getEnvironmentId()))
                .orElseThrow(() -> new NotFoundException("Config variant version " + version + " not found"));
    }

    /** Override tester: evaluates against a context and explains every override's outcome. */
    @Transactional(readOnly = true)
    public EvaluationResult evaluate(String projectId, String name, String userEmail, EvaluateRequest req) {
        permissions.requireProjectMember(projectId, userEmail);
        ConfigEntity c = load(projectId, name);

        JsonNode value = c.getValue();
        JsonNode overrides = c.getOverrides();
        if (req.environmentId() != null) {
            Optional<ConfigVariantEntity> v = variants.findByConfig_IdAndEnvironmentId(c.getId(), req.environmentId());
            if (v.isPresent()) {
                value = v.get().getValue();
                overrides = v.get().getOverrides();
            }
        }
        Map<String, JsonNode> ctx = req.context() == null ? Map.of() : req.context();
        return OverrideEvaluator.evaluateWithTrace(Json.orNull(value), OverrideCodec.decodeLenient(overrides), ctx, resolver);
    }

    // ---- writes ----

    public ConfigView create(String projectId, String userEmail, CreateConfigRequest req) {
        String actor = Emails.normalize(userEmail);
        directory.settings(projectId).orElseThrow(() -> new NotFoundException("Project not found"));
        ConfigAccess access = PermissionPolicy.accessOf(directory.roleOf(projectId, actor), Optional.empty());
        if (!access.satisfies(ConfigAccess.EDITOR)) {
            throw new ForbiddenException("Creating configs requires at least the editor role");
        }
        if (req.name() == null || !NAME.matcher(req.name()).matches()) {
            throw new BadRequestException("Config name must match [A-Za-z0-9_-]{1,100}");
        }

        ConfigMembers members = new ConfigMembers(req.editorEmails(), req.maintainerEmails()).validated();
        writer.validateContent(projectId, req.value(), req.schema(), req.overrides());

        List<CreateVariantRequest> variantReqs = req.variants() == null ? List.of() : req.variants();
        Set<String> envs = new HashSet<>();
        for (CreateVariantRequest v : variantReqs) {
            requireEnvironment(projectId, v.environmentId());
            if (!envs.add(v.environmentId())) {
                throw new BadRequestException("Duplicate variant for environment '" + v.environmentId() + "'");
            }
            boolean useBase = Boolean.TRUE.equals(v.useBaseSchema());
            writer.validateContent(projectId, v.value(), useBase ? req.schema() : v.schema(), v.overrides());
        }

        ConfigEntity c = new ConfigEntity();
        c.setProjectId(projectId);
        c.setName(req.name());
        c.setDescription(req.description() == null ? "" : req.description());
        c.setValue(Json.orNull(req.value()));
        c.setSchema(Json.schemaOrNull(req.schema()));
        c.setOverrides(Json.orEmptyArray(req.overrides()));
        c = store.createConfig(c, members, actor);

        ObjectNode payload = om.createObjectNode();
        payload.put("configId", c.getId().toString());
        payload.put("name", c.getName());
        payload.put("version", c.getVersion());
        audit.append(new AuditRecord(AuditType.CONFIG_CREATED, actor, projectId, c.getId(), payload));

        for (CreateVariantRequest v : variantReqs) {
            insertVariant(c, v, actor);
        }
        events.publishEvent(new ConfigChangedEvent(projectId, c.getId(), c.getName(), false));
        log.info("config {} created in project {} by {}", c.getName(), projectId, actor);
        return toView(c);
    }

    public ConfigView patch(String projectId, String name, String userEmail, PatchConfigRequest req) {
        String actor = Emails.normalize(userEmail);
        int prevVersion = requireVersion(req.prevVersion());
        ConfigEntity c = load(projectId, name);
        requireDirectEditsAllowed(projectId);

        ConfigMembers members = req.members() == null
                ? null
                : new ConfigMembers(req.members().editorEmails(), req.members().maintainerEmails());
        ConfigChange change = new ConfigChange(
                req.value(), req.schema() != null, req.schema(), req.overrides(), req.description(), members);
        return applyDirect(c, prevVersion, change, actor, null);
    }

    public ConfigView restore(String projectId, String name, String userEmail, RestoreRequest req) {
        String actor = Emails.normalize(userEmail);
        int prevVersion = requireVersion(req.prevVersion());
        if (req.version() == null) throw new BadRequestException("version is required");
        ConfigEntity c = load(projectId, name);
        requireDirectEditsAllowed(projectId);

        ConfigVersionEntity snap = versions.findByConfigIdAndVersion(c.getId(), req.version())
                .orElseThrow(() -> new NotFoundException("Config version " + req.version() + " not found"));
        ConfigChange change = new ConfigChange(
                Json.orNull(snap.getValue()),
                true,
                snap.getSchema(),
                Json.orEmptyArray(snap.getOverrides()),
                snap.getDescription(),
                ConfigMembers.fromJson(snap.getMembers()));
        ObjectNode extra = om.createObjectNode();
        extra.put("restoredFromVersion", snap.getVersion());
        return applyDirect(c, prevVersion, change, actor, extra);
    }

    public void delete(String projectId, String name, String userEmail, Integer prevVersion) {
        String actor = Emails.normalize(userEmail);
        int expected = requireVersion(prevVersion);
        ConfigEntity c = load(projectId, name);
        requireDirectEditsAllowed(projectId);
        permissions.requireAccess(projectId, c.getId(), actor, ChangeSet.deletion());

        cascade.rejectConfigProposals(projectId, c.getId(), RejectionReason.CONFIG_DELETED, null, actor);
        cascade.rejectAllVariantProposals(projectId, c.getId(), RejectionReason.CONFIG_DELETED, actor);
        writer.deleteConfig(c, expected, actor, null);
        log.info("config {} deleted from project {} by {}", name, projectId, actor);
    }

    public VariantView createVariant(String projectId, String name, String userEmail, CreateVariantRequest req) {
        String actor = Emails.normalize(userEmail);
        ConfigEntity c = load(projectId, name);
        requireEnvironment(projectId, req.environmentId());

        boolean useBase = Boolean.TRUE.equals(req.useBaseSchema());
        ChangeSet cs = new ChangeSet(true, req.overrides() != null, false,
                req.schema() != null && !req.schema().isNull(), useBase, false, false);
        permissions.requireAccess(projectId, c.getId(), actor, cs);
        writer.validateContent(projectId, req.value(), useBase ? c.getSchema() : req.schema(), req.overrides());

        ConfigVariantEntity v = insertVariant(c, req, actor);
        events.publishEvent(new ConfigChangedEvent(projectId, c.getId(), c.getName(), false));
        return toVariantView(v);
    }

    public VariantView patchVariant(String projectId, String name, String environmentId, String userEmail,
                                    PatchVariantRequest req) {
        String actor = Emails.normalize(userEmail);
        int prevVersion = requireVersion(req.prevVersion());
        ConfigEntity c = load(projectId, name);
        requireDirectEditsAllowed(projectId);
        ConfigVariantEntity current = loadVariant(c, environmentId);

        VariantChange change = new VariantChange(
                req.value(), req.schema() != null, req.schema(), req.overrides(), req.useBaseSchema());
        return applyVariantDirect(c, current, prevVersion, change, actor, null);
    }

    public VariantView restoreVariant(String projectId, String name, String environmentId, String userEmail,
                                      RestoreRequest req) {
        String actor = Emails.normalize(userEmail);
        int prevVersion = requireVersion(req.prevVersion());
        if (req.version() == null) throw new BadRequestException("version is required");
        ConfigEntity c = load(projectId, name);
        requireDirectEditsAllowed(projectId);
        ConfigVariantEntity current = loadVariant(c, environmentId);

        ConfigVariantVersionEntity snap = variantVersions.findByVariantIdAndVersion(current.getId(), req.version())
                .orElseThrow(() -> new NotFoundException("Config variant version " + req.version() + " not found"));
        VariantChange change = new VariantChange(
                Json.orNull(snap.getValue()),
                true,
                snap.getSchema(),
                Json.orEmptyArray(snap.getOverrides()),
                snap.isUseBaseSchema());
        ObjectNode extra = om.createObjectNode();
        extra.put("restoredFromVariantVersion", snap.getVersion());
        return applyVariantDirect(c, current, prevVersion, change, actor, extra);
    }

    // ---- helpers ----

    /** A patch that changes nothing still commits a new version and rejects pending proposals. */
    private ConfigView applyDirect(ConfigEntity c, int prevVersion, ConfigChange change, String actor, ObjectNode extra) {
        ChangeSet changed = change.diff(c, writer.currentMembers(c.getId()));
        permissions.requireAccess(c.getProjectId(), c.getId(), actor, changed);
        writer.validateConfigChange(c, change);

        ConfigEntity updated = writer.applyConfigChange(c.getId(), prevVersion, change, changed, actor, extra);
        cascade.rejectConfigProposals(updated.getProjectId(), updated.getId(), RejectionReason.CONFIG_EDITED, null, actor);
        return toView(configs.findById(updated.getId()).orElseThrow());
    }

    private VariantView applyVariantDirect(ConfigEntity c, ConfigVariantEntity current, int prevVersion,
                                           VariantChange change, String actor, ObjectNode extra) {
        ChangeSet changed = change.diff(current);
        permissions.requireAccess(c.getProjectId(), c.getId(), actor, changed);
        writer.validateVariantChange(c, current, change);

        ConfigVariantEntity v = writer.applyVariantChange(current.getId(), prevVersion, change, changed, actor, extra);
        cascade.rejectVariantProposals(c.getProjectId(), c.getId(), v.getId(), RejectionReason.CONFIG_EDITED, null, actor);
        return toVariantView(variants.findById(v.getId()).orElseThrow());
    }

    private ConfigVariantEntity insertVariant(ConfigEntity c, CreateVariantRequest req, String actor) {
        ConfigVariantEntity v = new ConfigVariantEntity();
        v.setEnvironmentId(req.environmentId());
        v.setValue(Json.orNull(req.value() != null ? req.value() : c.getValue()));
        v.setSchema(Json.schemaOrNull(req.schema()));
        v.setOverrides(Json.orEmptyArray(req.overrides()));
        v.setUseBaseSchema(Boolean.TRUE.equals(req.useBaseSchema()));
        v = store.createVariant(c, v, actor);

        ObjectNode payload = om.createObjectNode();
        payload.put("configId", c.getId().toString());
        payload.put("name", c.getName());
        payload.put("variantId", v.getId().toString());
        payload.put("environmentId", v.getEnvironmentId());
        audit.append(new AuditRecord(AuditType.CONFIG_VARIANT_CREATED, actor, c.getProjectId(), c.getId(), payload));
        return v;
    }

    private void requireDirectEditsAllowed(String projectId) {
        ProjectSettings settings = directory.settings(projectId)
                .orElseThrow(() -> new NotFoundException("Project not found"));
        if (settings.requireProposals()) {
            throw new BadRequestException(ErrorCode.PROPOSALS_REQUIRED,
                    "This project requires changes to go through proposals");
        }
    }

    private void requireEnvironment(String projectId, String environmentId) {
        if (environmentId == null || !directory.environmentBelongsTo(projectId, environmentId)) {
            throw new BadRequestException("Environment '" + environmentId + "' does not belong to this project");
        }
    }

    private static int requireVersion(Integer v) {
        if (v == null) throw new BadRequestException("prevVersion is required");
        return v;
    }

    ConfigEntity load(String projectId, String name) {
        return configs.findByProjectIdAndName(projectId, name)
                .orElseThrow(() -> new NotFoundException("Config '" + name + "' not found"));
    }

    private ConfigVariantEntity loadVariant(ConfigEntity c, String environmentId) {
        return variants.findByConfig_IdAndEnvironmentId(c.getId(), environmentId)
                .orElseThrow(() -> new NotFoundException("Config variant not found"));
    }

    ConfigView toView(ConfigEntity c) {
        ConfigMembers m = writer.currentMembers(c.getId());
        List<VariantView> vs = new ArrayList<>();
        for (ConfigVariantEntity v : variants.findByConfig_IdOrderByEnvironmentIdAsc(c.getId())) {
            vs.add(toVariantView(v));
        }
        return new ConfigView(c.getId(), c.getProjectId(), c.getName(), c.getDescription(), c.getVersion(),
                Json.orNull(c.getValue()), c.getSchema(), Json.orEmptyArray(c.getOverrides()),
                m.editorEmails(), m.maintainerEmails(), vs, c.getCreatedAt(), c.getUpdatedAt());
    }

    static VariantView toVariantView(ConfigVariantEntity v) {
        return new VariantView(v.getId(), v.getEnvironmentId(), v.getVersion(), Json.orNull(v.getValue()),
                v.getSchema(), Json.orEmptyArray(v.getOverrides()), v.isUseBaseSchema(), v.getUpdatedAt());
    }

    private static ConfigVersionView toVersionView(ConfigVersionEntity v) {
        ConfigMembers m = ConfigMembers.fromJson(v.getMembers());
        return new ConfigVersionView(v.getVersion(), v.getName(), v.getDescription(), Json.orNull(v.getValue()),
                v.getSchema(), Json.orEmptyArray(v.getOverrides()), m.editorEmails(), m.maintainerEmails(),
                v.getAuthorId(), v.getCreatedAt());
    }

    private static VariantVersionView toVariantVersionView(ConfigVariantVersionEntity v, String environmentId) {
        return new VariantVersionView(v.getVersion(), environmentId, Json.orNull(v.getValue()), v.getSchema(),
                Json.orEmptyArray(v.getOverrides()), v.isUseBaseSchema(), v.getAuthorId(), v.getCreatedAt());
    }
}
