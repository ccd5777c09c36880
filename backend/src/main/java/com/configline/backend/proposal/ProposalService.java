package com.configline.backend.proposal;

import com.configline.backend.audit.AuditRecord;
import com.configline.backend.audit.AuditSink;
import com.configline.backend.audit.AuditType;
import com.configline.backend.configs.*;
import com.configline.backend.configs.ConfigDtos.MembersBody;
import com.configline.backend.error.BadRequestException;
import com.configline.backend.error.ErrorCode;
import com.configline.backend.error.ForbiddenException;
import com.configline.backend.error.NotFoundException;
import com.configline.backend.permission.ChangeSet;
import com.configline.backend.permission.ConfigAccess;
import com.configline.backend.permission.ConfigPermissions;
import com.configline.backend.permission.PermissionPolicy;
import com.configline.backend.project.Emails;
import com.configline.backend.project.ProjectDirectory;
import com.configline.backend.project.ProjectSettings;
import com.configline.backend.proposal.ProposalDtos.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Proposal lifecycle: pending, then approved or rejected exactly once. Approval re-checks the
 * reviewer's access and the base version at approval time, applies the change through
 * {@link ConfigWriter}, and rejects every other pending proposal on the same target in favor of
 * the approved one. All of it commits or rolls back together.
 */
@Service
@Transactional
public class ProposalService {
    private static final Logger log = LoggerFactory.getLogger(ProposalService.class);

    private final ConfigProposalRepository configProposals;
    private final ConfigVariantProposalRepository variantProposals;
    private final ConfigRepository configs;
    private final ConfigVariantRepository variants;
    private final ConfigWriter writer;
    private final ProposalCascade cascade;
    private final ConfigPermissions permissions;
    private final ProjectDirectory directory;
    private final AuditSink audit;
    private final ObjectMapper om;
    private final Clock clock;

    public ProposalService(
            ConfigProposalRepository configProposals,
            ConfigVariantProposalRepository variantProposals,
            ConfigRepository configs,
            ConfigVariantRepository variants,
            ConfigWriter writer,
            ProposalCascade cascade,
            ConfigPermissions permissions,
            ProjectDirectory directory,
            AuditSink audit,
            ObjectMapper om,
            Clock clock
    ) {
        this.configProposals = configProposals;
        this.variantProposals = variantProposals;
        this.configs = configs;
        this.variants = variants;
        this.writer = writer;
        this.cascade = cascade;
        this.permissions = permissions;
        this.directory = directory;
        this.audit = audit;
        this.om = om;
        this.clock = clock;
    }

    // ---- config proposals ----

    public ConfigProposalView createConfigProposal(String projectId, String configName, String userEmail,
                                                   CreateConfigProposalRequest req) {
        String actor = Emails.normalize(userEmail);
        ConfigEntity config = loadConfig(projectId, configName);
        permissions.requireProjectMember(projectId, actor);
        requireBaseVersion(req.baseVersion(), config.getVersion());

        boolean delete = Boolean.TRUE.equals(req.proposedDelete());
        ConfigMembers members = req.members() == null
                ? null
                : new ConfigMembers(req.members().editorEmails(), req.members().maintainerEmails()).validated();
        boolean anyField = req.value() != null || req.schema() != null || req.overrides() != null
                || req.description() != null || members != null;
        if (delete && anyField) {
            throw new BadRequestException("A delete proposal cannot also change fields");
        }
        if (!delete && !anyField) {
            throw new BadRequestException("A proposal must change at least one field or propose deletion");
        }
        if (!delete) {
            writer.validateConfigChange(config, new ConfigChange(
                    req.value(), req.schema() != null, req.schema(), req.overrides(), req.description(), members));
        }

        ConfigProposalEntity p = new ConfigProposalEntity();
        p.setId(UUID.randomUUID());
        p.setConfigId(config.getId());
        p.setProjectId(projectId);
        p.setProposerId(actor);
        p.setBaseConfigVersion(config.getVersion());
        p.setProposedDelete(delete);
        p.setProposedDescription(req.description());
        p.setProposedMembers(members == null ? null : members.toJson());
        p.setValueProposed(req.value() != null);
        p.setProposedValue(req.value());
        p.setSchemaProposed(req.schema() != null);
        p.setProposedSchema(req.schema() == null || req.schema().isNull() ? null : req.schema());
        p.setProposedOverrides(req.overrides());
        p.setMessage(req.message());
        p.setCreatedAt(OffsetDateTime.now(clock));
        p = configProposals.save(p);

        ObjectNode payload = om.createObjectNode();
        payload.put("proposalId", p.getId().toString());
        payload.put("baseConfigVersion", p.getBaseConfigVersion());
        payload.put("proposedDelete", delete);
        audit.append(new AuditRecord(AuditType.CONFIG_PROPOSAL_CREATED, actor, projectId, config.getId(), payload));
        return toView(p);
    }

    public ConfigProposalView approveConfigProposal(UUID proposalId, String userEmail) {
        String actor = Emails.normalize(userEmail);
        ConfigProposalEntity p = configProposals.findById(proposalId)
                .orElseThrow(() -> new BadRequestException(ErrorCode.PROPOSAL_NOT_FOUND, "Proposal not found"));
        requirePending(p.getStatus());

        ConfigEntity config = configs.findById(p.getConfigId())
                .orElseThrow(() -> new NotFoundException("Config not found"));
        ConfigChange change = toChange(p);
        ChangeSet changed = p.isProposedDelete()
                ? ChangeSet.deletion()
                : change.diff(config, writer.currentMembers(config.getId()));
        requireApprover(p.getProjectId(), config.getId(), actor, changed);
        requireNotSelfApproval(p.getProjectId(), p.getProposerId(), actor);
        if (config.getVersion() != p.getBaseConfigVersion()) {
            throw new BadRequestException(ErrorCode.VERSION_MISMATCH,
                    "Config has changed since the proposal was created (proposal base v"
                            + p.getBaseConfigVersion() + ", current v" + config.getVersion() + ")");
        }
        if (!p.isProposedDelete()) {
            writer.validateConfigChange(config, change);
        }

        if (configProposals.markApproved(p.getId(), actor, OffsetDateTime.now(clock)) == 0) {
            throw alreadyTerminal(configProposals.findById(proposalId).map(ConfigProposalEntity::getStatus).orElse(null));
        }

        ObjectNode extra = om.createObjectNode();
        extra.put("proposalId", p.getId().toString());
        if (p.isProposedDelete()) {
            cascade.rejectConfigProposals(p.getProjectId(), config.getId(),
                    RejectionReason.ANOTHER_PROPOSAL_APPROVED, p.getId(), actor);
            cascade.rejectAllVariantProposals(p.getProjectId(), config.getId(), RejectionReason.CONFIG_DELETED, actor);
            writer.deleteConfig(config, p.getBaseConfigVersion(), actor, extra);
        } else {
            writer.applyConfigChange(config.getId(), p.getBaseConfigVersion(), change, changed, actor, extra);
            cascade.rejectConfigProposals(p.getProjectId(), config.getId(),
                    RejectionReason.ANOTHER_PROPOSAL_APPROVED, p.getId(), actor);
        }

        ObjectNode payload = om.createObjectNode();
        payload.put("proposalId", p.getId().toString());
        payload.put("proposerId", p.getProposerId());
        payload.put("proposedDelete", p.isProposedDelete());
        audit.append(new AuditRecord(AuditType.CONFIG_PROPOSAL_APPROVED, actor, p.getProjectId(), p.getConfigId(), payload));
        log.info("config proposal {} approved by {}", p.getId(), actor);
        return toView(configProposals.findById(proposalId).orElseThrow());
    }

    public ConfigProposalView rejectConfigProposal(UUID proposalId, String userEmail) {
        String actor = Emails.normalize(userEmail);
        ConfigProposalEntity p = configProposals.findById(proposalId)
                .orElseThrow(() -> new BadRequestException(ErrorCode.PROPOSAL_NOT_FOUND, "Proposal not found"));
        requirePending(p.getStatus());
        permissions.requireProjectMember(p.getProjectId(), actor);

        if (configProposals.markRejected(p.getId(), RejectionReason.REJECTED_EXPLICITLY, null, actor,
                OffsetDateTime.now(clock)) == 0) {
            throw alreadyTerminal(configProposals.findById(proposalId).map(ConfigProposalEntity::getStatus).orElse(null));
        }
        ObjectNode payload = om.createObjectNode();
        payload.put("proposalId", p.getId().toString());
        payload.put("rejectionReason", RejectionReason.REJECTED_EXPLICITLY.wireName());
        audit.append(new AuditRecord(AuditType.CONFIG_PROPOSAL_REJECTED, actor, p.getProjectId(), p.getConfigId(), payload));
        return toView(configProposals.findById(proposalId).orElseThrow());
    }

    @Transactional(readOnly = true)
    public ConfigProposalView getConfigProposal(UUID proposalId, String userEmail) {
        ConfigProposalEntity p = configProposals.findById(proposalId)
                .orElseThrow(() -> new NotFoundException("Proposal not found"));
        permissions.requireProjectMember(p.getProjectId(), userEmail);
        return toView(p);
    }

    @Transactional(readOnly = true)
    public List<ConfigProposalView> listConfigProposals(String projectId, String configName, String userEmail) {
        permissions.requireProjectMember(projectId, userEmail);
        ConfigEntity config = loadConfig(projectId, configName);
        return configProposals.findByConfigIdOrderByCreatedAtDesc(config.getId()).stream().map(this::toView).toList();
    }

    // ---- variant proposals ----

    public VariantProposalView createVariantProposal(String projectId, String configName, String environmentId,
                                                     String userEmail, CreateVariantProposalRequest req) {
        String actor = Emails.normalize(userEmail);
        ConfigEntity config = loadConfig(projectId, configName);
        ConfigVariantEntity variant = variants.findByConfig_IdAndEnvironmentId(config.getId(), environmentId)
                .orElseThrow(() -> new NotFoundException("Config variant not found"));
        permissions.requireProjectMember(projectId, actor);
        requireBaseVersion(req.baseVersion(), variant.getVersion());

        boolean anyField = req.value() != null || req.schema() != null || req.overrides() != null
                || req.useBaseSchema() != null;
        if (!anyField) {
            throw new BadRequestException("A proposal must change at least one field");
        }
        writer.validateVariantChange(config, variant, new VariantChange(
                req.value(), req.schema() != null, req.schema(), req.overrides(), req.useBaseSchema()));

        ConfigVariantProposalEntity p = new ConfigVariantProposalEntity();
        p.setId(UUID.randomUUID());
        p.setConfigVariantId(variant.getId());
        p.setConfigId(config.getId());
        p.setProjectId(projectId);
        p.setEnvironmentId(environmentId);
        p.setProposerId(actor);
        p.setBaseVariantVersion(variant.getVersion());
        p.setValueProposed(req.value() != null);
        p.setProposedValue(req.value());
        p.setSchemaProposed(req.schema() != null);
        p.setProposedSchema(req.schema() == null || req.schema().isNull() ? null : req.schema());
        p.setProposedOverrides(req.overrides());
        p.setProposedUseBaseSchema(req.useBaseSchema());
        p.setMessage(req.message());
        p.setCreatedAt(OffsetDateTime.now(clock));
        p = variantProposals.save(p);

        ObjectNode payload = om.createObjectNode();
        payload.put("proposalId", p.getId().toString());
        payload.put("variantId", variant.getId().toString());
        payload.put("environmentId", environmentId);
        payload.put("baseVariantVersion", p.getBaseVariantVersion());
        audit.append(new AuditRecord(AuditType.CONFIG_VARIANT_PROPOSAL_CREATED, actor, projectId, config.getId(), payload));
        return toView(p);
    }

    public VariantProposalView approveVariantProposal(UUID proposalId, String userEmail) {
        String actor = Emails.normalize(userEmail);
        ConfigVariantProposalEntity p = variantProposals.findById(proposalId)
                .orElseThrow(() -> new BadRequestException(ErrorCode.PROPOSAL_NOT_FOUND, "Proposal not found"));
        requirePending(p.getStatus());

        ConfigVariantEntity variant = variants.findById(p.getConfigVariantId())
                .orElseThrow(() -> new NotFoundException("Config variant not found"));
        ConfigEntity config = variant.getConfig();
        VariantChange change = toChange(p);
        ChangeSet changed = change.diff(variant);
        requireApprover(p.getProjectId(), config.getId(), actor, changed);
        requireNotSelfApproval(p.getProjectId(), p.getProposerId(), actor);
        if (variant.getVersion() != p.getBaseVariantVersion()) {
            throw new BadRequestException(ErrorCode.VERSION_MISMATCH,
                    "Variant has changed since the proposal was created (proposal base v"
                            + p.getBaseVariantVersion() + ", current v" + variant.getVersion() + ")");
        }
        writer.validateVariantChange(config, variant, change);

        if (variantProposals.markApproved(p.getId(), actor, OffsetDateTime.now(clock)) == 0) {
            throw alreadyTerminal(variantProposals.findById(proposalId).map(ConfigVariantProposalEntity::getStatus).orElse(null));
        }
        ObjectNode extra = om.createObjectNode();
        extra.put("proposalId", p.getId().toString());
        writer.applyVariantChange(p.getConfigVariantId(), p.getBaseVariantVersion(), change, changed, actor, extra);
        cascade.rejectVariantProposals(p.getProjectId(), p.getConfigId(), p.getConfigVariantId(),
                RejectionReason.ANOTHER_PROPOSAL_APPROVED, p.getId(), actor);

        ObjectNode payload = om.createObjectNode();
        payload.put("proposalId", p.getId().toString());
        payload.put("proposerId", p.getProposerId());
        payload.put("environmentId", p.getEnvironmentId());
        audit.append(new AuditRecord(AuditType.CONFIG_VARIANT_PROPOSAL_APPROVED, actor, p.getProjectId(), p.getConfigId(), payload));
        log.info("variant proposal {} approved by {}", p.getId(), actor);
        return toView(variantProposals.findById(proposalId).orElseThrow());
    }

    public VariantProposalView rejectVariantProposal(UUID proposalId, String userEmail) {
        String actor = Emails.normalize(userEmail);
        ConfigVariantProposalEntity p = variantProposals.findById(proposalId)
                .orElseThrow(() -> new BadRequestException(ErrorCode.PROPOSAL_NOT_FOUND, "Proposal not found"));
        requirePending(p.getStatus());
        permissions.requireProjectMember(p.getProjectId(), actor);

        if (variantProposals.markRejected(p.getId(), RejectionReason.REJECTED_EXPLICITLY, null, actor,
                OffsetDateTime.now(clock)) == 0) {
            throw alreadyTerminal(variantProposals.findById(proposalId).map(ConfigVariantProposalEntity::getStatus).orElse(null));
        }
        ObjectNode payload = om.createObjectNode();
        payload.put("proposalId", p.getId().toString());
        payload.put("rejectionReason", RejectionReason.REJECTED_EXPLICITLY.wireName());
        audit.append(new AuditRecord(AuditType.CONFIG_VARIANT_PROPOSAL_REJECTED, actor, p.getProjectId(), p.getConfigId(), payload));
        return toView(variantProposals.findById(proposalId).orElseThrow());
    }

    @Transactional(readOnly = true)
    public VariantProposalView getVariantProposal(UUID proposalId, String userEmail) {
        ConfigVariantProposalEntity p = variantProposals.findById(proposalId)
                .orElseThrow(() -> new NotFoundException("Proposal not found"));
        permissions.requireProjectMember(p.getProjectId(), userEmail);
        return toView(p);
    }

    @Transactional(readOnly = true)
    public List<VariantProposalView> listVariantProposals(String projectId, String configName, String environmentId,
                                                          String userEmail) {
        permissions.requireProjectMember(projectId, userEmail);
        ConfigEntity config = loadConfig(projectId, configName);
        ConfigVariantEntity variant = variants.findByConfig_IdAndEnvironmentId(config.getId(), environmentId)
                .orElseThrow(() -> new NotFoundException("Config variant not found"));
        return variantProposals.findByConfigVariantIdOrderByCreatedAtDesc(variant.getId()).stream()
                .map(this::toView).toList();
    }

    // ---- helpers ----

    private ConfigEntity loadConfig(String projectId, String name) {
        return configs.findByProjectIdAndName(projectId, name)
                .orElseThrow(() -> new NotFoundException("Config '" + name + "' not found"));
    }

    private static void requireBaseVersion(Integer baseVersion, int current) {
        if (baseVersion == null) throw new BadRequestException("baseVersion is required");
        if (baseVersion != current) {
            throw new BadRequestException(ErrorCode.VERSION_MISMATCH,
                    "Base version " + baseVersion + " does not match current version " + current);
        }
    }

    private static void requirePending(ProposalStatus status) {
        if (status != ProposalStatus.PENDING) throw alreadyTerminal(status);
    }

    private static BadRequestException alreadyTerminal(ProposalStatus status) {
        if (status == ProposalStatus.APPROVED) {
            return new BadRequestException(ErrorCode.PROPOSAL_ALREADY_APPROVED, "Proposal is already approved");
        }
        if (status == ProposalStatus.REJECTED) {
            return new BadRequestException(ErrorCode.PROPOSAL_ALREADY_REJECTED, "Proposal is already rejected");
        }
        return new BadRequestException(ErrorCode.PROPOSAL_NOT_FOUND, "Proposal not found");
    }

    private void requireApprover(String projectId, UUID configId, String actor, ChangeSet changed) {
        ConfigAccess required = PermissionPolicy.requiredForCommit(changed);
        if (!permissions.accessOf(projectId, configId, actor).satisfies(required)) {
            throw new ForbiddenException(ErrorCode.INSUFFICIENT_ROLE,
                    "Approving this proposal requires " + required.name().toLowerCase(Locale.ROOT) + " access");
        }
    }

    private void requireNotSelfApproval(String projectId, String proposerId, String actor) {
        if (!proposerId.equals(actor)) return;
        boolean allowed = directory.settings(projectId).map(ProjectSettings::allowSelfApprovals).orElse(false);
        if (!allowed) {
            throw new ForbiddenException(ErrorCode.SELF_APPROVAL_FORBIDDEN, "You cannot approve your own proposal");
        }
    }

    private static ConfigChange toChange(ConfigProposalEntity p) {
        return new ConfigChange(
                p.isValueProposed() ? orNull(p.getProposedValue()) : null,
                p.isSchemaProposed(),
                p.getProposedSchema(),
                p.getProposedOverrides(),
                p.getProposedDescription(),
                p.getProposedMembers() == null ? null : ConfigMembers.fromJson(p.getProposedMembers()));
    }

    private static VariantChange toChange(ConfigVariantProposalEntity p) {
        return new VariantChange(
                p.isValueProposed() ? orNull(p.getProposedValue()) : null,
                p.isSchemaProposed(),
                p.getProposedSchema(),
                p.getProposedOverrides(),
                p.getProposedUseBaseSchema());
    }

    private static JsonNode orNull(JsonNode n) {
        return n == null ? NullNode.getInstance() : n;
    }

    private ConfigProposalView toView(ConfigProposalEntity p) {
        MembersBody members = null;
        if (p.getProposedMembers() != null) {
            ConfigMembers m = ConfigMembers.fromJson(p.getProposedMembers());
            members = new MembersBody(m.editorEmails(), m.maintainerEmails());
        }
        return new ConfigProposalView(p.getId(), p.getConfigId(), p.getProjectId(), p.getProposerId(),
                p.getBaseConfigVersion(), p.getStatus(), p.isProposedDelete(), p.getProposedDescription(),
                p.isValueProposed(), p.isValueProposed() ? orNull(p.getProposedValue()) : null,
                p.isSchemaProposed(), p.getProposedSchema(), p.getProposedOverrides(), members, p.getMessage(),
                p.getCreatedAt(), p.getApprovedAt(), p.getRejectedAt(), p.getReviewerId(),
                p.getRejectedInFavorOfProposalId(),
                p.getRejectionReason() == null ? null : p.getRejectionReason().wireName());
    }

    private VariantProposalView toView(ConfigVariantProposalEntity p) {
        return new VariantProposalView(p.getId(), p.getConfigVariantId(), p.getConfigId(), p.getEnvironmentId(),
                p.getProposerId(), p.getBaseVariantVersion(), p.getStatus(), p.isValueProposed(),
                p.isValueProposed() ? orNull(p.getProposedValue()) : null, p.isSchemaProposed(),
                p.getProposedSchema(), p.getProposedOverrides(), p.getProposedUseBaseSchema(), p.getMessage(),
                p.getCreatedAt(), p.getApprovedAt(), p.getRejectedAt(), p.getReviewerId(),
                p.getRejectedInFavorOfProposalId(),
                p.getRejectionReason() == null ? null : p.getRejectionReason().wireName());
    }
}
