package com.configline.backend.configs;

import com.configline.backend.error.DuplicateNameException;
import com.configline.backend.error.NotFoundException;
import com.configline.backend.error.VersionConflictException;
import com.configline.backend.permission.ConfigMemberRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Versioned storage of configs and variants. Every mutation is conditional on the version the
 * caller last saw: the row's version is advanced by a single compare-and-swap update, and only the
 * caller that won it may write the new content. Each committed version is copied into history.
 *
 * <p>Must run inside the caller's transaction so content, history, cascades and audit commit
 * together.
 */
@Component
@Transactional(propagation = Propagation.MANDATORY)
public class VersionStore {
    private static final Logger log = LoggerFactory.getLogger(VersionStore.class);

    private final ConfigRepository configs;
    private final ConfigVariantRepository variants;
    private final ConfigMemberRepository members;
    private final ConfigVersionRepository versions;
    private final ConfigVariantVersionRepository variantVersions;
    private final Clock clock;

    public VersionStore(
            ConfigRepository configs,
            ConfigVariantRepository variants,
            ConfigMemberRepository members,
            ConfigVersionRepository versions,
            ConfigVariantVersionRepository variantVersions,
            Clock clock
    ) {
        this.configs = configs;
        this.variants = variants;
        this.members = members;
        this.versions = versions;
        this.variantVersions = variantVersions;
        this.clock = clock;
    }

    public ConfigEntity createConfig(ConfigEntity config, ConfigMembers configMembers, String authorId) {
        if (configs.existsByProjectIdAndName(config.getProjectId(), config.getName())) {
            throw new DuplicateNameException("Config with name '" + config.getName() + "' already exists");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        config.setId(UUID.randomUUID());
        config.setVersion(1);
        config.setCreatedAt(now);
        config.setUpdatedAt(now);
        try {
            config = configs.saveAndFlush(config);
        } catch (DataIntegrityViolationException e) {
            // lost a race on the (project, name) unique index
            throw new DuplicateNameException("Config with name '" + config.getName() + "' already exists");
        }
        replaceMembers(config, configMembers);
        snapshot(config, configMembers, authorId);
        return config;
    }

    public ConfigVariantEntity createVariant(ConfigEntity config, ConfigVariantEntity variant, String authorId) {
        if (variants.existsByConfig_IdAndEnvironmentId(config.getId(), variant.getEnvironmentId())) {
            throw new DuplicateNameException("Variant for environment '" + variant.getEnvironmentId() + "' already exists");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        variant.setId(UUID.randomUUID());
        variant.setConfig(config);
        variant.setVersion(1);
        variant.setCreatedAt(now);
        variant.setUpdatedAt(now);
        try {
            variant = variants.saveAndFlush(variant);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateNameException("Variant for environment '" + variant.getEnvironmentId() + "' already exists");
        }
        snapshot(variant, authorId);
        return variant;
    }

    /**
     * Wins the next version of a config or fails. The returned entity is freshly loaded and
     * already carries {@code expectedVersion + 1}; the caller applies its patch to it and then
     * calls {@link #commit(ConfigEntity, ConfigMembers, String)}.
     */
    public ConfigEntity claimConfig(UUID id, int expectedVersion) {
        int updated = configs.advanceVersion(id, expectedVersion, OffsetDateTime.now(clock));
        if (updated == 0) {
            if (!configs.existsById(id)) throw new NotFoundException("Config not found");
            throw new VersionConflictException("Config", expectedVersion);
        }
        return configs.findById(id).orElseThrow(() -> new NotFoundException("Config not found"));
    }

    public ConfigVariantEntity claimVariant(UUID id, int expectedVersion) {
        int updated = variants.advanceVersion(id, expectedVersion, OffsetDateTime.now(clock));
        if (updated == 0) {
            if (!variants.existsById(id)) throw new NotFoundException("Config variant not found");
            throw new VersionConflictException("Config variant", expectedVersion);
        }
        return variants.findById(id).orElseThrow(() -> new NotFoundException("Config variant not found"));
    }

    /** Persists patched content of a claimed config; {@code newMembers} null keeps the members. */
    public ConfigEntity commit(ConfigEntity config, ConfigMembers newMembers, String authorId) {
        config = configs.saveAndFlush(config);
        ConfigMembers current;
        if (newMembers != null) {
            replaceMembers(config, newMembers);
            current = newMembers;
        } else {
            current = ConfigMembers.fromEntities(members.findByConfig_IdOrderByEmailAsc(config.getId()));
        }
        snapshot(config, current, authorId);
        log.debug("config {} committed at v{}", config.getId(), config.getVersion());
        return config;
    }

    public ConfigVariantEntity commit(ConfigVariantEntity variant, String authorId) {
        variant = variants.saveAndFlush(variant);
        snapshot(variant, authorId);
        log.debug("variant {} committed at v{}", variant.getId(), variant.getVersion());
        return variant;
    }

    /** Removes the config with its members, variants and history. */
    public void deleteConfig(UUID id, int expectedVersion) {
        ConfigEntity current = configs.findById(id).orElseThrow(() -> new NotFoundException("Config not found"));
        if (current.getVersion() != expectedVersion) {
            throw new VersionConflictException("Config", expectedVersion);
        }
        members.deleteByConfigId(id);
        variants.deleteByConfigId(id);
        variantVersions.deleteByConfigId(id);
        versions.deleteByConfigId(id);
        // the version predicate repeats the check above against concurrent writers
        if (configs.deleteIfVersion(id, expectedVersion) == 0) {
            throw new VersionConflictException("Config", expectedVersion);
        }
    }

    private void replaceMembers(ConfigEntity config, ConfigMembers configMembers) {
        members.deleteByConfigId(config.getId());
        for (String e : configMembers.editorEmails()) {
            members.save(new ConfigMemberEntity(config, e, ConfigMemberRole.EDITOR));
        }
        for (String e : configMembers.maintainerEmails()) {
            members.save(new ConfigMemberEntity(config, e, ConfigMemberRole.MAINTAINER));
        }
        members.flush();
    }

    private void snapshot(ConfigEntity c, ConfigMembers configMembers, String authorId) {
        ConfigVersionEntity v = new ConfigVersionEntity();
        v.setId(UUID.randomUUID());
        v.setConfigId(c.getId());
        v.setVersion(c.getVersion());
        v.setName(c.getName());
        v.setDescription(c.getDescription());
        v.setValue(c.getValue());
        v.setSchema(c.getSchema());
        v.setOverrides(c.getOverrides());
        v.setMembers(configMembers.toJson());
        v.setAuthorId(authorId);
        v.setCreatedAt(OffsetDateTime.now(clock));
        versions.save(v);
    }

    private void snapshot(ConfigVariantEntity variant, String authorId) {
        ConfigVariantVersionEntity v = new ConfigVariantVersionEntity();
        v.setId(UUID.randomUUID());
        v.setVariantId(variant.getId());
        v.setConfigId(variant.getConfig().getId());
        v.setVersion(variant.getVersion());
        v.setValue(variant.getValue());
        v.setSchema(variant.getSchema());
        v.setOverrides(variant.getOverrides());
        v.setUseBaseSchema(variant.isUseBaseSchema());
        v.setAuthorId(authorId);
        v.setCreatedAt(OffsetDateTime.now(clock));
        variantVersions.save(v);
    }
}
