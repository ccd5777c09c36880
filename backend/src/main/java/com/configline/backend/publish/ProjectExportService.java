package com.configline.backend.publish;

import com.configline.backend.configs.ConfigEntity;
import com.configline.backend.configs.ConfigRepository;
import com.configline.backend.configs.ConfigVariantEntity;
import com.configline.backend.configs.ConfigVariantRepository;
import com.configline.backend.error.NotFoundException;
import com.configline.backend.permission.ConfigPermissions;
import com.configline.backend.project.ProjectDirectory;
import com.configline.backend.publish.ProjectExport.ExportedConfig;
import com.configline.backend.publish.ProjectExport.ExportedVariant;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ProjectExportService {

    private final ConfigRepository configs;
    private final ConfigVariantRepository variants;
    private final ConfigPermissions permissions;
    private final ProjectDirectory directory;

    public ProjectExportService(
            ConfigRepository configs,
            ConfigVariantRepository variants,
            ConfigPermissions permissions,
            ProjectDirectory directory
    ) {
        this.configs = configs;
        this.variants = variants;
        this.permissions = permissions;
        this.directory = directory;
    }

    @Transactional(readOnly = true)
    public ProjectExport exportFor(String projectId, String userEmail) {
        if (directory.settings(projectId).isEmpty()) {
            throw new NotFoundException("Project not found: " + projectId);
        }
        permissions.requireProjectMember(projectId, userEmail);
        return build(projectId);
    }

    /** Used after commit, outside any caller transaction. */
    @Transactional(readOnly = true, propagation = Propagation.REQUIRES_NEW)
    public ProjectExport build(String projectId) {
        List<ExportedConfig> out = configs.findByProjectIdOrderByNameAsc(projectId).stream()
                .map(this::exportConfig)
                .toList();
        return new ProjectExport(projectId, out);
    }

    private ExportedConfig exportConfig(ConfigEntity c) {
        Map<String, ExportedVariant> byEnv = new LinkedHashMap<>();
        for (ConfigVariantEntity v : variants.findByConfig_IdOrderByEnvironmentIdAsc(c.getId())) {
            byEnv.put(v.getEnvironmentId(),
                    new ExportedVariant(v.getValue(), v.getSchema(), v.getOverrides(), v.isUseBaseSchema()));
        }
        return new ExportedConfig(c.getName(), c.getDescription(), c.getValue(), c.getSchema(), c.getOverrides(), byEnv);
    }
}
