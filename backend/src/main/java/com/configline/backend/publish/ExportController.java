package com.configline.backend.publish;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ExportController {

    private final ProjectExportService exports;

    public ExportController(ProjectExportService exports) {
        this.exports = exports;
    }

    @GetMapping("/api/projects/{projectId}/export")
    public ProjectExport export(@PathVariable String projectId, @RequestHeader("X-User-Email") String user) {
        return exports.exportFor(projectId, user);
    }
}
