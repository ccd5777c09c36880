package com.configline.backend.configs;

import com.configline.backend.configs.ConfigDtos.*;
import com.configline.backend.override.EvaluationResult;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/projects/{projectId}/configs")
public class ConfigController {

    static final String USER_HEADER = "X-User-Email";

    private final ConfigService service;

    public ConfigController(ConfigService service) {
        this.service = service;
    }

    @GetMapping
    public List<ConfigSummary> list(@PathVariable String projectId, @RequestHeader(USER_HEADER) String user) {
        return service.list(projectId, user);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ConfigView create(
            @PathVariable String projectId,
            @RequestHeader(USER_HEADER) String user,
            @RequestBody CreateConfigRequest req
    ) {
        return service.create(projectId, user, req);
    }

    @GetMapping("/{name}")
    public ConfigView get(@PathVariable String projectId, @PathVariable String name,
                          @RequestHeader(USER_HEADER) String user) {
        return service.get(projectId, name, user);
    }

    @PatchMapping("/{name}")
    public ConfigView patch(
            @PathVariable String projectId,
            @PathVariable String name,
            @RequestHeader(USER_HEADER) String user,
            @RequestBody PatchConfigRequest req
    ) {
        return service.patch(projectId, name, user, req);
    }

    @DeleteMapping("/{name}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(
            @PathVariable String projectId,
            @PathVariable String name,
            @RequestHeader(USER_HEADER) String user,
            @RequestParam(required = false) Integer prevVersion
    ) {
        service.delete(projectId, name, user, prevVersion);
    }

    @GetMapping("/{name}/versions")
    public List<ConfigVersionView> versions(@PathVariable String projectId, @PathVariable String name,
                                            @RequestHeader(USER_HEADER) String user) {
        return service.versions(projectId, name, user);
    }

    @GetMapping("/{name}/versions/{version}")
    public ConfigVersionView version(@PathVariable String projectId, @PathVariable String name,
                                     @PathVariable int version, @RequestHeader(USER_HEADER) String user) {
        return service.version(projectId, name, version, user);
    }

    @PostMapping("/{name}/restore")
    public ConfigView restore(
            @PathVariable String projectId,
            @PathVariable String name,
            @RequestHeader(USER_HEADER) String user,
            @RequestBody RestoreRequest req
    ) {
        return service.restore(projectId, name, user, req);
    }

    @PostMapping("/{name}/variants")
    @ResponseStatus(HttpStatus.CREATED)
    public VariantView createVariant(
            @PathVariable String projectId,
            @PathVariable String name,
            @RequestHeader(USER_HEADER) String user,
            @RequestBody CreateVariantRequest req
    ) {
        return service.createVariant(projectId, name, user, req);
    }

    @PatchMapping("/{name}/variants/{environmentId}")
    public VariantView patchVariant(
            @PathVariable String projectId,
            @PathVariable String name,
            @PathVariable String environmentId,
            @RequestHeader(USER_HEADER) String user,
            @RequestBody PatchVariantRequest req
    ) {
        return service.patchVariant(projectId, name, environmentId, user, req);
    }

    @GetMapping("/{name}/variants/{environmentId}/versions")
    public List<VariantVersionView> variantVersions(@PathVariable String projectId, @PathVariable String name,
                                                    @PathVariable String environmentId,
                                                    @RequestHeader(USER_HEADER) String user) {
        return service.variantVersions(projectId, name, environmentId, user);
    }

    @GetMapping("/{name}/variants/{environmentId}/versions/{version}")
    public VariantVersionView variantVersion(@PathVariable String projectId, @PathVariable String name,
                                             @PathVariable String environmentId, @PathVariable int version,
                                             @RequestHeader(USER_HEADER) String user) {
        return service.variantVersion(projectId, name, environmentId, version, user);
    }

    @PostMapping("/{name}/variants/{environmentId}/restore")
    public VariantView restoreVariant(
            @PathVariable String projectId,
            @PathVariable String name,
            @PathVariable String environmentId,
            @RequestHeader(USER_HEADER) String user,
            @RequestBody RestoreRequest req
    ) {
        return service.restoreVariant(projectId, name, environmentId, user, req);
    }

    @PostMapping("/{name}/evaluate")
    public EvaluationResult evaluate(
            @PathVariable String projectId,
            @PathVariable String name,
            @RequestHeader(USER_HEADER) String user,
            @RequestBody EvaluateRequest req
    ) {
        return service.evaluate(projectId, name, user, req);
    }
}
