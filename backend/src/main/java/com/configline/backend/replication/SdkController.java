package com.configline.backend.replication;

import com.configline.backend.error.NotFoundException;
import com.configline.backend.error.UnauthorizedException;
import com.configline.backend.override.EvaluationResult;
import com.configline.backend.project.ProjectDirectory;
import com.configline.backend.project.SdkKeys;
import com.configline.backend.project.SdkScope;
import com.configline.backend.replication.ReplicationStreamManager.StartRequest;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/** Endpoints used by SDKs. Authenticated with an environment-scoped SDK key. */
@RestController
@RequestMapping("/api/sdk/v1")
public class SdkController {

    public record ConfigsResponse(List<SdkConfig> configs) {}

    public record EvaluateBody(Map<String, JsonNode> context) {}

    public record ValueResponse(String name, JsonNode value, String matchedOverride) {}

    private final ProjectDirectory directory;
    private final ConfigReplicaService replicas;
    private final ReplicationStreamManager streams;

    public SdkController(ProjectDirectory directory, ConfigReplicaService replicas, ReplicationStreamManager streams) {
        this.directory = directory;
        this.replicas = replicas;
        this.streams = streams;
    }

    @GetMapping("/configs")
    public ConfigsResponse configs(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth) {
        SdkScope scope = authenticate(auth);
        return new ConfigsResponse(replicas.snapshot(scope.projectId(), scope.environmentId()).stream()
                .map(ReplicaEntry::config)
                .toList());
    }

    @PostMapping("/configs/{name}/value")
    public ValueResponse value(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
            @PathVariable String name,
            @RequestBody(required = false) EvaluateBody body
    ) {
        SdkScope scope = authenticate(auth);
        EvaluationResult r = replicas.evaluate(scope.projectId(), scope.environmentId(), name,
                        body == null ? null : body.context())
                .orElseThrow(() -> new NotFoundException("Config not found: " + name));
        return new ValueResponse(name, r.value(), r.matchedOverride());
    }

    @PostMapping("/replication/stream")
    public SseEmitter stream(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
            @RequestBody(required = false) StartRequest body
    ) {
        SdkScope scope = authenticate(auth);
        // lifetime is enforced by the stream itself
        SseStreamSink sink = new SseStreamSink(new SseEmitter(0L));
        streams.open(scope, sink, body);
        return sink.emitter();
    }

    private SdkScope authenticate(String authorization) {
        String token = SdkKeys.bearerToken(authorization);
        if (token == null) {
            throw new UnauthorizedException("Missing SDK key");
        }
        return directory.resolveSdkKey(token)
                .orElseThrow(() -> new UnauthorizedException("Invalid SDK key"));
    }
}
