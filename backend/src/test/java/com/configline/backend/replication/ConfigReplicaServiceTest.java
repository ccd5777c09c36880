package com.configline.backend.replication;

import com.configline.backend.TestProjects;
import com.configline.backend.configs.ConfigDtos.CreateConfigRequest;
import com.configline.backend.configs.ConfigDtos.CreateVariantRequest;
import com.configline.backend.configs.ConfigDtos.PatchConfigRequest;
import com.configline.backend.configs.ConfigService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
public class ConfigReplicaServiceTest {

    @Autowired ConfigReplicaService replicas;
    @Autowired ConfigService configs;
    @Autowired TestProjects projects;
    @Autowired ObjectMapper om;

    @Test
    void snapshot_rendersReferencesAndPrefersEnvironmentVariant() throws Exception {
        var p = projects.create(false, false);
        configs.create(p.projectId(), TestProjects.EDITOR,
                new CreateConfigRequest("limits", null, om.readTree("{\"max\":10}"), null, null, null, null, null));
        var overrides = om.readTree("""
                [{"name":"big","conditions":[{"operator":"greater_than","property":"size",
                  "value":{"type":"reference","projectId":"%s","configName":"limits","path":["max"]}}],"value":"big"}]
                """.formatted(p.projectId()));
        configs.create(p.projectId(), TestProjects.EDITOR, new CreateConfigRequest("size", null, TextNode.valueOf("small"),
                null, overrides, null, null,
                List.of(new CreateVariantRequest(p.stagingEnv(), TextNode.valueOf("tiny"), null, null, null))));

        var prod = replicas.snapshot(p.projectId(), p.prodEnv());
        assertEquals(List.of("limits", "size"), prod.stream().map(e -> e.config().name()).toList());
        var size = prod.get(1);
        assertEquals(ReplicaEntry.BASE, size.source());
        var operand = size.config().overrides().get(0).get("conditions").get(0).get("value");
        assertEquals("literal", operand.get("type").asText());
        assertEquals(10, operand.get("value").intValue());

        var staging = replicas.find(p.projectId(), p.stagingEnv(), "size").orElseThrow();
        assertEquals(TextNode.valueOf("tiny"), staging.config().value());
        assertTrue(!staging.source().equals(ReplicaEntry.BASE));
    }

    @Test
    void snapshot_reflectsCommittedChanges() throws Exception {
        var p = projects.create(false, false);
        configs.create(p.projectId(), TestProjects.EDITOR,
                new CreateConfigRequest("flags", null, IntNode.valueOf(1), null, null, null, null, null));
        assertEquals(1, replicas.snapshot(p.projectId(), p.prodEnv()).get(0).config().version());

        configs.patch(p.projectId(), "flags", TestProjects.EDITOR, new PatchConfigRequest(1, IntNode.valueOf(2), null, null, null, null));

        var after = replicas.snapshot(p.projectId(), p.prodEnv()).get(0).config();
        assertEquals(2, after.version());
        assertEquals(IntNode.valueOf(2), after.value());
    }

    @Test
    void evaluate_runsRenderedOverridesAgainstContext() throws Exception {
        var p = projects.create(false, false);
        var overrides = om.readTree("""
                [{"name":"pro","conditions":[{"operator":"equals","property":"plan","value":{"type":"literal","value":"pro"}}],"value":100}]
                """);
        configs.create(p.projectId(), TestProjects.EDITOR,
                new CreateConfigRequest("quota", null, IntNode.valueOf(10), null, overrides, null, null, null));

        var pro = replicas.evaluate(p.projectId(), p.prodEnv(), "quota", Map.of("plan", TextNode.valueOf("pro"))).orElseThrow();
        assertEquals(IntNode.valueOf(100), pro.value());
        var free = replicas.evaluate(p.projectId(), p.prodEnv(), "quota", Map.of()).orElseThrow();
        assertEquals(IntNode.valueOf(10), free.value());
    }
}
