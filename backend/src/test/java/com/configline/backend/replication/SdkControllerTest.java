package com.configline.backend.replication;

import com.configline.backend.TestProjects;
import com.configline.backend.configs.ConfigDtos.CreateConfigRequest;
import com.configline.backend.configs.ConfigService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
public class SdkControllerTest {

    @Autowired MockMvc mvc;
    @Autowired ConfigService configs;
    @Autowired TestProjects projects;
    @Autowired ObjectMapper om;

    @Test
    void configs_requiresValidSdkKey() throws Exception {
        mvc.perform(get("/api/sdk/v1/configs"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
        mvc.perform(get("/api/sdk/v1/configs").header("Authorization", "Bearer not-a-key"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void configs_returnsSnapshotOfKeyEnvironment() throws Exception {
        var p = projects.create(false, false);
        configs.create(p.projectId(), TestProjects.EDITOR,
                new CreateConfigRequest("flags", null, IntNode.valueOf(7), null, null, null, null, null));

        mvc.perform(get("/api/sdk/v1/configs").header("Authorization", "Bearer " + p.sdkKey()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.configs[0].name").value("flags"))
                .andExpect(jsonPath("$.configs[0].value").value(7))
                .andExpect(jsonPath("$.configs[0].version").value(1));
    }

    @Test
    void value_evaluatesServerSide_and404sForUnknownConfig() throws Exception {
        var p = projects.create(false, false);
        var overrides = om.readTree("""
                [{"name":"us","conditions":[{"operator":"in","property":"country","value":{"type":"literal","value":["US"]}}],"value":1}]
                """);
        configs.create(p.projectId(), TestProjects.EDITOR,
                new CreateConfigRequest("region", null, IntNode.valueOf(0), null, overrides, null, null, null));

        mvc.perform(post("/api/sdk/v1/configs/region/value")
                        .header("Authorization", "Bearer " + p.sdkKey())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"context\":{\"country\":\"US\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value").value(1))
                .andExpect(jsonPath("$.matchedOverride").value("us"));

        mvc.perform(post("/api/sdk/v1/configs/missing/value")
                        .header("Authorization", "Bearer " + p.sdkKey())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound());
    }
}
