package com.configline.backend.publish;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SnapshotPublishServiceTest {

    @Test
    void publish_writesExportUnderProjectKey() throws Exception {
        ObjectMapper om = new ObjectMapper();
        FakeStore fake = new FakeStore();
        var svc = new SnapshotPublishService(fake, "configline", "configs/", om);

        var export = new ProjectExport("p1", List.of(new ProjectExport.ExportedConfig(
                "flags", "d", IntNode.valueOf(1), null, om.createArrayNode(), Map.of())));
        var out = svc.publish(export);

        assertEquals("configline", out.location().bucket());
        assertEquals("configs/p1.json", out.location().key());
        assertEquals("p1", out.location().projectId());
        assertTrue(out.bytes() > 0);
        assertEquals("flags", om.readTree(fake.lastJson).get("configs").get(0).get("name").asText());
    }

    @Test
    void publish_rejectsExportWithoutProject() {
        var svc = new SnapshotPublishService(new FakeStore(), "configline", "configs/", new ObjectMapper());

        assertThrows(IllegalArgumentException.class, () -> svc.publish(new ProjectExport(" ", List.of())));
    }

    static class FakeStore implements SnapshotStore {
        byte[] lastJson;

        @Override
        public StoredSnapshot put(SnapshotLocation location, byte[] json) {
            lastJson = json;
            return new StoredSnapshot(location, "\"etag\"", json.length);
        }
    }
}
