package com.configline.backend.publish;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class S3SnapshotStoreTest {

    @Test
    void request_isUncachedJsonTaggedWithProject() {
        var request = S3SnapshotStore.request(new SnapshotStore.SnapshotLocation("configline", "configs/p1.json", "p1"));

        assertEquals("configline", request.bucket());
        assertEquals("configs/p1.json", request.key());
        assertEquals("application/json", request.contentType());
        assertEquals("no-cache", request.cacheControl());
        assertEquals("p1", request.metadata().get(S3SnapshotStore.PROJECT_METADATA));
    }
}
