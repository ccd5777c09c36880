package com.configline.backend.publish;

/** Where published project snapshots end up. One object per project, overwritten on every publish. */
public interface SnapshotStore {

    StoredSnapshot put(SnapshotLocation location, byte[] json);

    record SnapshotLocation(String bucket, String key, String projectId) {}

    record StoredSnapshot(SnapshotLocation location, String etag, long bytes) {}
}
