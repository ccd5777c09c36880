package com.configline.backend.publish;

import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

import java.util.Map;

/**
 * Stores snapshots as S3 objects. SDKs poll these objects, so they are served uncached and tagged
 * with the project they belong to.
 */
public class S3SnapshotStore implements SnapshotStore {
    static final String PROJECT_METADATA = "configline-project";

    private final S3Client s3;

    public S3SnapshotStore(S3Client s3) {
        this.s3 = s3;
    }

    @Override
    public StoredSnapshot put(SnapshotLocation location, byte[] json) {
        PutObjectResponse resp = s3.putObject(request(location), RequestBody.fromBytes(json));
        return new StoredSnapshot(location, resp.eTag(), json.length);
    }

    static PutObjectRequest request(SnapshotLocation location) {
        return PutObjectRequest.builder()
                .bucket(location.bucket())
                .key(location.key())
                .contentType("application/json")
                .cacheControl("no-cache")
                .metadata(Map.of(PROJECT_METADATA, location.projectId()))
                .build();
    }
}
