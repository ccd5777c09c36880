package com.configline.backend.config;

import com.configline.backend.publish.ProjectExportService;
import com.configline.backend.publish.PublishProperties;
import com.configline.backend.publish.S3SnapshotStore;
import com.configline.backend.publish.SnapshotPublishService;
import com.configline.backend.publish.SnapshotPublisher;
import com.configline.backend.publish.SnapshotStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/** S3 snapshot publishing. Nothing here is created unless {@code configline.publish.enabled=true}. */
@Configuration
@ConditionalOnProperty(prefix = "configline.publish", name = "enabled", havingValue = "true")
public class AwsConfig {

    @Bean
    public S3Client s3Client(PublishProperties props) {
        // default credentials chain: instance role in prod, ~/.aws/credentials in dev
        return S3Client.builder()
                .region(Region.of(props.getRegion()))
                .build();
    }

    @Bean
    public SnapshotStore snapshotStore(S3Client s3) {
        return new S3SnapshotStore(s3);
    }

    @Bean
    public SnapshotPublishService snapshotPublishService(SnapshotStore store, PublishProperties props, ObjectMapper om) {
        if (props.getBucket() == null || props.getBucket().isBlank()) {
            throw new IllegalStateException("configline.publish.bucket is required when publishing is enabled");
        }
        return new SnapshotPublishService(store, props.getBucket(), props.getPrefix(), om);
    }

    @Bean
    public SnapshotPublisher snapshotPublisher(ProjectExportService exports, SnapshotPublishService publish) {
        return new SnapshotPublisher(exports, publish);
    }
}
