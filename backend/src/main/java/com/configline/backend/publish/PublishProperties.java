package com.configline.backend.publish;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Optional mirroring of project exports to S3 after every committed change. */
@ConfigurationProperties(prefix = "configline.publish")
public class PublishProperties {

    private boolean enabled = false;
    private String bucket;
    /** Object key prefix; the key is {@code <prefix><projectId>.json}. */
    private String prefix = "configs/";
    private String region = "us-east-2";

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getBucket() { return bucket; }
    public void setBucket(String bucket) { this.bucket = bucket; }

    public String getPrefix() { return prefix; }
    public void setPrefix(String prefix) { this.prefix = prefix; }

    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }
}
