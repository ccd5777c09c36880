package com.configline.backend.replication;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "configline.replication")
public class ReplicationProperties {

    /**
     * Records buffered per subscriber. A subscriber that falls this far behind is disconnected
     * and resynchronizes with a fresh snapshot on reconnect.
     */
    private int queueCapacity = 256;

    /** Idle interval after which a comment line is written to keep proxies from closing the stream. */
    private Duration heartbeatInterval = Duration.ofSeconds(15);

    /** Streams are closed by the server after this long; clients reconnect. */
    private Duration maxLifetime = Duration.ofMinutes(30);

    public int getQueueCapacity() { return queueCapacity; }
    public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }

    public Duration getMaxLifetime() { return maxLifetime; }
    public void setMaxLifetime(Duration maxLifetime) { this.maxLifetime = maxLifetime; }
}
