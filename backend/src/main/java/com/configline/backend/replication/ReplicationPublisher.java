package com.configline.backend.replication;

import com.configline.backend.configs.ConfigChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/** Fans committed changes out to subscribers. Never runs for rolled-back writes. */
@Component
public class ReplicationPublisher {
    private static final Logger log = LoggerFactory.getLogger(ReplicationPublisher.class);

    private final ConfigReplicaService replicas;
    private final ReplicationStreamManager streams;

    public ReplicationPublisher(ConfigReplicaService replicas, ReplicationStreamManager streams) {
        this.replicas = replicas;
        this.streams = streams;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onConfigChanged(ConfigChangedEvent e) {
        replicas.invalidate(e.projectId());
        try {
            streams.publishChange(e.projectId(), e.configId(), e.configName(), e.deleted());
        } catch (RuntimeException ex) {
            // the write is committed; subscribers catch up on their next snapshot
            log.error("Replicating change of config {} failed: {}", e.configId(), ex.getMessage(), ex);
        }
    }
}
