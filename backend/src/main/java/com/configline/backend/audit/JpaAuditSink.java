package com.configline.backend.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

@Component
public class JpaAuditSink implements AuditSink {
    private static final Logger log = LoggerFactory.getLogger(JpaAuditSink.class);

    private final AuditLogRepository repo;
    private final Clock clock;

    public JpaAuditSink(AuditLogRepository repo, Clock clock) {
        this.repo = repo;
        this.clock = clock;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void append(AuditRecord record) {
        AuditLogEntity e = new AuditLogEntity();
        e.setId(UUID.randomUUID());
        e.setType(record.type().wireName());
        e.setActorId(record.actorId());
        e.setProjectId(record.projectId());
        e.setConfigId(record.configId());
        e.setPayload(record.payload());
        e.setCreatedAt(OffsetDateTime.now(clock));
        repo.save(e);
        log.debug("audit {} project={} config={} actor={}", e.getType(), e.getProjectId(), e.getConfigId(), e.getActorId());
    }
}
