package com.configline.backend.audit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AuditLogRepository extends JpaRepository<AuditLogEntity, UUID> {

    List<AuditLogEntity> findByConfigIdOrderByCreatedAtAsc(UUID configId);

    List<AuditLogEntity> findByProjectIdAndTypeOrderByCreatedAtAsc(String projectId, String type);
}
