package com.configline.backend.audit;

/**
 * Receives audit records inside the writer's transaction; a failing sink rolls the mutation back.
 */
public interface AuditSink {

    void append(AuditRecord record);
}
