package com.configline.backend.configs;

import org.springframework.data.jpa.repository.*;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ConfigRepository extends JpaRepository<ConfigEntity, UUID> {

    Optional<ConfigEntity> findByProjectIdAndName(String projectId, String name);

    boolean existsByProjectIdAndName(String projectId, String name);

    List<ConfigEntity> findByProjectIdOrderByNameAsc(String projectId);

    /** Compare-and-swap on the version column; 1 when this caller won, 0 otherwise. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update ConfigEntity c
        set c.version = c.version + 1, c.updatedAt = :now
        where c.id = :id
          and c.version = :expectedVersion
    """)
    int advanceVersion(@Param("id") UUID id,
                       @Param("expectedVersion") int expectedVersion,
                       @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        delete from ConfigEntity c
        where c.id = :id
          and c.version = :expectedVersion
    """)
    int deleteIfVersion(@Param("id") UUID id, @Param("expectedVersion") int expectedVersion);
}
