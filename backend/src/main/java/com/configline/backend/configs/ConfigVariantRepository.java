package com.configline.backend.configs;

import org.springframework.data.jpa.repository.*;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ConfigVariantRepository extends JpaRepository<ConfigVariantEntity, UUID> {

    List<ConfigVariantEntity> findByConfig_IdOrderByEnvironmentIdAsc(UUID configId);

    Optional<ConfigVariantEntity> findByConfig_IdAndEnvironmentId(UUID configId, String environmentId);

    List<ConfigVariantEntity> findByConfig_ProjectIdAndEnvironmentId(String projectId, String environmentId);

    boolean existsByConfig_IdAndEnvironmentId(UUID configId, String environmentId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update ConfigVariantEntity v
        set v.version = v.version + 1, v.updatedAt = :now
        where v.id = :id
          and v.version = :expectedVersion
    """)
    int advanceVersion(@Param("id") UUID id,
                       @Param("expectedVersion") int expectedVersion,
                       @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true)
    @Query("delete from ConfigVariantEntity v where v.config.id = :configId")
    int deleteByConfigId(@Param("configId") UUID configId);
}
