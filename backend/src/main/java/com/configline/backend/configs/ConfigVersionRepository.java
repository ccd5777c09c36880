package com.configline.backend.configs;

import org.springframework.data.jpa.repository.*;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ConfigVersionRepository extends JpaRepository<ConfigVersionEntity, UUID> {

    List<ConfigVersionEntity> findByConfigIdOrderByVersionDesc(UUID configId);

    Optional<ConfigVersionEntity> findByConfigIdAndVersion(UUID configId, int version);

    @Modifying(flushAutomatically = true)
    @Query("delete from ConfigVersionEntity v where v.configId = :configId")
    int deleteByConfigId(@Param("configId") UUID configId);
}
