package com.configline.backend.configs;

import org.springframework.data.jpa.repository.*;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ConfigVariantVersionRepository extends JpaRepository<ConfigVariantVersionEntity, UUID> {

    List<ConfigVariantVersionEntity> findByVariantIdOrderByVersionDesc(UUID variantId);

    Optional<ConfigVariantVersionEntity> findByVariantIdAndVersion(UUID variantId, int version);

    @Modifying(flushAutomatically = true)
    @Query("delete from ConfigVariantVersionEntity v where v.configId = :configId")
    int deleteByConfigId(@Param("configId") UUID configId);
}
