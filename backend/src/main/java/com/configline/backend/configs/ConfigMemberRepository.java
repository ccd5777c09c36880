package com.configline.backend.configs;

import org.springframework.data.jpa.repository.*;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ConfigMemberRepository extends JpaRepository<ConfigMemberEntity, UUID> {

    List<ConfigMemberEntity> findByConfig_IdOrderByEmailAsc(UUID configId);

    Optional<ConfigMemberEntity> findByConfig_IdAndEmail(UUID configId, String email);

    @Modifying(flushAutomatically = true)
    @Query("delete from ConfigMemberEntity m where m.config.id = :configId")
    int deleteByConfigId(@Param("configId") UUID configId);
}
