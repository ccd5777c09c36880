package com.configline.backend.project;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface SdkKeyRepository extends JpaRepository<SdkKeyEntity, UUID> {

    Optional<SdkKeyEntity> findByKeyHash(String keyHash);
}
