package com.configline.backend.proposal;

import org.springframework.data.jpa.repository.*;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public interface ConfigVariantProposalRepository extends JpaRepository<ConfigVariantProposalEntity, UUID> {

    List<ConfigVariantProposalEntity> findByConfigVariantIdOrderByCreatedAtDesc(UUID configVariantId);

    @Query("""
        select p.id from ConfigVariantProposalEntity p
        where p.configVariantId = :variantId
          and p.approvedAt is null
          and p.rejectedAt is null
        order by p.createdAt asc
    """)
    List<UUID> findPendingIdsByVariant(@Param("variantId") UUID variantId);

    @Query("""
        select p.id from ConfigVariantProposalEntity p
        where p.configId = :configId
          and p.approvedAt is null
          and p.rejectedAt is null
        order by p.createdAt asc
    """)
    List<UUID> findPendingIdsByConfig(@Param("configId") UUID configId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update ConfigVariantProposalEntity p
        set p.approvedAt = :now, p.reviewerId = :reviewerId
        where p.id = :id
          and p.approvedAt is null
          and p.rejectedAt is null
    """)
    int markApproved(@Param("id") UUID id,
                     @Param("reviewerId") String reviewerId,
                     @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update ConfigVariantProposalEntity p
        set p.rejectedAt = :now,
            p.reviewerId = :reviewerId,
            p.rejectionReason = :reason,
            p.rejectedInFavorOfProposalId = :inFavorOf
        where p.id = :id
          and p.approvedAt is null
          and p.rejectedAt is null
    """)
    int markRejected(@Param("id") UUID id,
                     @Param("reason") RejectionReason reason,
                     @Param("inFavorOf") UUID inFavorOf,
                     @Param("reviewerId") String reviewerId,
                     @Param("now") OffsetDateTime now);
}
