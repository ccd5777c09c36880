package com.configline.backend.proposal;

import org.springframework.data.jpa.repository.*;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public interface ConfigProposalRepository extends JpaRepository<ConfigProposalEntity, UUID> {

    List<ConfigProposalEntity> findByConfigIdOrderByCreatedAtDesc(UUID configId);

    @Query("""
        select p.id from ConfigProposalEntity p
        where p.configId = :configId
          and p.approvedAt is null
          and p.rejectedAt is null
        order by p.createdAt asc
    """)
    List<UUID> findPendingIds(@Param("configId") UUID configId);

    /** Terminal transitions only apply to a pending row; 0 means someone else got there first. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update ConfigProposalEntity p
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
        update ConfigProposalEntity p
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
