package com.configline.backend.proposal;

import com.configline.backend.audit.AuditRecord;
import com.configline.backend.audit.AuditSink;
import com.configline.backend.audit.AuditType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Rejects pending proposals made stale by a committed write. Runs in the writer's transaction
 * and records one audit entry per rejected proposal.
 */
@Component
@Transactional(propagation = Propagation.MANDATORY)
public class ProposalCascade {
    private static final Logger log = LoggerFactory.getLogger(ProposalCascade.class);

    private final ConfigProposalRepository configProposals;
    private final ConfigVariantProposalRepository variantProposals;
    private final AuditSink audit;
    private final ObjectMapper om;
    private final Clock clock;

    public ProposalCascade(
            ConfigProposalRepository configProposals,
            ConfigVariantProposalRepository variantProposals,
            AuditSink audit,
            ObjectMapper om,
            Clock clock
    ) {
        this.configProposals = configProposals;
        this.variantProposals = variantProposals;
        this.audit = audit;
        this.om = om;
        this.clock = clock;
    }

    public int rejectConfigProposals(String projectId, UUID configId, RejectionReason reason,
                                     UUID inFavorOf, String actorId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int n = 0;
        for (UUID id : configProposals.findPendingIds(configId)) {
            if (id.equals(inFavorOf)) continue;
            if (configProposals.markRejected(id, reason, inFavorOf, actorId, now) == 1) {
                audit.append(new AuditRecord(AuditType.CONFIG_PROPOSAL_REJECTED, actorId, projectId, configId,
                        payload(id, reason, inFavorOf)));
                n++;
            }
        }
        if (n > 0) log.info("rejected {} config proposal(s) of {} ({})", n, configId, reason.wireName());
        return n;
    }

    public int rejectVariantProposals(String projectId, UUID configId, UUID variantId, RejectionReason reason,
                                      UUID inFavorOf, String actorId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int n = 0;
        for (UUID id : variantProposals.findPendingIdsByVariant(variantId)) {
            if (id.equals(inFavorOf)) continue;
            if (variantProposals.markRejected(id, reason, inFavorOf, actorId, now) == 1) {
                audit.append(new AuditRecord(AuditType.CONFIG_VARIANT_PROPOSAL_REJECTED, actorId, projectId, configId,
                        payload(id, reason, inFavorOf)));
                n++;
            }
        }
        if (n > 0) log.info("rejected {} variant proposal(s) of {} ({})", n, variantId, reason.wireName());
        return n;
    }

    /** Every pending variant proposal of the config, whichever environment it targets. */
    public int rejectAllVariantProposals(String projectId, UUID configId, RejectionReason reason, String actorId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int n = 0;
        for (UUID id : variantProposals.findPendingIdsByConfig(configId)) {
            if (variantProposals.markRejected(id, reason, null, actorId, now) == 1) {
                audit.append(new AuditRecord(AuditType.CONFIG_VARIANT_PROPOSAL_REJECTED, actorId, projectId, configId,
                        payload(id, reason, null)));
                n++;
            }
        }
        return n;
    }

    private ObjectNode payload(UUID proposalId, RejectionReason reason, UUID inFavorOf) {
        ObjectNode p = om.createObjectNode();
        p.put("proposalId", proposalId.toString());
        p.put("rejectionReason", reason.wireName());
        if (inFavorOf != null) p.put("rejectedInFavorOfProposalId", inFavorOf.toString());
        else p.putNull("rejectedInFavorOfProposalId");
        return p;
    }
}
