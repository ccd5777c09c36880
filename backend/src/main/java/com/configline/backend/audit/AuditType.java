package com.configline.backend.audit;

import java.util.Locale;

public enum AuditType {
    CONFIG_CREATED,
    CONFIG_UPDATED,
    CONFIG_DELETED,
    CONFIG_MEMBERS_CHANGED,
    CONFIG_VARIANT_CREATED,
    CONFIG_VARIANT_UPDATED,
    CONFIG_PROPOSAL_CREATED,
    CONFIG_PROPOSAL_APPROVED,
    CONFIG_PROPOSAL_REJECTED,
    CONFIG_VARIANT_PROPOSAL_CREATED,
    CONFIG_VARIANT_PROPOSAL_APPROVED,
    CONFIG_VARIANT_PROPOSAL_REJECTED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
