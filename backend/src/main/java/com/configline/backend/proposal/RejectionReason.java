package com.configline.backend.proposal;

import java.util.Locale;

public enum RejectionReason {
    ANOTHER_PROPOSAL_APPROVED,
    REJECTED_EXPLICITLY,
    CONFIG_EDITED,
    CONFIG_DELETED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
