package com.configline.backend.proposal;

public enum ProposalStatus {
    PENDING,   // waiting for a reviewer
    APPROVED,  // applied to the config; terminal
    REJECTED   // explicitly, or cascaded by another write; terminal
}
