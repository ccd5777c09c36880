package com.configline.backend.error;

public enum ErrorCode {
    NOT_FOUND,
    DUPLICATE_NAME,
    VERSION_CONFLICT,
    VERSION_MISMATCH,
    UNAUTHORIZED,
    FORBIDDEN,
    INSUFFICIENT_ROLE,
    SELF_APPROVAL_FORBIDDEN,
    BAD_REQUEST,
    PROPOSAL_NOT_FOUND,
    PROPOSAL_ALREADY_APPROVED,
    PROPOSAL_ALREADY_REJECTED,
    PROPOSALS_REQUIRED,
    INVALID_REFERENCE,
    INVALID_OVERRIDES,
    SCHEMA_VIOLATION,
    DUPLICATE_MEMBER
}
