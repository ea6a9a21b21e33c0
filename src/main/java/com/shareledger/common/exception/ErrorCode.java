package com.shareledger.common.exception;

/**
 * Stable, numbered error codes exposed to callers.
 *
 * Numbers are part of the public contract. New codes are only ever appended.
 */
public enum ErrorCode {
    OWNER_ONLY(100, "OwnerOnly", ErrorCategory.AUTHORIZATION),
    NOT_FOUND(101, "NotFound", ErrorCategory.NOT_FOUND),
    ALREADY_LISTED(102, "AlreadyListed", ErrorCategory.STATE_CONFLICT),
    INVALID_AMOUNT(103, "InvalidAmount", ErrorCategory.INVALID_INPUT),
    NOT_AUTHORIZED(104, "NotAuthorized", ErrorCategory.AUTHORIZATION),
    KYC_REQUIRED(105, "KycRequired", ErrorCategory.AUTHORIZATION),
    VOTE_EXISTS(106, "VoteExists", ErrorCategory.STATE_CONFLICT),
    VOTE_ENDED(107, "VoteEnded", ErrorCategory.STATE_CONFLICT),
    PRICE_EXPIRED(108, "PriceExpired", ErrorCategory.STALE_DATA),
    INVALID_URI(109, "InvalidURI", ErrorCategory.INVALID_INPUT),
    INVALID_VALUE(110, "InvalidValue", ErrorCategory.INVALID_INPUT),
    INVALID_DURATION(111, "InvalidDuration", ErrorCategory.INVALID_INPUT),
    INVALID_KYC_LEVEL(112, "InvalidKycLevel", ErrorCategory.INVALID_INPUT),
    INVALID_EXPIRY(113, "InvalidExpiry", ErrorCategory.INVALID_INPUT),
    INVALID_VOTES(114, "InvalidVotes", ErrorCategory.INVALID_INPUT),
    INVALID_ADDRESS(115, "InvalidAddress", ErrorCategory.INVALID_INPUT),
    INVALID_TITLE(116, "InvalidTitle", ErrorCategory.INVALID_INPUT),
    ALREADY_EXECUTED(117, "AlreadyExecuted", ErrorCategory.STATE_CONFLICT),
    PROPOSAL_OPEN(118, "ProposalOpen", ErrorCategory.STATE_CONFLICT);

    private final int number;
    private final String label;
    private final ErrorCategory category;

    ErrorCode(int number, String label, ErrorCategory category) {
        this.number = number;
        this.label = label;
        this.category = category;
    }

    public int getNumber() {
        return number;
    }

    public String getLabel() {
        return label;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
