package com.axlabs.neo.yieldshares;

/**
 * The distinguishable causes a contract invocation can abort with.
 */
public enum ErrorCode {

    // governance process
    PROPOSAL_NOT_FOUND,
    PROPOSAL_NOT_ACTIVE,
    PROPOSAL_ALREADY_EXECUTED,
    INSUFFICIENT_VOTING_POWER,
    ALREADY_VOTED,
    INVALID_SUPPORT,
    THRESHOLD_NOT_MET,
    PARAMETER_OUT_OF_BOUNDS,
    VOTING_NOT_ENDED,
    DISTRIBUTION_ABORTED,

    // access and runtime
    UNAUTHORIZED,
    CONTRACT_PAUSED,
    REENTRANT_CALL,
    INVALID_ARGUMENT,

    // ledger and transfers
    TRANSFER_RESTRICTED,
    TRANSFER_FAILED,
    INSUFFICIENT_BALANCE,
    MAX_SHAREHOLDERS_EXCEEDED,
    POOLED_CAPITAL_MISMATCH,

    // collaborators
    AGREEMENT_NOT_FOUND,
    ALREADY_WHITELISTED,
    NOT_WHITELISTED
}
