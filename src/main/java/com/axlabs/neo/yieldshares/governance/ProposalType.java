package com.axlabs.neo.yieldshares.governance;

/**
 * The kinds of changes a proposal can make.
 */
public enum ProposalType {

    ROI_ADJUSTMENT,
    RESERVE_ALLOCATION,
    RESERVE_WITHDRAWAL,
    GOVERNANCE_PARAMETER_UPDATE,
    AGREEMENT_PARAMETER_UPDATE,
    TRANSFER_RESTRICTION_UPDATE,
    KYC_WHITELIST_UPDATE
}
