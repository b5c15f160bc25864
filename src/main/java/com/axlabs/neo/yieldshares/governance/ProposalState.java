package com.axlabs.neo.yieldshares.governance;

/**
 * The state of a proposal as derived from its voting window, its tallies and its execution flag.
 */
public enum ProposalState {

    /**
     * The voting window has not started yet.
     */
    PENDING,

    /**
     * Votes can be cast.
     */
    ACTIVE,

    /**
     * Voting ended with quorum and majority. The proposal can be executed.
     */
    SUCCEEDED,

    /**
     * Voting ended without quorum or without majority.
     */
    DEFEATED,

    EXECUTED
}
