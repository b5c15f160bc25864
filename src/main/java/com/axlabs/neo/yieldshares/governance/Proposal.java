package com.axlabs.neo.yieldshares.governance;

import com.axlabs.neo.yieldshares.runtime.Struct;

/**
 * The base struct of a proposal created and stored when a user creates a proposal.
 * <p>
 * The data that doesn't change after creation is kept in {@link ProposalData} and the tallies in
 * {@link ProposalVotes}.
 */
public class Proposal implements Struct {

    /**
     * The proposal's ID. IDs are assigned incrementally, starting at 1.
     */
    public int id;

    /**
     * The start of the voting window.
     */
    public long votingStart;

    /**
     * The end of the voting window. Votes are accepted up to and including this time.
     */
    public long votingEnd;

    /**
     * Tells if this proposal was already executed. Never changes back to false once set.
     */
    public boolean executed;

    /**
     * Tells if an evaluation of this proposal defeated it. Informational only. It does not prevent a new evaluation
     * and stays set if a later evaluation executes the proposal.
     */
    public boolean defeated;

    /**
     * The quorum result of the last evaluation.
     */
    public boolean quorumReached;

    public Proposal(int id, long votingStart, long votingEnd) {
        this.id = id;
        this.votingStart = votingStart;
        this.votingEnd = votingEnd;
        executed = false;
        defeated = false;
        quorumReached = false;
    }

    @Override
    public Proposal copy() {
        Proposal p = new Proposal(id, votingStart, votingEnd);
        p.executed = executed;
        p.defeated = defeated;
        p.quorumReached = quorumReached;
        return p;
    }
}
