package com.axlabs.neo.yieldshares.governance;

/**
 * The process-wide governance parameters.
 */
public class GovernanceParameters {

    /**
     * Seconds between the creation of a proposal and the start of its voting window.
     */
    public long votingDelay;

    /**
     * Length of the voting window in seconds.
     */
    public long votingPeriod;

    /**
     * The share of the total supply that has to vote for a proposal to be valid, in basis points.
     */
    public int quorumPercentageBP;

    /**
     * The share of the total supply a proposer has to hold, in basis points.
     */
    public int proposalThresholdBP;

    public GovernanceParameters(long votingDelay, long votingPeriod, int quorumPercentageBP,
            int proposalThresholdBP) {
        this.votingDelay = votingDelay;
        this.votingPeriod = votingPeriod;
        this.quorumPercentageBP = quorumPercentageBP;
        this.proposalThresholdBP = proposalThresholdBP;
    }

    public long get(GovernanceParameter parameter) {
        switch (parameter) {
            case VOTING_DELAY:
                return votingDelay;
            case VOTING_PERIOD:
                return votingPeriod;
            case QUORUM_BP:
                return quorumPercentageBP;
            default:
                return proposalThresholdBP;
        }
    }
}
