package com.axlabs.neo.yieldshares.governance;

import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * Used to return all proposal information as one structure in getter methods.
 */
public class ProposalDTO {

    public int id;
    public Hash160 proposer;
    public int agreementId;
    public ProposalType type;
    public BigInteger targetValue;
    public String description;
    public long createdAt;
    public long votingStart;
    public long votingEnd;
    public boolean executed;
    public boolean defeated;
    public boolean quorumReached;
    public BigInteger forVotes;
    public BigInteger againstVotes;
    public BigInteger abstainVotes;
    public ProposalState state;

    public ProposalDTO() {
    }
}
