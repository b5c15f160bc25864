package com.axlabs.neo.yieldshares.governance;

import com.axlabs.neo.yieldshares.runtime.Struct;
import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * Proposal information that is set at the time of creation of a proposal and doesn't change after that.
 * This data was separated from {@link Proposal} so that updating a proposal doesn't rewrite it.
 */
public class ProposalData implements Struct {

    /**
     * The creator of the proposal.
     */
    public Hash160 proposer;

    /**
     * The agreement the proposal targets. For governance parameter updates this holds the parameter id instead.
     */
    public int agreementId;

    public ProposalType type;

    /**
     * The raw or packed target value, see {@link ParameterCodec}.
     */
    public BigInteger targetValue;

    public String description;

    /**
     * The time of creation. Voting power is read at this time when snapshot voting is enabled.
     */
    public long createdAt;

    public ProposalData(Hash160 proposer, int agreementId, ProposalType type, BigInteger targetValue,
            String description, long createdAt) {
        this.proposer = proposer;
        this.agreementId = agreementId;
        this.type = type;
        this.targetValue = targetValue;
        this.description = description;
        this.createdAt = createdAt;
    }

    @Override
    public ProposalData copy() {
        return new ProposalData(proposer, agreementId, type, targetValue, description, createdAt);
    }
}
