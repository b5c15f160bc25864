package com.axlabs.neo.yieldshares.governance;

import com.axlabs.neo.yieldshares.runtime.Struct;

import java.math.BigInteger;

/**
 * The struct holding the vote tallies of a proposal. Who voted is recorded separately, how someone voted only in
 * the {@code Voted} event.
 */
public class ProposalVotes implements Struct {

    public BigInteger forVotes;
    public BigInteger againstVotes;
    public BigInteger abstainVotes;

    public ProposalVotes() {
        forVotes = BigInteger.ZERO;
        againstVotes = BigInteger.ZERO;
        abstainVotes = BigInteger.ZERO;
    }

    public BigInteger total() {
        return forVotes.add(againstVotes).add(abstainVotes);
    }

    @Override
    public ProposalVotes copy() {
        ProposalVotes v = new ProposalVotes();
        v.forVotes = forVotes;
        v.againstVotes = againstVotes;
        v.abstainVotes = abstainVotes;
        return v;
    }
}
