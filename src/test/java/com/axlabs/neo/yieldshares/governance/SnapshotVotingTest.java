package com.axlabs.neo.yieldshares.governance;

import com.axlabs.neo.yieldshares.Config;
import com.axlabs.neo.yieldshares.ContractException;
import com.axlabs.neo.yieldshares.ErrorCode;
import com.axlabs.neo.yieldshares.YieldSharesPlatform;
import com.axlabs.neo.yieldshares.ledger.YieldSharesToken;
import com.axlabs.neo.yieldshares.runtime.Runtime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.axlabs.neo.yieldshares.util.TestHelper.ALICE;
import static com.axlabs.neo.yieldshares.util.TestHelper.BOB;
import static com.axlabs.neo.yieldshares.util.TestHelper.EVE;
import static com.axlabs.neo.yieldshares.util.TestHelper.OWNER;
import static com.axlabs.neo.yieldshares.util.TestHelper.big;
import static com.axlabs.neo.yieldshares.util.TestHelper.endVoting;
import static com.axlabs.neo.yieldshares.util.TestHelper.mintShares;
import static com.axlabs.neo.yieldshares.util.TestHelper.newRuntime;
import static com.axlabs.neo.yieldshares.util.TestHelper.startVoting;
import static com.axlabs.neo.yieldshares.util.TestHelper.vote;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SnapshotVotingTest {

    private Runtime runtime;
    private YieldSharesPlatform platform;
    private YieldSharesGov gov;
    private YieldSharesToken token;
    private int agreementId;
    private int proposalId;

    @BeforeEach
    public void setUp() {
        Config.setProfile("snapshot");
        runtime = newRuntime();
        platform = YieldSharesPlatform.deploy(runtime, OWNER);
        gov = platform.getGovernance();
        agreementId = platform.createAgreement(big(100_000), 500, 24);
        token = platform.getSharesToken(agreementId);
        mintShares(platform, agreementId, ALICE, 6_000);
        mintShares(platform, agreementId, BOB, 3_000);
        mintShares(platform, agreementId, EVE, 1_000);
        proposalId = runtime.send(ALICE,
                () -> gov.createProposal(agreementId, ProposalPayload.roiAdjustment(700), ""));
        runtime.fastForward(1);
    }

    @AfterEach
    public void tearDown() {
        Config.setProfile(null);
    }

    @Test
    public void weigh_votes_with_balances_at_proposal_creation() {
        assertThat(gov.isVotingPowerSnapshots(), is(true));
        runtime.send(ALICE, () -> token.transfer(ALICE, EVE, big(5_000)));
        startVoting(runtime);

        vote(runtime, gov, proposalId, EVE, 0);
        vote(runtime, gov, proposalId, ALICE, 1);

        ProposalDTO p = gov.getProposal(proposalId);
        assertThat(p.againstVotes, is(big(1_000)));
        assertThat(p.forVotes, is(big(6_000)));
        // Live power is still reported as such.
        assertThat(gov.getVotingPower(EVE, agreementId), is(big(6_000)));
    }

    @Test
    public void fail_voting_with_shares_acquired_after_creation() {
        mintShares(platform, agreementId, OWNER, 50_000);
        startVoting(runtime);

        ContractException e = assertThrows(ContractException.class,
                () -> vote(runtime, gov, proposalId, OWNER, 1));
        assertThat(e.getCode(), is(ErrorCode.INSUFFICIENT_VOTING_POWER));
    }

    @Test
    public void keep_quorum_at_supply_of_proposal_creation() {
        mintShares(platform, agreementId, OWNER, 90_000);
        assertThat(gov.getQuorumRequired(proposalId), is(big(1_000)));

        startVoting(runtime);
        vote(runtime, gov, proposalId, EVE, 1);
        endVoting(runtime);

        assertThat(runtime.send(ALICE, () -> gov.executeProposal(proposalId)), is(true));
    }
}
