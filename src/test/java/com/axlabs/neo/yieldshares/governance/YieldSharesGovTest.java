package com.axlabs.neo.yieldshares.governance;

import com.axlabs.neo.yieldshares.Config;
import com.axlabs.neo.yieldshares.ContractException;
import com.axlabs.neo.yieldshares.ErrorCode;
import com.axlabs.neo.yieldshares.YieldSharesPlatform;
import com.axlabs.neo.yieldshares.runtime.Notification;
import com.axlabs.neo.yieldshares.runtime.Runtime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.axlabs.neo.yieldshares.util.TestHelper.ALICE;
import static com.axlabs.neo.yieldshares.util.TestHelper.BOB;
import static com.axlabs.neo.yieldshares.util.TestHelper.CHARLIE;
import static com.axlabs.neo.yieldshares.util.TestHelper.DENISE;
import static com.axlabs.neo.yieldshares.util.TestHelper.EVE;
import static com.axlabs.neo.yieldshares.util.TestHelper.OWNER;
import static com.axlabs.neo.yieldshares.util.TestHelper.QUORUM_BP;
import static com.axlabs.neo.yieldshares.util.TestHelper.THRESHOLD_BP;
import static com.axlabs.neo.yieldshares.util.TestHelper.VOTING_DELAY;
import static com.axlabs.neo.yieldshares.util.TestHelper.VOTING_PERIOD;
import static com.axlabs.neo.yieldshares.util.TestHelper.assertLastEvent;
import static com.axlabs.neo.yieldshares.util.TestHelper.big;
import static com.axlabs.neo.yieldshares.util.TestHelper.endVoting;
import static com.axlabs.neo.yieldshares.util.TestHelper.mintShares;
import static com.axlabs.neo.yieldshares.util.TestHelper.newRuntime;
import static com.axlabs.neo.yieldshares.util.TestHelper.startVoting;
import static com.axlabs.neo.yieldshares.util.TestHelper.vote;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class YieldSharesGovTest {

    private Runtime runtime;
    private YieldSharesPlatform platform;
    private YieldSharesGov gov;
    private int agreementId;

    @BeforeEach
    public void setUp() {
        Config.setProfile(null);
        runtime = newRuntime();
        platform = YieldSharesPlatform.deploy(runtime, OWNER);
        gov = platform.getGovernance();
        agreementId = platform.createAgreement(big(100_000), 500, 24);
        mintShares(platform, agreementId, ALICE, 50_000);
        mintShares(platform, agreementId, BOB, 30_000);
        mintShares(platform, agreementId, CHARLIE, 10_000);
        mintShares(platform, agreementId, DENISE, 9_000);
        mintShares(platform, agreementId, EVE, 1_000);
    }

    private int propose(ProposalPayload payload) {
        return runtime.send(ALICE, () -> gov.createProposal(agreementId, payload, "description"));
    }

    @Test
    public void succeed_reading_configured_parameters() {
        GovernanceParameters params = gov.getGovernanceParameters();
        assertThat(params.votingDelay, is(VOTING_DELAY));
        assertThat(params.votingPeriod, is(VOTING_PERIOD));
        assertThat(params.quorumPercentageBP, is(QUORUM_BP));
        assertThat(params.proposalThresholdBP, is(THRESHOLD_BP));
        assertThat(gov.getOwner(), is(OWNER));
        assertThat(gov.isVotingPowerSnapshots(), is(false));
    }

    @Test
    public void fail_deploying_with_parameters_out_of_range() {
        GovernanceParameters params = new GovernanceParameters(60, VOTING_PERIOD, QUORUM_BP, THRESHOLD_BP);
        assertThrows(IllegalArgumentException.class, () -> new YieldSharesGov(runtime, "OtherGov", OWNER, params,
                false, platform.getPaymentToken(), platform.getAgreementRegistry(), platform.getKycRegistry(),
                platform.getLedgers()));
    }

    @Test
    public void succeed_creating_proposal() {
        long now = runtime.getTime();
        int id = propose(ProposalPayload.roiAdjustment(700));

        assertThat(id, is(1));
        assertThat(gov.getProposalCount(), is(1));
        ProposalDTO p = gov.getProposal(id);
        assertThat(p.proposer, is(ALICE));
        assertThat(p.agreementId, is(agreementId));
        assertThat(p.type, is(ProposalType.ROI_ADJUSTMENT));
        assertThat(p.targetValue, is(big(700)));
        assertThat(p.description, is("description"));
        assertThat(p.createdAt, is(now));
        assertThat(p.votingStart, is(now + VOTING_DELAY));
        assertThat(p.votingEnd, is(now + VOTING_DELAY + VOTING_PERIOD));
        assertThat(p.forVotes, is(BigInteger.ZERO));
        assertThat(p.state, is(ProposalState.PENDING));

        Notification n = assertLastEvent(runtime, YieldSharesGov.PROPOSAL_CREATED);
        assertThat(n.getState().get(0), is(id));
        assertThat(n.getState().get(1), is(ALICE));
        assertThat(n.getState().get(3), is(ProposalType.ROI_ADJUSTMENT));
        assertThat(n.getState().get(4), is(big(700)));
    }

    @Test
    public void succeed_creating_proposal_with_exactly_threshold_shares() {
        assertThat(gov.getProposalThreshold(agreementId), is(big(1_000)));
        int id = runtime.send(EVE, () -> gov.createProposal(agreementId, ProposalPayload.roiAdjustment(600), ""));
        assertThat(gov.getProposal(id).proposer, is(EVE));
    }

    @Test
    public void fail_creating_proposal_below_threshold() {
        ContractException e = assertThrows(ContractException.class, () -> runtime.send(OWNER,
                () -> gov.createProposal(agreementId, ProposalPayload.roiAdjustment(600), "")));
        assertThat(e.getCode(), is(ErrorCode.THRESHOLD_NOT_MET));
        assertThat(gov.getProposalCount(), is(0));
    }

    @Test
    public void fail_creating_proposal_out_of_bounds() {
        ContractException e = assertThrows(ContractException.class,
                () -> propose(ProposalPayload.roiAdjustment(1100)));
        assertThat(e.getCode(), is(ErrorCode.PARAMETER_OUT_OF_BOUNDS));
        assertThat(e.getMessage(), endsWith(ProposalValidator.ROI_DEVIATION_TOO_LARGE));
        assertThat(runtime.getNotifications(YieldSharesGov.PROPOSAL_CREATED), hasSize(0));
    }

    @Test
    public void succeed_voting_with_share_weight() {
        int id = propose(ProposalPayload.roiAdjustment(700));
        startVoting(runtime);

        vote(runtime, gov, id, ALICE, 1);
        vote(runtime, gov, id, BOB, 0);
        vote(runtime, gov, id, CHARLIE, 2);

        ProposalDTO p = gov.getProposal(id);
        assertThat(p.forVotes, is(big(50_000)));
        assertThat(p.againstVotes, is(big(30_000)));
        assertThat(p.abstainVotes, is(big(10_000)));
        assertThat(p.state, is(ProposalState.ACTIVE));
        assertThat(gov.hasVoted(id, BOB), is(true));
        assertThat(gov.hasVoted(id, DENISE), is(false));

        Notification n = assertLastEvent(runtime, YieldSharesGov.VOTED);
        assertThat(n.getState().get(1), is(CHARLIE));
        assertThat(n.getState().get(2), is(2));
        assertThat(n.getState().get(3), is(big(10_000)));
    }

    @Test
    public void fail_voting_twice_or_without_shares_or_with_invalid_support() {
        int id = propose(ProposalPayload.roiAdjustment(700));
        startVoting(runtime);
        vote(runtime, gov, id, ALICE, 1);

        ContractException e = assertThrows(ContractException.class, () -> vote(runtime, gov, id, ALICE, 0));
        assertThat(e.getCode(), is(ErrorCode.ALREADY_VOTED));
        e = assertThrows(ContractException.class, () -> vote(runtime, gov, id, OWNER, 1));
        assertThat(e.getCode(), is(ErrorCode.INSUFFICIENT_VOTING_POWER));
        e = assertThrows(ContractException.class, () -> vote(runtime, gov, id, BOB, 3));
        assertThat(e.getCode(), is(ErrorCode.INVALID_SUPPORT));
        e = assertThrows(ContractException.class, () -> vote(runtime, gov, 2, BOB, 1));
        assertThat(e.getCode(), is(ErrorCode.PROPOSAL_NOT_FOUND));
        // A missing proposal is reported before an invalid support value.
        e = assertThrows(ContractException.class, () -> vote(runtime, gov, 999, BOB, 7));
        assertThat(e.getCode(), is(ErrorCode.PROPOSAL_NOT_FOUND));
        assertThat(e.getMessage(), is("[YieldSharesGov.castVote] Proposal doesn't exist"));

        assertThat(gov.getProposal(id).forVotes, is(big(50_000)));
    }

    @Test
    public void respect_voting_window_boundaries() {
        int id = propose(ProposalPayload.roiAdjustment(700));
        ProposalDTO p = gov.getProposal(id);

        runtime.setTime(p.votingStart - 1);
        ContractException e = assertThrows(ContractException.class, () -> vote(runtime, gov, id, ALICE, 1));
        assertThat(e.getCode(), is(ErrorCode.PROPOSAL_NOT_ACTIVE));

        runtime.setTime(p.votingStart);
        vote(runtime, gov, id, ALICE, 1);

        runtime.setTime(p.votingEnd);
        vote(runtime, gov, id, BOB, 1);
        e = assertThrows(ContractException.class, () -> runtime.send(ALICE, () -> gov.executeProposal(id)));
        assertThat(e.getCode(), is(ErrorCode.VOTING_NOT_ENDED));

        runtime.setTime(p.votingEnd + 1);
        e = assertThrows(ContractException.class, () -> vote(runtime, gov, id, CHARLIE, 1));
        assertThat(e.getCode(), is(ErrorCode.PROPOSAL_NOT_ACTIVE));
        assertThat(gov.getProposalState(id), is(ProposalState.SUCCEEDED));
        assertThat(runtime.send(ALICE, () -> gov.executeProposal(id)), is(true));
        assertThat(gov.getProposalState(id), is(ProposalState.EXECUTED));
    }

    @Test
    public void defeat_proposal_below_quorum() {
        int id = propose(ProposalPayload.roiAdjustment(700));
        assertThat(gov.getQuorumRequired(id), is(big(10_000)));
        startVoting(runtime);
        vote(runtime, gov, id, DENISE, 1);
        endVoting(runtime);

        assertThat(gov.getProposalState(id), is(ProposalState.DEFEATED));
        assertThat(runtime.send(ALICE, () -> gov.executeProposal(id)), is(false));

        ProposalDTO p = gov.getProposal(id);
        assertThat(p.defeated, is(true));
        assertThat(p.quorumReached, is(false));
        assertThat(p.executed, is(false));
        assertThat(platform.getAgreementRegistry().getAgreement(agreementId).roiBasisPoints, is(500));
        Notification n = assertLastEvent(runtime, YieldSharesGov.PROPOSAL_DEFEATED);
        assertThat(n.getState().get(1), is(false));
        assertThat(n.getState().get(2), is(big(9_000)));
    }

    @Test
    public void succeed_reaching_quorum_with_exactly_required_votes() {
        int id = propose(ProposalPayload.roiAdjustment(700));
        startVoting(runtime);
        vote(runtime, gov, id, CHARLIE, 1);
        endVoting(runtime);

        assertThat(runtime.send(ALICE, () -> gov.executeProposal(id)), is(true));
        assertThat(gov.getProposal(id).quorumReached, is(true));
        assertThat(platform.getAgreementRegistry().getAgreement(agreementId).roiBasisPoints, is(700));
    }

    @Test
    public void defeat_proposal_without_majority() {
        int id = propose(ProposalPayload.roiAdjustment(700));
        startVoting(runtime);
        vote(runtime, gov, id, BOB, 1);
        vote(runtime, gov, id, CHARLIE, 0);
        vote(runtime, gov, id, DENISE, 0);
        vote(runtime, gov, id, EVE, 0);
        vote(runtime, gov, id, ALICE, 2);
        endVoting(runtime);

        // 30000 for and 20000 against is a majority.
        assertThat(runtime.send(ALICE, () -> gov.executeProposal(id)), is(true));

        runtime.send(ALICE, () -> platform.getSharesToken(agreementId).transfer(ALICE, OWNER, big(20_000)));
        int tied = propose(ProposalPayload.roiAdjustment(600));
        startVoting(runtime);
        vote(runtime, gov, tied, BOB, 1);
        vote(runtime, gov, tied, ALICE, 0);
        endVoting(runtime);

        assertThat(gov.getProposal(tied).againstVotes, is(big(30_000)));
        assertThat(runtime.send(ALICE, () -> gov.executeProposal(tied)), is(false));
        assertThat(gov.getProposal(tied).quorumReached, is(true));
        assertThat(gov.getProposalState(tied), is(ProposalState.DEFEATED));
    }

    @Test
    public void succeed_executing_defeated_proposal_when_reevaluated() {
        int id = propose(ProposalPayload.roiAdjustment(700));
        startVoting(runtime);
        vote(runtime, gov, id, DENISE, 1);
        endVoting(runtime);
        assertThat(runtime.send(ALICE, () -> gov.executeProposal(id)), is(false));

        // Quorum follows the live supply.
        runtime.send(OWNER, () -> platform.getSharesToken(agreementId).burn(ALICE, big(50_000)));
        assertThat(gov.getQuorumRequired(id), is(big(5_000)));

        assertThat(runtime.send(BOB, () -> gov.executeProposal(id)), is(true));
        ProposalDTO p = gov.getProposal(id);
        assertThat(p.executed, is(true));
        // The earlier defeat stays recorded.
        assertThat(p.defeated, is(true));
        assertThat(p.state, is(ProposalState.EXECUTED));
        assertLastEvent(runtime, YieldSharesGov.PROPOSAL_EXECUTED);
    }

    @Test
    public void fail_executing_twice_or_unknown_proposal() {
        int id = propose(ProposalPayload.roiAdjustment(700));
        startVoting(runtime);
        vote(runtime, gov, id, ALICE, 1);
        endVoting(runtime);
        runtime.send(ALICE, () -> gov.executeProposal(id));

        ContractException e = assertThrows(ContractException.class,
                () -> runtime.send(ALICE, () -> gov.executeProposal(id)));
        assertThat(e.getCode(), is(ErrorCode.PROPOSAL_ALREADY_EXECUTED));
        e = assertThrows(ContractException.class, () -> runtime.send(ALICE, () -> gov.executeProposal(5)));
        assertThat(e.getCode(), is(ErrorCode.PROPOSAL_NOT_FOUND));
        assertThat(gov.getProposal(5), is(nullValue()));
        assertThat(gov.getProposalState(5), is(nullValue()));
    }

    @Test
    public void fail_using_paused_contract() {
        ContractException e = assertThrows(ContractException.class, () -> runtime.send(ALICE, () -> gov.pause()));
        assertThat(e.getCode(), is(ErrorCode.UNAUTHORIZED));

        int id = propose(ProposalPayload.roiAdjustment(700));
        runtime.send(OWNER, () -> gov.pause());
        assertThat(gov.isPaused(), is(true));
        assertLastEvent(runtime, YieldSharesGov.PAUSED);

        e = assertThrows(ContractException.class, () -> propose(ProposalPayload.roiAdjustment(600)));
        assertThat(e.getCode(), is(ErrorCode.CONTRACT_PAUSED));
        startVoting(runtime);
        e = assertThrows(ContractException.class, () -> vote(runtime, gov, id, ALICE, 1));
        assertThat(e.getCode(), is(ErrorCode.CONTRACT_PAUSED));

        runtime.send(OWNER, () -> gov.unpause());
        vote(runtime, gov, id, ALICE, 1);
        assertThat(gov.hasVoted(id, ALICE), is(true));
    }

    @Test
    public void succeed_paging_through_proposals() {
        Paginator.Paginated<ProposalDTO> empty = gov.getProposals(0, 10);
        assertThat(empty.pages, is(1));
        assertThat(empty.items, hasSize(0));

        propose(ProposalPayload.roiAdjustment(600));
        propose(ProposalPayload.roiAdjustment(700));
        propose(ProposalPayload.roiAdjustment(800));

        Paginator.Paginated<ProposalDTO> first = gov.getProposals(0, 2);
        assertThat(first.page, is(0));
        assertThat(first.pages, is(2));
        assertThat(first.items, hasSize(2));
        assertThat(first.items.get(0).id, is(1));
        assertThat(first.items.get(1).id, is(2));

        Paginator.Paginated<ProposalDTO> second = gov.getProposals(1, 2);
        assertThat(second.items, hasSize(1));
        assertThat(second.items.get(0).targetValue, is(big(800)));

        ContractException e = assertThrows(ContractException.class, () -> gov.getProposals(2, 2));
        assertThat(e.getCode(), is(ErrorCode.INVALID_ARGUMENT));
        e = assertThrows(ContractException.class, () -> gov.getProposals(0, 0));
        assertThat(e.getCode(), is(ErrorCode.INVALID_ARGUMENT));
    }

    @Test
    public void succeed_reading_live_voting_power() {
        assertThat(gov.getVotingPower(ALICE, agreementId), is(big(50_000)));
        assertThat(gov.getVotingPower(ALICE, 99), is(BigInteger.ZERO));
        runtime.send(ALICE, () -> platform.getSharesToken(agreementId).transfer(ALICE, OWNER, big(5_000)));
        assertThat(gov.getVotingPower(ALICE, agreementId), is(big(45_000)));
        assertThat(gov.getVotingPower(OWNER, agreementId), is(big(5_000)));
    }
}
