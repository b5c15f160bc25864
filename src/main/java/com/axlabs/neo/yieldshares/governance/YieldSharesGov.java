package com.axlabs.neo.yieldshares.governance;

import com.axlabs.neo.yieldshares.ErrorCode;
import com.axlabs.neo.yieldshares.agreement.AgreementParameter;
import com.axlabs.neo.yieldshares.agreement.AgreementRegistry;
import com.axlabs.neo.yieldshares.governance.power.ShareLedgerAdapter;
import com.axlabs.neo.yieldshares.kyc.KycRegistry;
import com.axlabs.neo.yieldshares.ledger.Distribution;
import com.axlabs.neo.yieldshares.ledger.DistributionEngine;
import com.axlabs.neo.yieldshares.ledger.Holding;
import com.axlabs.neo.yieldshares.restriction.ValidationResult;
import com.axlabs.neo.yieldshares.runtime.Runtime;
import com.axlabs.neo.yieldshares.runtime.SmartContract;
import com.axlabs.neo.yieldshares.runtime.StorageMap;
import com.axlabs.neo.yieldshares.token.SettlementToken;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The governance of the yield agreements. Shareholders of an agreement propose and vote on changes to it, weighted
 * by their shares. Approved proposals are executed by this contract on the agreement registry, the share ledgers
 * and the KYC registry.
 * <p>
 * A proposal can be voted on from {@code votingStart} up to and including {@code votingEnd} and executed from
 * the first second after {@code votingEnd}. Proposals that miss quorum or majority are marked defeated on
 * execution without failing the call, and can be evaluated again.
 * <p>
 * Reserve funds withdrawn by a proposal are distributed to the agreement's shareholders right away. If any of
 * these transfers fails, the whole execution fails.
 */
public class YieldSharesGov extends SmartContract {

    //region CONTRACT VARIABLES
    static final String OWNER_KEY = "owner";
    static final String PROPOSALS_COUNT_KEY = "#_proposals"; // int
    static final String PAUSED_KEY = "paused"; // boolean
    static final BigInteger BASIS_POINTS = BigInteger.valueOf(10_000);

    private final StorageMap properties = storageMap("properties");
    private final StorageMap proposals = storageMap("proposals"); // [int id: Proposal proposal]
    private final StorageMap proposalData = storageMap("proposalData"); // [int id: ProposalData data]
    private final StorageMap proposalVotes = storageMap("proposalVotes"); // [int id: ProposalVotes votes]
    private final StorageMap voters = storageMap("voters"); // [id_voter: Boolean]
    private final StorageMap parameters = storageMap("parameters"); // [String param_key: Long param_value]

    private final boolean votingPowerSnapshots;
    private final SettlementToken paymentToken;
    private final AgreementRegistry registry;
    private final KycRegistry kycRegistry;
    private final ShareLedgerAdapter ledgers;
    private final ProposalValidator validator;
    //endregion CONTRACT VARIABLES

    //region EVENTS
    public static final String PROPOSAL_CREATED = "ProposalCreated";
    public static final String VOTED = "Voted";
    public static final String PROPOSAL_EXECUTED = "ProposalExecuted";
    public static final String PROPOSAL_DEFEATED = "ProposalDefeated";
    public static final String PARAMETER_CHANGED = "GovernanceParameterChanged";
    public static final String RESERVE_DISTRIBUTED = "ReserveDistributed";
    public static final String PAUSED = "ContractPaused";
    public static final String UNPAUSED = "ContractUnpaused";
    //endregion EVENTS

    /**
     * Deploys the governance contract.
     *
     * @param runtime               The runtime to deploy on.
     * @param name                  The contract name.
     * @param owner                 The account allowed to pause the contract.
     * @param params                The initial governance parameters.
     * @param votingPowerSnapshots  Whether votes and quorum use the share balances at proposal creation instead of
     *                              the current ones.
     * @param paymentToken          The token reserves are held and distributed in.
     * @param registry              The agreement registry.
     * @param kycRegistry           The KYC registry changed by KYC whitelist proposals.
     * @param ledgers               The share ledgers of the agreements.
     */
    public YieldSharesGov(Runtime runtime, String name, Hash160 owner, GovernanceParameters params,
            boolean votingPowerSnapshots, SettlementToken paymentToken, AgreementRegistry registry,
            KycRegistry kycRegistry, ShareLedgerAdapter ledgers) {
        super(runtime, name);
        this.votingPowerSnapshots = votingPowerSnapshots;
        this.paymentToken = paymentToken;
        this.registry = registry;
        this.kycRegistry = kycRegistry;
        this.ledgers = ledgers;
        this.validator = new ProposalValidator(registry);
        properties.put(OWNER_KEY, owner);
        for (GovernanceParameter p : GovernanceParameter.values()) {
            long value = params.get(p);
            if (value < p.min() || value > p.max()) {
                throw new IllegalArgumentException("Governance parameter " + p.key() + " out of range: " + value);
            }
            parameters.put(p.key(), value);
        }
    }

    //region SAFE METHODS

    public Hash160 getOwner() {
        return properties.get(OWNER_KEY, Hash160.class);
    }

    public GovernanceParameters getGovernanceParameters() {
        return new GovernanceParameters(
                parameters.getLongOrZero(GovernanceParameter.VOTING_DELAY.key()),
                parameters.getLongOrZero(GovernanceParameter.VOTING_PERIOD.key()),
                (int) parameters.getLongOrZero(GovernanceParameter.QUORUM_BP.key()),
                (int) parameters.getLongOrZero(GovernanceParameter.THRESHOLD_BP.key()));
    }

    public boolean isVotingPowerSnapshots() {
        return votingPowerSnapshots;
    }

    /**
     * Gets all information about the proposal with {@code id}, including its derived state.
     *
     * @param id The proposal's id.
     * @return the proposal, or null if it does not exist.
     */
    public ProposalDTO getProposal(int id) {
        ProposalData data = proposalData.get(id, ProposalData.class);
        if (data == null) {
            return null;
        }
        ProposalDTO dto = new ProposalDTO();
        dto.id = id;
        dto.proposer = data.proposer;
        dto.agreementId = data.agreementId;
        dto.type = data.type;
        dto.targetValue = data.targetValue;
        dto.description = data.description;
        dto.createdAt = data.createdAt;
        Proposal p = proposals.get(id, Proposal.class);
        dto.votingStart = p.votingStart;
        dto.votingEnd = p.votingEnd;
        dto.executed = p.executed;
        dto.defeated = p.defeated;
        dto.quorumReached = p.quorumReached;
        ProposalVotes v = proposalVotes.get(id, ProposalVotes.class);
        dto.forVotes = v.forVotes;
        dto.againstVotes = v.againstVotes;
        dto.abstainVotes = v.abstainVotes;
        dto.state = deriveState(p, data, v);
        return dto;
    }

    /**
     * Gets the state of the proposal with {@code id}. After the voting window, a proposal that was not evaluated
     * yet is reported as succeeded or defeated according to its current tallies.
     *
     * @param id The proposal's id.
     * @return the state, or null if the proposal does not exist.
     */
    public ProposalState getProposalState(int id) {
        ProposalDTO dto = getProposal(id);
        return dto == null ? null : dto.state;
    }

    private ProposalState deriveState(Proposal p, ProposalData data, ProposalVotes v) {
        long now = runtime.getTime();
        if (p.executed) {
            return ProposalState.EXECUTED;
        }
        if (now < p.votingStart) {
            return ProposalState.PENDING;
        }
        if (now <= p.votingEnd) {
            return ProposalState.ACTIVE;
        }
        if (p.defeated) {
            return ProposalState.DEFEATED;
        }
        boolean quorumReached = v.total().compareTo(quorumRequired(data)) >= 0;
        return quorumReached && v.forVotes.compareTo(v.againstVotes) > 0
                ? ProposalState.SUCCEEDED
                : ProposalState.DEFEATED;
    }

    public int getProposalCount() {
        Integer count = properties.get(PROPOSALS_COUNT_KEY, Integer.class);
        return count == null ? 0 : count;
    }

    /**
     * Gets the proposals on the given page. Pages start at 0 and contain proposals in the order of their creation.
     *
     * @param page         The page.
     * @param itemsPerPage The number of proposals per page.
     * @return the chosen page, how many pages there are with the given page size and the found proposals on the
     * given page.
     */
    public Paginator.Paginated<ProposalDTO> getProposals(int page, int itemsPerPage) {
        int n = getProposalCount();
        int[] pagination = Paginator.calcPagination(n, page, itemsPerPage);
        List<ProposalDTO> list = new ArrayList<>();
        for (int i = pagination[0]; i < pagination[1]; i++) {
            list.add(getProposal(i + 1));
        }
        return new Paginator.Paginated<>(page, pagination[2], list);
    }

    public boolean hasVoted(int id, Hash160 voter) {
        return voters.getBoolean(voterKey(id, voter));
    }

    /**
     * Gets the current voting power of {@code voter}, i.e., its share balance in the agreement's ledger.
     *
     * @param voter       The voter.
     * @param agreementId The agreement.
     * @return the voting power. Zero if the agreement has no ledger.
     */
    public BigInteger getVotingPower(Hash160 voter, int agreementId) {
        return ledgers.balanceOf(voter, agreementId);
    }

    /**
     * @return the number of votes the proposal needs to reach quorum, or zero if it does not exist.
     */
    public BigInteger getQuorumRequired(int id) {
        ProposalData data = proposalData.get(id, ProposalData.class);
        return data == null ? BigInteger.ZERO : quorumRequired(data);
    }

    /**
     * @return the voting power needed to create a proposal for the agreement.
     */
    public BigInteger getProposalThreshold(int agreementId) {
        return ledgers.totalSupply(agreementId)
                .multiply(BigInteger.valueOf(parameters.getLongOrZero(GovernanceParameter.THRESHOLD_BP.key())))
                .divide(BASIS_POINTS);
    }

    public boolean isPaused() {
        return properties.getBoolean(PAUSED_KEY);
    }
    //endregion SAFE METHODS

    // region GOVERNANCE PROCESS METHODS

    /**
     * Creates a proposal. The caller needs at least the proposal threshold of the agreement's shares.
     * <p>
     * For governance parameter updates the {@code agreementId} holds the id of the parameter to change, and the
     * threshold is checked against the ledger registered under that id. Agreement parameter and transfer
     * restriction updates carry the packed parameter id and value as {@code targetValue}, see
     * {@link ParameterCodec}.
     *
     * @param agreementId The targeted agreement or parameter.
     * @param type        The proposal type.
     * @param targetValue The raw or packed target value.
     * @param description The proposal's description.
     * @return the id of the proposal.
     */
    public int createProposal(int agreementId, ProposalType type, BigInteger targetValue, String description) {
        return invoke("createProposal", () -> {
            abortIfPaused("createProposal");
            if (type == null || targetValue == null)
                fireErrorAndAbort(ErrorCode.INVALID_ARGUMENT, "Missing proposal type or value", "createProposal");
            Hash160 proposer = getCallingScriptHash();
            if (getVotingPower(proposer, agreementId).compareTo(getProposalThreshold(agreementId)) < 0)
                fireErrorAndAbort(ErrorCode.THRESHOLD_NOT_MET, "Proposal threshold not met", "createProposal");
            ValidationResult result = validator.validate(type, agreementId, targetValue, runtime.getTime());
            if (!result.isAllowed())
                fireErrorAndAbort(ErrorCode.PARAMETER_OUT_OF_BOUNDS, result.getReason(), "createProposal");
            return storeProposal(proposer, agreementId, type, targetValue, description);
        });
    }

    /**
     * Creates a proposal from a typed payload.
     *
     * @param agreementId The targeted agreement. Ignored for governance parameter and KYC whitelist updates.
     * @param payload     The proposal's action.
     * @param description The proposal's description.
     * @return the id of the proposal.
     */
    public int createProposal(int agreementId, ProposalPayload payload, String description) {
        if (payload.getType() == ProposalType.KYC_WHITELIST_UPDATE) {
            ProposalPayload.KycUpdate kyc = (ProposalPayload.KycUpdate) payload;
            return createKYCWhitelistProposal(kyc.getAccount(), kyc.isAdd(), description);
        }
        return createProposal(ParameterCodec.agreementIdOf(payload, agreementId), payload.getType(),
                ParameterCodec.encode(payload), description);
    }

    /**
     * Creates a proposal to add an account to or remove it from the KYC whitelist. Such proposals have no
     * proposal threshold.
     *
     * @param target      The account.
     * @param add         True to add the account, false to remove it.
     * @param description The proposal's description.
     * @return the id of the proposal.
     */
    public int createKYCWhitelistProposal(Hash160 target, boolean add, String description) {
        return invoke("createKYCWhitelistProposal", () -> {
            abortIfPaused("createKYCWhitelistProposal");
            if (target == null || Hash160.ZERO.equals(target))
                fireErrorAndAbort(ErrorCode.PARAMETER_OUT_OF_BOUNDS, ProposalValidator.INVALID_TARGET_ADDRESS,
                        "createKYCWhitelistProposal");
            return storeProposal(getCallingScriptHash(), 0, ProposalType.KYC_WHITELIST_UPDATE,
                    ParameterCodec.packKycUpdate(target, add), description);
        });
    }

    private int storeProposal(Hash160 proposer, int agreementId, ProposalType type, BigInteger targetValue,
            String description) {
        int id = getProposalCount() + 1;
        long now = runtime.getTime();
        long votingStart = now + parameters.getLongOrZero(GovernanceParameter.VOTING_DELAY.key());
        long votingEnd = votingStart + parameters.getLongOrZero(GovernanceParameter.VOTING_PERIOD.key());
        proposals.put(id, new Proposal(id, votingStart, votingEnd));
        proposalData.put(id, new ProposalData(proposer, agreementId, type, targetValue, description, now));
        proposalVotes.put(id, new ProposalVotes());
        properties.put(PROPOSALS_COUNT_KEY, id);

        // The description is not part of the event since it can be arbitrarily long.
        fire(PROPOSAL_CREATED, id, proposer, agreementId, type, targetValue);
        log.info("Proposal {} created by {}: {} on {} with target value {}", id, proposer, type, agreementId,
                targetValue);
        return id;
    }

    /**
     * Casts the caller's vote on the proposal with {@code id}, weighted by the caller's shares in the proposal's
     * agreement.
     *
     * @param id      The id of the proposal to vote on.
     * @param support 0 for against, 1 for in favour and 2 for abstaining.
     */
    public void castVote(int id, int support) {
        invoke("castVote", () -> {
            abortIfPaused("castVote");
            Proposal proposal = proposals.get(id, Proposal.class);
            if (proposal == null)
                fireErrorAndAbort(ErrorCode.PROPOSAL_NOT_FOUND, "Proposal doesn't exist", "castVote");
            if (support < 0 || support > 2) fireErrorAndAbort(ErrorCode.INVALID_SUPPORT, "Invalid vote", "castVote");
            long time = runtime.getTime();
            if (time < proposal.votingStart || time > proposal.votingEnd)
                fireErrorAndAbort(ErrorCode.PROPOSAL_NOT_ACTIVE, "Proposal not active", "castVote");
            Hash160 voter = getCallingScriptHash();
            if (hasVoted(id, voter))
                fireErrorAndAbort(ErrorCode.ALREADY_VOTED, "Already voted on this proposal", "castVote");
            ProposalData data = proposalData.get(id, ProposalData.class);
            BigInteger weight = votingPowerOf(voter, data);
            if (weight.signum() == 0)
                fireErrorAndAbort(ErrorCode.INSUFFICIENT_VOTING_POWER, "No voting power", "castVote");

            ProposalVotes votes = proposalVotes.get(id, ProposalVotes.class);
            if (support == 0) {
                votes.againstVotes = votes.againstVotes.add(weight);
            } else if (support == 1) {
                votes.forVotes = votes.forVotes.add(weight);
            } else {
                votes.abstainVotes = votes.abstainVotes.add(weight);
            }
            proposalVotes.put(id, votes);
            voters.put(voterKey(id, voter), true);
            fire(VOTED, id, voter, support, weight);
        });
    }

    /**
     * Executes the proposal with the given {@code id}. Anyone can execute any proposal once its voting window has
     * ended.
     * <p>
     * If the proposal misses quorum or majority, it is marked defeated and the call returns normally. Otherwise the
     * proposal is marked executed and its action is carried out. If the action fails, the whole call fails and the
     * proposal stays unexecuted.
     *
     * @param id The proposal id.
     * @return true if the proposal was executed, false if it was defeated.
     */
    public boolean executeProposal(int id) {
        return invoke("executeProposal", () -> {
            abortIfPaused("executeProposal");
            Proposal proposal = proposals.get(id, Proposal.class);
            if (proposal == null)
                fireErrorAndAbort(ErrorCode.PROPOSAL_NOT_FOUND, "Proposal doesn't exist", "executeProposal");
            if (proposal.executed)
                fireErrorAndAbort(ErrorCode.PROPOSAL_ALREADY_EXECUTED, "Proposal already executed",
                        "executeProposal");
            if (runtime.getTime() <= proposal.votingEnd)
                fireErrorAndAbort(ErrorCode.VOTING_NOT_ENDED, "Voting not ended", "executeProposal");

            ProposalData data = proposalData.get(id, ProposalData.class);
            ProposalVotes votes = proposalVotes.get(id, ProposalVotes.class);
            proposal.quorumReached = votes.total().compareTo(quorumRequired(data)) >= 0;
            if (!proposal.quorumReached || votes.forVotes.compareTo(votes.againstVotes) <= 0) {
                proposal.defeated = true;
                proposals.put(id, proposal);
                fire(PROPOSAL_DEFEATED, id, proposal.quorumReached, votes.forVotes, votes.againstVotes,
                        votes.abstainVotes);
                log.info("Proposal {} defeated (quorum reached: {})", id, proposal.quorumReached);
                return false;
            }

            proposal.executed = true;
            proposals.put(id, proposal);
            dispatch(data);
            fire(PROPOSAL_EXECUTED, id);
            log.info("Proposal {} executed", id);
            return true;
        });
    }
    // endregion GOVERNANCE PROCESS METHODS

    //region PROPOSAL DISPATCH

    private void dispatch(ProposalData data) {
        int agreementId = data.agreementId;
        BigInteger value = data.targetValue;
        switch (data.type) {
            case ROI_ADJUSTMENT:
                registry.setAgreementROI(agreementId, value.intValueExact());
                break;
            case RESERVE_ALLOCATION:
                allocateReserve(agreementId, value);
                break;
            case RESERVE_WITHDRAWAL:
                withdrawAndDistributeReserve(agreementId, value);
                break;
            case GOVERNANCE_PARAMETER_UPDATE:
                changeParameter(GovernanceParameter.fromId(agreementId), value);
                break;
            case AGREEMENT_PARAMETER_UPDATE:
                changeAgreementParameter(agreementId, value);
                break;
            case TRANSFER_RESTRICTION_UPDATE:
                ledgers.updateTransferRestriction(agreementId, ParameterCodec.unpackParameterId(value),
                        ParameterCodec.unpackParameterValue(value));
                break;
            default:
                Hash160 account = ParameterCodec.unpackKycAccount(value);
                if (ParameterCodec.unpackKycAddFlag(value)) {
                    kycRegistry.addToWhitelist(account);
                } else {
                    kycRegistry.removeFromWhitelist(account);
                }
        }
    }

    private void allocateReserve(int agreementId, BigInteger amount) {
        if (!paymentToken.transfer(getScriptHash(), registry.getScriptHash(), amount))
            fireErrorAndAbort(ErrorCode.TRANSFER_FAILED, "Reserve transfer failed", "executeProposal");
        registry.allocateReserve(agreementId, amount);
    }

    /**
     * Withdraws reserve funds to this contract and distributes them pro-rata to the agreement's shareholders. Fails
     * if any transfer to a shareholder fails.
     */
    private void withdrawAndDistributeReserve(int agreementId, BigInteger amount) {
        registry.withdrawReserve(agreementId, amount);
        List<Holding> holdings = ledgers.getHoldings(agreementId);
        BigInteger totalShares = ledgers.totalSupply(agreementId);
        if (holdings.isEmpty() || totalShares.signum() == 0)
            fireErrorAndAbort(ErrorCode.DISTRIBUTION_ABORTED, "No shareholders", "executeProposal");
        Distribution distribution = DistributionEngine.allocate(amount, holdings, totalShares);
        for (Map.Entry<Hash160, BigInteger> payout : distribution.getPayouts().entrySet()) {
            if (payout.getValue().signum() > 0
                    && !paymentToken.transfer(getScriptHash(), payout.getKey(), payout.getValue())) {
                fireErrorAndAbort(ErrorCode.DISTRIBUTION_ABORTED, "Transfer to " + payout.getKey() + " failed",
                        "executeProposal");
            }
        }
        fire(RESERVE_DISTRIBUTED, agreementId, amount, holdings.size());
    }

    private void changeParameter(GovernanceParameter parameter, BigInteger value) {
        if (!parameter.isInRange(value))
            fireErrorAndAbort(ErrorCode.PARAMETER_OUT_OF_BOUNDS, "Invalid parameter value", "executeProposal");
        parameters.put(parameter.key(), value.longValueExact());
        fire(PARAMETER_CHANGED, parameter.key(), value);
    }

    private void changeAgreementParameter(int agreementId, BigInteger packed) {
        BigInteger value = ParameterCodec.unpackParameterValue(packed);
        switch (AgreementParameter.fromId(ParameterCodec.unpackParameterId(packed))) {
            case GRACE_PERIOD_DAYS:
                registry.setGracePeriodDays(agreementId, value.intValueExact());
                break;
            case DEFAULT_PENALTY_RATE:
                registry.setDefaultPenaltyRate(agreementId, value.intValueExact());
                break;
            case DEFAULT_THRESHOLD:
                registry.setDefaultThreshold(agreementId, value.intValueExact());
                break;
            case ALLOW_PARTIAL_REPAYMENTS:
                registry.setAllowPartialRepayments(agreementId, value.signum() != 0);
                break;
            default:
                registry.setAllowEarlyRepayment(agreementId, value.signum() != 0);
        }
    }
    //endregion PROPOSAL DISPATCH

    public void pause() {
        invoke("pause", () -> {
            if (!runtime.checkWitness(getOwner()))
                fireErrorAndAbort(ErrorCode.UNAUTHORIZED, "Not authorised", "pause");
            properties.put(PAUSED_KEY, true);
            fire(PAUSED);
        });
    }

    public void unpause() {
        invoke("unpause", () -> {
            if (!runtime.checkWitness(getOwner()))
                fireErrorAndAbort(ErrorCode.UNAUTHORIZED, "Not authorised", "unpause");
            properties.put(PAUSED_KEY, false);
            fire(UNPAUSED);
        });
    }

    private BigInteger votingPowerOf(Hash160 voter, ProposalData data) {
        if (votingPowerSnapshots) {
            return ledgers.balanceOfAt(voter, data.agreementId, data.createdAt);
        }
        return ledgers.balanceOf(voter, data.agreementId);
    }

    private BigInteger quorumRequired(ProposalData data) {
        BigInteger supply = votingPowerSnapshots
                ? ledgers.totalSupplyAt(data.agreementId, data.createdAt)
                : ledgers.totalSupply(data.agreementId);
        return supply.multiply(BigInteger.valueOf(parameters.getLongOrZero(GovernanceParameter.QUORUM_BP.key())))
                .divide(BASIS_POINTS);
    }

    private void abortIfPaused(String method) {
        if (isPaused()) fireErrorAndAbort(ErrorCode.CONTRACT_PAUSED, "Contract is paused", method);
    }

    private static String voterKey(int id, Hash160 voter) {
        return id + "_" + voter;
    }
}
