package com.axlabs.neo.yieldshares.governance;

import com.axlabs.neo.yieldshares.agreement.AgreementParameter;
import com.axlabs.neo.yieldshares.restriction.RestrictionParameter;
import io.neow3j.constants.NeoConstants;
import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * Packs proposal actions into the single target value stored with a proposal and unpacks them again.
 * <p>
 * Agreement and restriction parameter updates are packed as {@code (parameterId << 128) | value}. KYC updates are
 * packed as {@code (address << 96) | addFlag}, with the address read as a big-endian unsigned integer. Governance
 * parameter updates carry the parameter id in the proposal's agreement id field and the raw value as target value.
 */
public final class ParameterCodec {

    static final int PARAMETER_SHIFT = 128;
    static final int ADDRESS_SHIFT = 96;
    static final BigInteger VALUE_MASK = BigInteger.ONE.shiftLeft(PARAMETER_SHIFT).subtract(BigInteger.ONE);
    static final BigInteger ADDRESS_MASK = BigInteger.ONE.shiftLeft(NeoConstants.HASH160_SIZE * 8).subtract(BigInteger.ONE);

    private ParameterCodec() {
    }

    public static BigInteger packParameter(int parameterId, BigInteger value) {
        if (parameterId < 0) {
            throw new IllegalArgumentException("Negative parameter id");
        }
        if (value.signum() < 0 || value.bitLength() > PARAMETER_SHIFT) {
            throw new IllegalArgumentException("Parameter value does not fit into 128 bits");
        }
        return BigInteger.valueOf(parameterId).shiftLeft(PARAMETER_SHIFT).or(value);
    }

    /**
     * @return the parameter id of a packed parameter, saturated to {@link Integer#MAX_VALUE} for oversized ids.
     */
    public static int unpackParameterId(BigInteger packed) {
        BigInteger id = packed.shiftRight(PARAMETER_SHIFT);
        return id.bitLength() > 31 ? Integer.MAX_VALUE : id.intValue();
    }

    public static BigInteger unpackParameterValue(BigInteger packed) {
        return packed.and(VALUE_MASK);
    }

    public static BigInteger packKycUpdate(Hash160 account, boolean add) {
        return toBigInteger(account).shiftLeft(ADDRESS_SHIFT).or(add ? BigInteger.ONE : BigInteger.ZERO);
    }

    public static Hash160 unpackKycAccount(BigInteger packed) {
        return toHash160(packed.shiftRight(ADDRESS_SHIFT).and(ADDRESS_MASK));
    }

    public static boolean unpackKycAddFlag(BigInteger packed) {
        return packed.testBit(0);
    }

    public static BigInteger toBigInteger(Hash160 account) {
        return new BigInteger(1, account.toArray());
    }

    public static Hash160 toHash160(BigInteger value) {
        byte[] raw = value.toByteArray();
        byte[] bytes = new byte[NeoConstants.HASH160_SIZE];
        int length = Math.min(raw.length, NeoConstants.HASH160_SIZE);
        System.arraycopy(raw, raw.length - length, bytes, NeoConstants.HASH160_SIZE - length, length);
        return new Hash160(bytes);
    }

    /**
     * @return the agreement id field of a proposal with the given payload.
     */
    public static int agreementIdOf(ProposalPayload payload, int agreementId) {
        switch (payload.getType()) {
            case GOVERNANCE_PARAMETER_UPDATE:
                return ((ProposalPayload.GovernanceParam) payload).getParameter().id();
            case KYC_WHITELIST_UPDATE:
                return 0;
            default:
                return agreementId;
        }
    }

    /**
     * @return the target value a proposal with the given payload is stored with.
     */
    public static BigInteger encode(ProposalPayload payload) {
        switch (payload.getType()) {
            case ROI_ADJUSTMENT:
                return BigInteger.valueOf(((ProposalPayload.RoiAdjustment) payload).getRoiBasisPoints());
            case RESERVE_ALLOCATION:
            case RESERVE_WITHDRAWAL:
                return ((ProposalPayload.ReserveAmount) payload).getAmount();
            case GOVERNANCE_PARAMETER_UPDATE:
                return ((ProposalPayload.GovernanceParam) payload).getValue();
            case AGREEMENT_PARAMETER_UPDATE:
                ProposalPayload.AgreementParam a = (ProposalPayload.AgreementParam) payload;
                return packParameter(a.getParameter().id(), a.getValue());
            case TRANSFER_RESTRICTION_UPDATE:
                ProposalPayload.RestrictionParam r = (ProposalPayload.RestrictionParam) payload;
                return packParameter(r.getParameter().id(), r.getValue());
            default:
                ProposalPayload.KycUpdate k = (ProposalPayload.KycUpdate) payload;
                return packKycUpdate(k.getAccount(), k.isAdd());
        }
    }

    /**
     * Reads the typed action of a stored proposal.
     *
     * @param type        The proposal type.
     * @param agreementId The proposal's agreement id field.
     * @param targetValue The proposal's target value.
     * @return the payload.
     * @throws IllegalArgumentException if a parameter id is unknown.
     */
    public static ProposalPayload decode(ProposalType type, int agreementId, BigInteger targetValue) {
        switch (type) {
            case ROI_ADJUSTMENT:
                return ProposalPayload.roiAdjustment(targetValue.intValueExact());
            case RESERVE_ALLOCATION:
                return ProposalPayload.reserveAllocation(targetValue);
            case RESERVE_WITHDRAWAL:
                return ProposalPayload.reserveWithdrawal(targetValue);
            case GOVERNANCE_PARAMETER_UPDATE:
                return ProposalPayload.governanceParam(GovernanceParameter.fromId(agreementId), targetValue);
            case AGREEMENT_PARAMETER_UPDATE:
                return ProposalPayload.agreementParam(
                        AgreementParameter.fromId(unpackParameterId(targetValue)),
                        unpackParameterValue(targetValue));
            case TRANSFER_RESTRICTION_UPDATE:
                return ProposalPayload.restrictionParam(
                        RestrictionParameter.fromId(unpackParameterId(targetValue)),
                        unpackParameterValue(targetValue));
            default:
                return ProposalPayload.kycUpdate(unpackKycAccount(targetValue), unpackKycAddFlag(targetValue));
        }
    }
}
