package com.axlabs.neo.yieldshares.governance;

import com.axlabs.neo.yieldshares.agreement.AgreementParameter;
import com.axlabs.neo.yieldshares.agreement.AgreementRegistry;
import com.axlabs.neo.yieldshares.agreement.YieldAgreement;
import com.axlabs.neo.yieldshares.restriction.RestrictionParameter;
import com.axlabs.neo.yieldshares.restriction.ValidationResult;
import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * Checks the target value of a new proposal against the bounds of its proposal type.
 */
public class ProposalValidator {

    static final BigInteger BASIS_POINTS = BigInteger.valueOf(10_000);
    static final int MIN_ROI_BP = 100;
    static final int MAX_ROI_BP = 5_000;
    static final int MAX_ROI_DEVIATION_BP = 500;
    static final BigInteger MAX_RESERVE_BP = BigInteger.valueOf(2_000);
    static final int MIN_MAX_SHARES_BP = 100;

    public static final String AGREEMENT_DOES_NOT_EXIST = "Agreement does not exist";
    public static final String ROI_OUT_OF_RANGE = "ROI out of range";
    public static final String ROI_DEVIATION_TOO_LARGE = "ROI deviates too much from current rate";
    public static final String RESERVE_TOO_LARGE = "Reserve exceeds 20% of upfront capital";
    public static final String INVALID_RESERVE_AMOUNT = "Invalid reserve amount";
    public static final String WITHDRAWAL_EXCEEDS_RESERVE = "Withdrawal exceeds reserve balance";
    public static final String UNKNOWN_PARAMETER = "Unknown parameter";
    public static final String VALUE_OUT_OF_RANGE = "Parameter value out of range";
    public static final String LOCKUP_NOT_IN_FUTURE = "Lockup end must be in the future";
    public static final String INVALID_TARGET_ADDRESS = "Invalid target address";

    private final AgreementRegistry registry;

    public ProposalValidator(AgreementRegistry registry) {
        this.registry = registry;
    }

    /**
     * Validates a proposal's target value.
     *
     * @param type        The proposal type.
     * @param agreementId The proposal's agreement id field, i.e., the parameter id for governance parameter updates.
     * @param targetValue The raw or packed target value.
     * @param now         The current time.
     * @return the validation result, with the violated bound as reason if rejected.
     */
    public ValidationResult validate(ProposalType type, int agreementId, BigInteger targetValue, long now) {
        if (targetValue.signum() < 0) {
            return ValidationResult.rejected(VALUE_OUT_OF_RANGE);
        }
        switch (type) {
            case ROI_ADJUSTMENT:
                return validateRoi(agreementId, targetValue);
            case RESERVE_ALLOCATION:
                return validateReserveAllocation(agreementId, targetValue);
            case RESERVE_WITHDRAWAL:
                return validateReserveWithdrawal(agreementId, targetValue);
            case GOVERNANCE_PARAMETER_UPDATE:
                return validateGovernanceParameter(agreementId, targetValue);
            case AGREEMENT_PARAMETER_UPDATE:
                return validateAgreementParameter(agreementId, targetValue);
            case TRANSFER_RESTRICTION_UPDATE:
                return validateRestrictionParameter(targetValue, now);
            default:
                return validateKycUpdate(targetValue);
        }
    }

    private ValidationResult validateRoi(int agreementId, BigInteger targetValue) {
        YieldAgreement agreement = registry.getAgreement(agreementId);
        if (agreement == null) {
            return ValidationResult.rejected(AGREEMENT_DOES_NOT_EXIST);
        }
        if (targetValue.compareTo(BigInteger.valueOf(MIN_ROI_BP)) < 0
                || targetValue.compareTo(BigInteger.valueOf(MAX_ROI_BP)) > 0) {
            return ValidationResult.rejected(ROI_OUT_OF_RANGE);
        }
        int deviation = Math.abs(targetValue.intValue() - agreement.roiBasisPoints);
        if (deviation > MAX_ROI_DEVIATION_BP) {
            return ValidationResult.rejected(ROI_DEVIATION_TOO_LARGE);
        }
        return ValidationResult.allowed();
    }

    private ValidationResult validateReserveAllocation(int agreementId, BigInteger amount) {
        YieldAgreement agreement = registry.getAgreement(agreementId);
        if (agreement == null) {
            return ValidationResult.rejected(AGREEMENT_DOES_NOT_EXIST);
        }
        if (amount.signum() == 0) {
            return ValidationResult.rejected(INVALID_RESERVE_AMOUNT);
        }
        BigInteger max = agreement.upfrontCapital.multiply(MAX_RESERVE_BP).divide(BASIS_POINTS);
        if (amount.compareTo(max) > 0) {
            return ValidationResult.rejected(RESERVE_TOO_LARGE);
        }
        return ValidationResult.allowed();
    }

    private ValidationResult validateReserveWithdrawal(int agreementId, BigInteger amount) {
        YieldAgreement agreement = registry.getAgreement(agreementId);
        if (agreement == null) {
            return ValidationResult.rejected(AGREEMENT_DOES_NOT_EXIST);
        }
        if (amount.signum() == 0) {
            return ValidationResult.rejected(INVALID_RESERVE_AMOUNT);
        }
        if (amount.compareTo(agreement.reserveBalance) > 0) {
            return ValidationResult.rejected(WITHDRAWAL_EXCEEDS_RESERVE);
        }
        return ValidationResult.allowed();
    }

    private ValidationResult validateGovernanceParameter(int parameterId, BigInteger value) {
        if (parameterId < 0 || parameterId > 3) {
            return ValidationResult.rejected(UNKNOWN_PARAMETER);
        }
        if (!GovernanceParameter.fromId(parameterId).isInRange(value)) {
            return ValidationResult.rejected(VALUE_OUT_OF_RANGE);
        }
        return ValidationResult.allowed();
    }

    private ValidationResult validateAgreementParameter(int agreementId, BigInteger packed) {
        int parameterId = ParameterCodec.unpackParameterId(packed);
        if (parameterId > 4) {
            return ValidationResult.rejected(UNKNOWN_PARAMETER);
        }
        if (!AgreementParameter.fromId(parameterId).isInRange(ParameterCodec.unpackParameterValue(packed))) {
            return ValidationResult.rejected(VALUE_OUT_OF_RANGE);
        }
        if (!registry.agreementExists(agreementId)) {
            return ValidationResult.rejected(AGREEMENT_DOES_NOT_EXIST);
        }
        return ValidationResult.allowed();
    }

    private ValidationResult validateRestrictionParameter(BigInteger packed, long now) {
        int parameterId = ParameterCodec.unpackParameterId(packed);
        if (parameterId > 2) {
            return ValidationResult.rejected(UNKNOWN_PARAMETER);
        }
        BigInteger value = ParameterCodec.unpackParameterValue(packed);
        switch (RestrictionParameter.fromId(parameterId)) {
            case LOCKUP_END_TIMESTAMP:
                if (value.signum() != 0 && value.compareTo(BigInteger.valueOf(now)) <= 0) {
                    return ValidationResult.rejected(LOCKUP_NOT_IN_FUTURE);
                }
                break;
            case MAX_SHARES_PER_INVESTOR_BP:
                if (value.signum() != 0 && (value.compareTo(BigInteger.valueOf(MIN_MAX_SHARES_BP)) < 0
                        || value.compareTo(BASIS_POINTS) > 0)) {
                    return ValidationResult.rejected(VALUE_OUT_OF_RANGE);
                }
                break;
            default:
                if (value.compareTo(BigInteger.valueOf(RestrictionParameter.MAX_HOLDING_PERIOD)) > 0) {
                    return ValidationResult.rejected(VALUE_OUT_OF_RANGE);
                }
        }
        return ValidationResult.allowed();
    }

    private ValidationResult validateKycUpdate(BigInteger packed) {
        if (Hash160.ZERO.equals(ParameterCodec.unpackKycAccount(packed))) {
            return ValidationResult.rejected(INVALID_TARGET_ADDRESS);
        }
        return ValidationResult.allowed();
    }
}
