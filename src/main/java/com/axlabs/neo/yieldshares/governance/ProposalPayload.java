package com.axlabs.neo.yieldshares.governance;

import com.axlabs.neo.yieldshares.agreement.AgreementParameter;
import com.axlabs.neo.yieldshares.restriction.RestrictionParameter;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.Objects;

/**
 * The typed action of a proposal. Proposals are stored with a single packed target value, {@link ParameterCodec}
 * converts between the two forms.
 */
public abstract class ProposalPayload {

    public abstract ProposalType getType();

    public static RoiAdjustment roiAdjustment(int roiBasisPoints) {
        return new RoiAdjustment(roiBasisPoints);
    }

    public static ReserveAmount reserveAllocation(BigInteger amount) {
        return new ReserveAmount(ProposalType.RESERVE_ALLOCATION, amount);
    }

    public static ReserveAmount reserveWithdrawal(BigInteger amount) {
        return new ReserveAmount(ProposalType.RESERVE_WITHDRAWAL, amount);
    }

    public static GovernanceParam governanceParam(GovernanceParameter parameter, BigInteger value) {
        return new GovernanceParam(parameter, value);
    }

    public static AgreementParam agreementParam(AgreementParameter parameter, BigInteger value) {
        return new AgreementParam(parameter, value);
    }

    public static RestrictionParam restrictionParam(RestrictionParameter parameter, BigInteger value) {
        return new RestrictionParam(parameter, value);
    }

    public static KycUpdate kycUpdate(Hash160 account, boolean add) {
        return new KycUpdate(account, add);
    }

    public static class RoiAdjustment extends ProposalPayload {
        private final int roiBasisPoints;

        RoiAdjustment(int roiBasisPoints) {
            this.roiBasisPoints = roiBasisPoints;
        }

        public int getRoiBasisPoints() {
            return roiBasisPoints;
        }

        @Override
        public ProposalType getType() {
            return ProposalType.ROI_ADJUSTMENT;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RoiAdjustment && ((RoiAdjustment) o).roiBasisPoints == roiBasisPoints;
        }

        @Override
        public int hashCode() {
            return roiBasisPoints;
        }
    }

    /**
     * A reserve allocation or withdrawal.
     */
    public static class ReserveAmount extends ProposalPayload {
        private final ProposalType type;
        private final BigInteger amount;

        ReserveAmount(ProposalType type, BigInteger amount) {
            this.type = type;
            this.amount = amount;
        }

        public BigInteger getAmount() {
            return amount;
        }

        @Override
        public ProposalType getType() {
            return type;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ReserveAmount)) return false;
            ReserveAmount that = (ReserveAmount) o;
            return type == that.type && amount.equals(that.amount);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, amount);
        }
    }

    public static class GovernanceParam extends ProposalPayload {
        private final GovernanceParameter parameter;
        private final BigInteger value;

        GovernanceParam(GovernanceParameter parameter, BigInteger value) {
            this.parameter = parameter;
            this.value = value;
        }

        public GovernanceParameter getParameter() {
            return parameter;
        }

        public BigInteger getValue() {
            return value;
        }

        @Override
        public ProposalType getType() {
            return ProposalType.GOVERNANCE_PARAMETER_UPDATE;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof GovernanceParam)) return false;
            GovernanceParam that = (GovernanceParam) o;
            return parameter == that.parameter && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(parameter, value);
        }
    }

    public static class AgreementParam extends ProposalPayload {
        private final AgreementParameter parameter;
        private final BigInteger value;

        AgreementParam(AgreementParameter parameter, BigInteger value) {
            this.parameter = parameter;
            this.value = value;
        }

        public AgreementParameter getParameter() {
            return parameter;
        }

        public BigInteger getValue() {
            return value;
        }

        @Override
        public ProposalType getType() {
            return ProposalType.AGREEMENT_PARAMETER_UPDATE;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof AgreementParam)) return false;
            AgreementParam that = (AgreementParam) o;
            return parameter == that.parameter && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(parameter, value);
        }
    }

    public static class RestrictionParam extends ProposalPayload {
        private final RestrictionParameter parameter;
        private final BigInteger value;

        RestrictionParam(RestrictionParameter parameter, BigInteger value) {
            this.parameter = parameter;
            this.value = value;
        }

        public RestrictionParameter getParameter() {
            return parameter;
        }

        public BigInteger getValue() {
            return value;
        }

        @Override
        public ProposalType getType() {
            return ProposalType.TRANSFER_RESTRICTION_UPDATE;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof RestrictionParam)) return false;
            RestrictionParam that = (RestrictionParam) o;
            return parameter == that.parameter && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(parameter, value);
        }
    }

    public static class KycUpdate extends ProposalPayload {
        private final Hash160 account;
        private final boolean add;

        KycUpdate(Hash160 account, boolean add) {
            this.account = account;
            this.add = add;
        }

        public Hash160 getAccount() {
            return account;
        }

        public boolean isAdd() {
            return add;
        }

        @Override
        public ProposalType getType() {
            return ProposalType.KYC_WHITELIST_UPDATE;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof KycUpdate)) return false;
            KycUpdate that = (KycUpdate) o;
            return add == that.add && account.equals(that.account);
        }

        @Override
        public int hashCode() {
            return Objects.hash(account, add);
        }
    }
}
