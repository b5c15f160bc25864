package com.axlabs.neo.yieldshares.agreement;

import com.axlabs.neo.yieldshares.ContractException;
import com.axlabs.neo.yieldshares.ErrorCode;
import com.axlabs.neo.yieldshares.runtime.Notification;
import com.axlabs.neo.yieldshares.runtime.Runtime;
import com.axlabs.neo.yieldshares.token.SettlementToken;
import io.neow3j.types.Hash160;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.axlabs.neo.yieldshares.util.TestHelper.ALICE;
import static com.axlabs.neo.yieldshares.util.TestHelper.BOB;
import static com.axlabs.neo.yieldshares.util.TestHelper.OWNER;
import static com.axlabs.neo.yieldshares.util.TestHelper.assertLastEvent;
import static com.axlabs.neo.yieldshares.util.TestHelper.big;
import static com.axlabs.neo.yieldshares.util.TestHelper.newRuntime;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class YieldAgreementRegistryTest {

    // Stands in for the governance contract.
    private static final Hash160 GOVERNANCE = BOB;

    private Runtime runtime;
    private SettlementToken payment;
    private YieldAgreementRegistry registry;
    private int agreementId;

    @BeforeEach
    public void setUp() {
        runtime = newRuntime();
        payment = new SettlementToken(runtime, "SettlementToken", OWNER);
        registry = new YieldAgreementRegistry(runtime, "YieldAgreementRegistry", OWNER, payment);
        runtime.send(OWNER, () -> registry.setGovernance(GOVERNANCE));
        agreementId = runtime.send(OWNER, () -> registry.createAgreement(big(1_000_000), 800, 36));
    }

    @Test
    public void succeed_creating_agreement_with_defaults() {
        assertThat(agreementId, is(1));
        assertThat(registry.getAgreementCount(), is(1));
        assertThat(registry.agreementExists(1), is(true));
        assertThat(registry.agreementExists(2), is(false));
        assertThat(registry.getAgreement(2), is(nullValue()));

        YieldAgreement a = registry.getAgreement(agreementId);
        assertThat(a.upfrontCapital, is(big(1_000_000)));
        assertThat(a.roiBasisPoints, is(800));
        assertThat(a.termMonths, is(36));
        assertThat(a.reserveBalance, is(BigInteger.ZERO));
        assertThat(a.gracePeriodDays, is(30));
        assertThat(a.defaultPenaltyRate, is(200));
        assertThat(a.defaultThreshold, is(3));
        assertThat(a.allowPartialRepayments, is(true));
        assertThat(a.allowEarlyRepayment, is(true));
        assertThat(a.active, is(true));

        Notification n = runtime.getLastNotification(YieldAgreementRegistry.AGREEMENT_CREATED);
        assertThat(n.getState().get(0), is(1));
    }

    @Test
    public void fail_creating_agreement_with_invalid_terms_or_by_non_owner() {
        ContractException e = assertThrows(ContractException.class,
                () -> runtime.send(OWNER, () -> registry.createAgreement(BigInteger.ZERO, 800, 36)));
        assertThat(e.getCode(), is(ErrorCode.INVALID_ARGUMENT));

        e = assertThrows(ContractException.class,
                () -> runtime.send(ALICE, () -> registry.createAgreement(big(1), 800, 36)));
        assertThat(e.getCode(), is(ErrorCode.UNAUTHORIZED));
        assertThat(registry.getAgreementCount(), is(1));
    }

    @Test
    public void succeed_updating_agreement_by_governance() {
        runtime.send(GOVERNANCE, () -> {
            registry.setAgreementROI(agreementId, 900);
            registry.setGracePeriodDays(agreementId, 45);
            registry.setDefaultPenaltyRate(agreementId, 500);
            registry.setDefaultThreshold(agreementId, 5);
            registry.setAllowPartialRepayments(agreementId, false);
            registry.setAllowEarlyRepayment(agreementId, false);
        });

        YieldAgreement a = registry.getAgreement(agreementId);
        assertThat(a.roiBasisPoints, is(900));
        assertThat(a.gracePeriodDays, is(45));
        assertThat(a.defaultPenaltyRate, is(500));
        assertThat(a.defaultThreshold, is(5));
        assertThat(a.allowPartialRepayments, is(false));
        assertThat(a.allowEarlyRepayment, is(false));
        assertThat(assertLastEvent(runtime, YieldAgreementRegistry.AGREEMENT_UPDATED).getState().get(1),
                is("setAllowEarlyRepayment"));
    }

    @Test
    public void fail_updating_agreement_by_owner() {
        ContractException e = assertThrows(ContractException.class,
                () -> runtime.send(OWNER, () -> registry.setAgreementROI(agreementId, 900)));
        assertThat(e.getCode(), is(ErrorCode.UNAUTHORIZED));
        assertThat(registry.getAgreement(agreementId).roiBasisPoints, is(800));
    }

    @Test
    public void fail_updating_unknown_agreement() {
        ContractException e = assertThrows(ContractException.class,
                () -> runtime.send(GOVERNANCE, () -> registry.setAgreementROI(5, 900)));
        assertThat(e.getCode(), is(ErrorCode.AGREEMENT_NOT_FOUND));
    }

    @Test
    public void succeed_allocating_and_withdrawing_reserve() {
        runtime.send(OWNER, () -> payment.mint(registry.getScriptHash(), big(5000)));
        runtime.send(GOVERNANCE, () -> registry.allocateReserve(agreementId, big(5000)));
        assertThat(registry.getAgreement(agreementId).reserveBalance, is(big(5000)));

        runtime.send(GOVERNANCE, () -> registry.withdrawReserve(agreementId, big(2000)));

        assertThat(registry.getAgreement(agreementId).reserveBalance, is(big(3000)));
        assertThat(payment.balanceOf(GOVERNANCE), is(big(2000)));
        assertThat(payment.balanceOf(registry.getScriptHash()), is(big(3000)));
        Notification n = assertLastEvent(runtime, YieldAgreementRegistry.RESERVE_WITHDRAWN);
        assertThat(n.getState().get(2), is(big(3000)));
    }

    @Test
    public void fail_withdrawing_more_than_reserve() {
        runtime.send(OWNER, () -> payment.mint(registry.getScriptHash(), big(100)));
        runtime.send(GOVERNANCE, () -> registry.allocateReserve(agreementId, big(100)));

        ContractException e = assertThrows(ContractException.class,
                () -> runtime.send(GOVERNANCE, () -> registry.withdrawReserve(agreementId, big(101))));
        assertThat(e.getCode(), is(ErrorCode.INVALID_ARGUMENT));
        assertThat(registry.getAgreement(agreementId).reserveBalance, is(big(100)));
    }

    @Test
    public void fail_withdrawing_unfunded_reserve() {
        runtime.send(GOVERNANCE, () -> registry.allocateReserve(agreementId, big(100)));

        ContractException e = assertThrows(ContractException.class,
                () -> runtime.send(GOVERNANCE, () -> registry.withdrawReserve(agreementId, big(100))));
        assertThat(e.getCode(), is(ErrorCode.TRANSFER_FAILED));
        assertThat(registry.getAgreement(agreementId).reserveBalance, is(big(100)));
    }

    @Test
    public void fail_changing_stored_agreement_through_returned_copy() {
        YieldAgreement a = registry.getAgreement(agreementId);
        a.roiBasisPoints = 1;
        assertThat(registry.getAgreement(agreementId).roiBasisPoints, is(800));
    }
}
