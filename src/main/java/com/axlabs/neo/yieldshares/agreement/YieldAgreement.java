package com.axlabs.neo.yieldshares.agreement;

import com.axlabs.neo.yieldshares.runtime.Struct;

import java.math.BigInteger;

/**
 * The terms of a yield agreement, i.e., a funded asset position whose yield is shared by the holders of its share
 * token.
 */
public class YieldAgreement implements Struct {

    public int id;

    /**
     * The capital raised for the agreement.
     */
    public BigInteger upfrontCapital;

    /**
     * The yield rate in basis points.
     */
    public int roiBasisPoints;

    public int termMonths;

    /**
     * The funds held in reserve for the agreement.
     */
    public BigInteger reserveBalance;

    public int gracePeriodDays;

    /**
     * The penalty on late repayments in basis points.
     */
    public int defaultPenaltyRate;

    /**
     * The number of missed repayments after which the agreement is in default.
     */
    public int defaultThreshold;

    public boolean allowPartialRepayments;
    public boolean allowEarlyRepayment;
    public boolean active;

    public YieldAgreement(int id, BigInteger upfrontCapital, int roiBasisPoints, int termMonths) {
        this.id = id;
        this.upfrontCapital = upfrontCapital;
        this.roiBasisPoints = roiBasisPoints;
        this.termMonths = termMonths;
        reserveBalance = BigInteger.ZERO;
        gracePeriodDays = 30;
        defaultPenaltyRate = 200;
        defaultThreshold = 3;
        allowPartialRepayments = true;
        allowEarlyRepayment = true;
        active = true;
    }

    @Override
    public YieldAgreement copy() {
        YieldAgreement c = new YieldAgreement(id, upfrontCapital, roiBasisPoints, termMonths);
        c.reserveBalance = reserveBalance;
        c.gracePeriodDays = gracePeriodDays;
        c.defaultPenaltyRate = defaultPenaltyRate;
        c.defaultThreshold = defaultThreshold;
        c.allowPartialRepayments = allowPartialRepayments;
        c.allowEarlyRepayment = allowEarlyRepayment;
        c.active = active;
        return c;
    }
}
