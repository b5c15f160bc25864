package com.axlabs.neo.yieldshares.ledger;

import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.Objects;

/**
 * The balance of one shareholder at the time a ledger snapshot was taken.
 */
public class Holding {

    private final Hash160 account;
    private final BigInteger balance;

    public Holding(Hash160 account, BigInteger balance) {
        this.account = account;
        this.balance = balance;
    }

    public Hash160 getAccount() {
        return account;
    }

    public BigInteger getBalance() {
        return balance;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Holding)) return false;
        Holding that = (Holding) o;
        return account.equals(that.account) && balance.equals(that.balance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(account, balance);
    }

    @Override
    public String toString() {
        return account + "=" + balance;
    }
}
