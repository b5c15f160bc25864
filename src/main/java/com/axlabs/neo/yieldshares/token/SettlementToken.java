package com.axlabs.neo.yieldshares.token;

import com.axlabs.neo.yieldshares.ErrorCode;
import com.axlabs.neo.yieldshares.runtime.PaymentReceiver;
import com.axlabs.neo.yieldshares.runtime.Runtime;
import com.axlabs.neo.yieldshares.runtime.SmartContract;
import com.axlabs.neo.yieldshares.runtime.StorageMap;
import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * The fungible token that repayments, reserves and distributions are settled in.
 * <p>
 * {@link #transfer(Hash160, Hash160, BigInteger)} never throws. It returns false if the transfer cannot be made,
 * including when the receiving contract rejects the payment in its {@link PaymentReceiver#onPayment} callback.
 */
public class SettlementToken extends SmartContract {

    public static final String TRANSFER = "Transfer";

    private static final String OWNER_KEY = "owner";
    private static final String TOTAL_SUPPLY_KEY = "totalSupply";

    private final StorageMap balances = storageMap("balances");
    private final StorageMap properties = storageMap("properties");

    public SettlementToken(Runtime runtime, String name, Hash160 owner) {
        super(runtime, name);
        properties.put(OWNER_KEY, owner);
    }

    public BigInteger totalSupply() {
        return properties.getIntOrZero(TOTAL_SUPPLY_KEY);
    }

    public BigInteger balanceOf(Hash160 account) {
        return balances.getIntOrZero(account);
    }

    /**
     * Creates new tokens for {@code to}. Only callable by the token owner.
     *
     * @param to     The receiver.
     * @param amount The amount to create.
     */
    public void mint(Hash160 to, BigInteger amount) {
        invoke("mint", () -> {
            if (!runtime.checkWitness(properties.get(OWNER_KEY, Hash160.class)))
                fireErrorAndAbort(ErrorCode.UNAUTHORIZED, "Not authorised", "mint");
            if (amount.signum() <= 0) fireErrorAndAbort(ErrorCode.INVALID_ARGUMENT, "Invalid amount", "mint");
            balances.put(to, balanceOf(to).add(amount));
            properties.put(TOTAL_SUPPLY_KEY, totalSupply().add(amount));
            fire(TRANSFER, null, to, amount);
        });
    }

    /**
     * Transfers {@code amount} from {@code from} to {@code to}. The invocation has to be witnessed by {@code from}.
     *
     * @param from   The sender.
     * @param to     The receiver.
     * @param amount The amount to transfer.
     * @return true if the tokens were transferred. False otherwise.
     */
    public boolean transfer(Hash160 from, Hash160 to, BigInteger amount) {
        return invoke("transfer", () -> {
            if (amount.signum() < 0 || to == null || Hash160.ZERO.equals(to)) {
                return false;
            }
            if (!runtime.checkWitness(from)) {
                log.debug("Transfer from {} not witnessed", from);
                return false;
            }
            BigInteger fromBalance = balanceOf(from);
            if (fromBalance.compareTo(amount) < 0) {
                return false;
            }
            return attempt(() -> {
                balances.put(from, fromBalance.subtract(amount));
                balances.put(to, balanceOf(to).add(amount));
                fire(TRANSFER, from, to, amount);
                callOnPayment(to, from, amount);
            });
        });
    }
}
