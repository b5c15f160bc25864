package com.axlabs.neo.yieldshares.runtime;

import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * Implemented by contracts that want to be notified when they receive settlement tokens. Throwing from the
 * callback rejects the payment.
 */
public interface PaymentReceiver {

    void onPayment(Hash160 sender, BigInteger amount);
}
