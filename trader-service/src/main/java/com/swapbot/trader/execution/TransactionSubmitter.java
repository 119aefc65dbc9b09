package com.swapbot.trader.execution;

import com.swapbot.jupiter.SwapTransaction;

/**
 * Settles a swap transaction. Expected to return a failed result rather than throw for rejected transactions.
 */
public interface TransactionSubmitter {

    SubmissionResult submit(SwapTransaction transaction);

    /**
     * Follows a submitted transaction until it lands, fails or expires. Submitters that settle synchronously have
     * nothing to wait for.
     */
    default Confirmation awaitConfirmation(SwapTransaction transaction, String signature) {
        return Confirmation.LANDED;
    }
}
