package com.swapbot.trader.execution;

/**
 * Signs an unsigned, base64 encoded transaction with the wallet key. Required in LIVE mode.
 */
@FunctionalInterface
public interface TransactionSigner {

    String sign(String unsignedTransactionBase64);
}
