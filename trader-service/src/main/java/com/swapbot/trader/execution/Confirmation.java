package com.swapbot.trader.execution;

/**
 * What became of a submitted transaction while it was being followed.
 */
public enum Confirmation {
    /** Reached confirmed or finalized commitment without an error. */
    LANDED,
    /** Landed with an execution error. */
    FAILED,
    /** The blockhash expired and the transaction can no longer land. */
    EXPIRED,
    /** Still pending when the status checks ran out. */
    UNKNOWN
}
