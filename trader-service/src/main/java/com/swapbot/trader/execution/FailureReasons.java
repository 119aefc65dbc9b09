package com.swapbot.trader.execution;

import com.swapbot.http.ExternalCallException;

/**
 * Operator-facing wording for external failures.
 */
public final class FailureReasons {

    private FailureReasons() {
    }

    public static String describe(String step, ExternalCallException e) {
        return switch (e.category()) {
            case THROTTLE -> step + " was rate limited, try again later";
            case TRANSIENT_NETWORK -> step + " failed: service unreachable";
            case FATAL_AUTHORIZATION -> step + " was not authorized";
            case DOMAIN_VALIDATION -> step + " was rejected";
        };
    }
}
