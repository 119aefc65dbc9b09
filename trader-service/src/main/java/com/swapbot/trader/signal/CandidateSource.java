package com.swapbot.trader.signal;

import java.time.Duration;
import java.util.List;

/**
 * A place candidates are discovered. Driven by a {@link CandidatePollingDriver}, which calls
 * {@link #initialize()} once, then {@link #extractCandidates()} at {@link #pollInterval()}, then
 * {@link #teardown()} on stop.
 */
public interface CandidateSource {

    String name();

    Duration pollInterval();

    default void initialize() throws Exception {
    }

    List<CandidateAsset> extractCandidates() throws Exception;

    default void teardown() {
    }
}
