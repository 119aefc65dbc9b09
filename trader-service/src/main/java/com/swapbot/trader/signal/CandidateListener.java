package com.swapbot.trader.signal;

@FunctionalInterface
public interface CandidateListener {

    /**
     * Called on the source's polling thread; must return quickly.
     */
    void onCandidateAsset(CandidateAsset candidate);
}
