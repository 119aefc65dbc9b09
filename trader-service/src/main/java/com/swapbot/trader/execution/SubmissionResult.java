package com.swapbot.trader.execution;

public record SubmissionResult(boolean success, String signature, String reason) {

    public static SubmissionResult submitted(String signature) {
        return new SubmissionResult(true, signature, null);
    }

    public static SubmissionResult failed(String reason) {
        return new SubmissionResult(false, null, reason);
    }
}
