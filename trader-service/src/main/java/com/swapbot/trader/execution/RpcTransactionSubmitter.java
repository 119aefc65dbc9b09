package com.swapbot.trader.execution;

import com.swapbot.http.ExternalCallException;
import com.swapbot.http.Sleeper;
import com.swapbot.jupiter.SwapTransaction;
import com.swapbot.solana.SignatureStatus;
import com.swapbot.solana.SolanaRpcClient;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Signs and sends swaps over JSON-RPC, then follows the signature until it lands or its blockhash expires.
 */
@Slf4j
@RequiredArgsConstructor
public class RpcTransactionSubmitter implements TransactionSubmitter {

    private final @NonNull SolanaRpcClient rpc;
    private final @NonNull TransactionSigner signer;
    private final @NonNull ConfirmationPolicy policy;
    private final @NonNull Sleeper sleeper;

    @Override
    public SubmissionResult submit(SwapTransaction transaction) {
        String signed;
        try {
            signed = signer.sign(transaction.payload());
        } catch (RuntimeException e) {
            log.error("signing failed for swap {} -> {}: {}",
                    transaction.quote().inputMint(), transaction.quote().outputMint(), e.toString());
            return SubmissionResult.failed("transaction could not be signed");
        }
        try {
            String signature = rpc.sendTransaction(signed);
            log.info("submitted swap {} -> {} signature={}",
                    transaction.quote().inputMint(), transaction.quote().outputMint(), signature);
            return SubmissionResult.submitted(signature);
        } catch (ExternalCallException e) {
            log.warn("sendTransaction failed ({}): {}", e.category(), e.getMessage());
            return SubmissionResult.failed(FailureReasons.describe("transaction submission", e));
        }
    }

    @Override
    public Confirmation awaitConfirmation(SwapTransaction transaction, String signature) {
        for (int poll = 1; poll <= policy.maxStatusPolls(); poll++) {
            try {
                Optional<SignatureStatus> status = rpc.getSignatureStatus(signature);
                if (status.isPresent() && status.get().failed()) {
                    log.error("transaction {} failed on chain: {}", signature, status.get().error());
                    return Confirmation.FAILED;
                }
                if (status.isPresent() && status.get().landed()) {
                    log.info("transaction {} {} after {} status check(s)",
                            signature, status.get().confirmationStatus(), poll);
                    return Confirmation.LANDED;
                }
                if (status.isEmpty() && expired(transaction)) {
                    log.warn("transaction {} expired past block height {}", signature, transaction.lastValidBlockHeight());
                    return Confirmation.EXPIRED;
                }
            } catch (ExternalCallException e) {
                log.warn("status check {} for {} failed ({}): {}", poll, signature, e.category(), e.getMessage());
            }
            if (poll < policy.maxStatusPolls()) {
                try {
                    sleeper.sleep(policy.pollInterval());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Confirmation.UNKNOWN;
                }
            }
        }
        log.warn("transaction {} still unconfirmed after {} status checks", signature, policy.maxStatusPolls());
        return Confirmation.UNKNOWN;
    }

    private boolean expired(SwapTransaction transaction) {
        return transaction.lastValidBlockHeight() > 0 && rpc.getBlockHeight() > transaction.lastValidBlockHeight();
    }
}
