package com.swapbot.solana;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Cluster view of a submitted transaction.
 *
 * @param confirmationStatus {@code processed}, {@code confirmed} or {@code finalized}
 * @param error              the transaction error, {@code null} when it executed successfully
 */
public record SignatureStatus(String signature, String confirmationStatus, JsonNode error) {

  public boolean failed() {
    return error != null && !error.isNull();
  }

  /**
   * Confirmed or finalized without an error.
   */
  public boolean landed() {
    return !failed() && ("confirmed".equals(confirmationStatus) || "finalized".equals(confirmationStatus));
  }
}
