package io.pagereach.engine.stats;

/** Terminal outcome of one recipient in one run. Exactly one is recorded per ledger row. */
public enum RecipientOutcome {
  /** Accepted by the platform; delivery is pending a receipt. */
  SENT,
  FAILED_PERMANENT,
  FAILED_EXHAUSTED,
  /** No legal send method. Counted as a compliance failure, never retried. */
  BLOCKED;

  public boolean isFailure() {
    return this == FAILED_PERMANENT || this == FAILED_EXHAUSTED;
  }
}
