package io.pagereach.engine.dispatch;

import java.util.UUID;

/**
 * Totals for one dispatch pass.
 *
 * @param stopped whether the pass ended on a pause or cancel signal rather than an empty queue
 * @param skipped whether another pass for the campaign was already active
 */
public record DispatchSummary(
    UUID campaignId,
    int batches,
    int sent,
    int failed,
    int blocked,
    int deferred,
    boolean stopped,
    boolean skipped) {

  static DispatchSummary skipped(UUID campaignId) {
    return new DispatchSummary(campaignId, 0, 0, 0, 0, 0, false, true);
  }

  public int attempted() {
    return sent + failed;
  }
}
