package io.pagereach.engine.campaign;

/**
 * Campaign lifecycle status. Enforces valid state transitions.
 *
 * <p>Valid transitions:
 *
 * <ul>
 *   <li>DRAFT → SCHEDULED (explicit schedule)
 *   <li>DRAFT, SCHEDULED → RUNNING (launch or due run)
 *   <li>SCHEDULED → CANCELLED
 *   <li>RUNNING → PAUSED, CANCELLED, COMPLETED
 *   <li>RUNNING → SCHEDULED (a run of a recurring or drip campaign finished, more runs follow)
 *   <li>PAUSED → RUNNING (resume), CANCELLED
 *   <li>COMPLETED and CANCELLED are terminal
 * </ul>
 */
public enum CampaignStatus {
  DRAFT,
  SCHEDULED,
  RUNNING,
  PAUSED,
  COMPLETED,
  CANCELLED;

  public boolean canTransitionTo(CampaignStatus target) {
    return switch (this) {
      case DRAFT -> target == SCHEDULED || target == RUNNING;
      case SCHEDULED -> target == RUNNING || target == CANCELLED;
      case RUNNING ->
          target == PAUSED || target == CANCELLED || target == COMPLETED || target == SCHEDULED;
      case PAUSED -> target == RUNNING || target == CANCELLED;
      case COMPLETED, CANCELLED -> false; // Terminal states
    };
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED;
  }
}
