package io.pagereach.engine.dispatch;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.stereotype.Component;

/**
 * Registry of active dispatch passes. At most one pass per campaign runs at a time; pause and
 * cancel raise the pass's stop flag, which the dispatcher polls between batches. A pass requested
 * while another is active is folded into the active one, which drains its queue once more before
 * it ends.
 */
@Component
public class DispatchSignals {

  private final ConcurrentMap<UUID, DispatchControl> active = new ConcurrentHashMap<>();

  Optional<DispatchControl> tryStart(UUID campaignId) {
    var control = new DispatchControl(campaignId);
    var current =
        active.compute(
            campaignId,
            (id, existing) -> {
              if (existing == null) {
                return control;
              }
              existing.requestFollowUp();
              return existing;
            });
    return current == control ? Optional.of(control) : Optional.empty();
  }

  /**
   * Ends the pass unless another pass was requested since its queue was last drained. Returns
   * false, and clears the request, when the pass has to drain its queue again.
   */
  boolean finishIfIdle(DispatchControl control) {
    var ended = new AtomicBoolean(true);
    active.computeIfPresent(
        control.campaignId(),
        (id, existing) -> {
          if (existing != control) {
            return existing;
          }
          if (control.takeFollowUp()) {
            ended.set(false);
            return existing;
          }
          return null;
        });
    return ended.get();
  }

  void finish(DispatchControl control) {
    active.remove(control.campaignId(), control);
  }

  /** Asks the campaign's active pass, if any, to stop pulling batches. */
  public void requestStop(UUID campaignId) {
    var control = active.get(campaignId);
    if (control != null) {
      control.stop();
    }
  }

  public boolean isActive(UUID campaignId) {
    return active.containsKey(campaignId);
  }

  static final class DispatchControl {

    private final UUID campaignId;
    private volatile boolean stopRequested;
    private boolean followUpRequested;

    private DispatchControl(UUID campaignId) {
      this.campaignId = campaignId;
    }

    UUID campaignId() {
      return campaignId;
    }

    void stop() {
      this.stopRequested = true;
    }

    boolean isStopRequested() {
      return stopRequested;
    }

    // Both accessed only inside the registry's per-key compute.
    private void requestFollowUp() {
      this.followUpRequested = true;
    }

    private boolean takeFollowUp() {
      boolean requested = followUpRequested;
      followUpRequested = false;
      return requested;
    }
  }
}
