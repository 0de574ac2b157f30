package io.pagereach.engine.dispatch;

/** Receives per-recipient outcomes. Called from worker threads, concurrently. */
@FunctionalInterface
public interface DeliveryListener {

  void onOutcome(DeliveryReport report);
}
