package io.pagereach.engine.dispatch;

import java.time.Instant;
import java.util.List;

/** Source of recipients for one dispatch pass. */
public interface RecipientQueue {

  /** Next recipients to attempt; empty when the pass should end. */
  List<DispatchTarget> nextBatch(int maxSize);

  /** Puts a recipient back so a later pass retries it no earlier than {@code notBefore}. */
  void defer(DispatchTarget target, Instant notBefore);
}
