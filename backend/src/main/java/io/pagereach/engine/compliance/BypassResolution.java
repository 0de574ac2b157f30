package io.pagereach.engine.compliance;

import java.util.UUID;

/**
 * Outcome of bypass resolution for one recipient.
 *
 * @param method the legal method, or {@link BypassMethod#BLOCKED}
 * @param messageTag tag to attach for tag sends; null otherwise
 * @param artifactId reserved OTN token or recurring subscription; null for artifact-free methods
 * @param artifactValue platform token the transport must present with the send
 * @param reservationKey key the artifact is reserved under
 * @param blockReason why no method was legal; null unless blocked
 */
public record BypassResolution(
    BypassMethod method,
    MessageTag messageTag,
    UUID artifactId,
    String artifactValue,
    String reservationKey,
    String blockReason) {

  public static BypassResolution withinWindow() {
    return new BypassResolution(BypassMethod.WITHIN_WINDOW, null, null, null, null, null);
  }

  public static BypassResolution tagged(MessageTag tag) {
    return new BypassResolution(tag.bypassMethod(), tag, null, null, null, null);
  }

  public static BypassResolution sponsored() {
    return new BypassResolution(BypassMethod.SPONSORED_MESSAGE, null, null, null, null, null);
  }

  public static BypassResolution reserved(
      BypassMethod method, UUID artifactId, String artifactValue, String reservationKey) {
    return new BypassResolution(method, null, artifactId, artifactValue, reservationKey, null);
  }

  public static BypassResolution blocked(String reason) {
    return new BypassResolution(BypassMethod.BLOCKED, null, null, null, null, reason);
  }

  public boolean isBlocked() {
    return method == BypassMethod.BLOCKED;
  }
}
