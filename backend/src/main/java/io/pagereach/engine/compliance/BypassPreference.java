package io.pagereach.engine.compliance;

import java.util.ArrayList;
import java.util.List;

/**
 * A campaign's intent regarding out-of-window sends.
 *
 * @param staticMethod when non-null, the only method tried after the 24h window
 * @param messageTag tag the campaign declares; tags are never selected without it
 * @param sponsored whether the campaign is a paid sponsored send
 * @param recurringTopic topic a recurring subscription must match; null accepts any topic
 */
public record BypassPreference(
    BypassMethod staticMethod, MessageTag messageTag, boolean sponsored, String recurringTopic) {

  public static BypassPreference perRecipient() {
    return new BypassPreference(null, null, false, null);
  }

  /** Methods to try, in priority order, once the 24h window is closed. */
  public List<BypassMethod> fallbackMethods() {
    var methods = new ArrayList<BypassMethod>();
    if (staticMethod != null) {
      if (staticMethod != BypassMethod.WITHIN_WINDOW && staticMethod != BypassMethod.BLOCKED) {
        methods.add(staticMethod);
      }
      return methods;
    }
    methods.add(BypassMethod.OTN_TOKEN);
    methods.add(BypassMethod.RECURRING_NOTIFICATION);
    if (messageTag != null) {
      methods.add(messageTag.bypassMethod());
    }
    if (sponsored) {
      methods.add(BypassMethod.SPONSORED_MESSAGE);
    }
    return methods;
  }
}
