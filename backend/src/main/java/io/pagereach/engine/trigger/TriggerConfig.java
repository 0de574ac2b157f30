package io.pagereach.engine.trigger;

import java.util.List;

/**
 * When a trigger campaign fires for a contact.
 *
 * @param matchAll every condition must hold (true) or any one (false)
 * @param cooldownMinutes minimum gap between two firings for the same contact
 * @param maxTriggersPerContact firings per contact over the campaign's life; 0 is unlimited
 */
public record TriggerConfig(
    List<TriggerCondition> conditions,
    boolean matchAll,
    int cooldownMinutes,
    int maxTriggersPerContact) {

  public TriggerConfig {
    conditions = conditions != null ? List.copyOf(conditions) : List.of();
  }

  public static TriggerConfig defaults(List<TriggerCondition> conditions) {
    return new TriggerConfig(conditions, true, 60, 1);
  }

  public boolean hasCondition(TriggerEventType type) {
    return conditions.stream().anyMatch(c -> c.type() == type);
  }
}
