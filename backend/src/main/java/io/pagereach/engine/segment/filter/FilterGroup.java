package io.pagereach.engine.segment.filter;

import java.util.List;

/**
 * Combines child nodes with AND or OR. An empty group matches every contact. {@code negate}
 * inverts the combined result.
 */
public record FilterGroup(FilterLogic logic, List<FilterNode> children, boolean negate)
    implements FilterNode {

  public FilterGroup {
    logic = logic != null ? logic : FilterLogic.AND;
    children = children != null ? List.copyOf(children) : List.of();
  }

  public static FilterGroup and(FilterNode... children) {
    return new FilterGroup(FilterLogic.AND, List.of(children), false);
  }

  public static FilterGroup or(FilterNode... children) {
    return new FilterGroup(FilterLogic.OR, List.of(children), false);
  }

  public static FilterGroup matchAll() {
    return new FilterGroup(FilterLogic.AND, List.of(), false);
  }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) {
    return visitor.visitGroup(this);
  }
}
