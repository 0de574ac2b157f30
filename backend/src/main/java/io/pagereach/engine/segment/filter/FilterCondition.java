package io.pagereach.engine.segment.filter;

/**
 * A predicate on one contact field.
 *
 * @param field base field name, a virtual field, or a custom-field key
 * @param customFieldKey key to read when {@code field} is {@code customField}
 * @param value comparison operand; a two-element list for BETWEEN, a list for IN / NOT_IN, a day
 *     count for WITHIN_LAST_DAYS
 * @param not inverts this condition's result
 */
public record FilterCondition(
    String field, String customFieldKey, FilterOperator operator, Object value, boolean not)
    implements FilterNode {

  public static FilterCondition of(String field, FilterOperator operator, Object value) {
    return new FilterCondition(field, null, operator, value, false);
  }

  public FilterCondition negated() {
    return new FilterCondition(field, customFieldKey, operator, value, !not);
  }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) {
    return visitor.visitCondition(this);
  }
}
