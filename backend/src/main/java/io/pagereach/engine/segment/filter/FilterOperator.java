package io.pagereach.engine.segment.filter;

public enum FilterOperator {
  EQUALS,
  NOT_EQUALS,
  CONTAINS,
  NOT_CONTAINS,
  STARTS_WITH,
  ENDS_WITH,
  GREATER_THAN,
  GREATER_THAN_OR_EQUAL,
  LESS_THAN,
  LESS_THAN_OR_EQUAL,
  BETWEEN,
  IN,
  NOT_IN,
  IS_EMPTY,
  IS_NOT_EMPTY,
  IS_TRUE,
  IS_FALSE,
  BEFORE,
  AFTER,
  WITHIN_LAST_DAYS,
  NOT_WITHIN_LAST_DAYS
}
