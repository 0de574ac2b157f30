package io.pagereach.engine.segment.filter;

public enum FilterLogic {
  AND,
  OR
}
