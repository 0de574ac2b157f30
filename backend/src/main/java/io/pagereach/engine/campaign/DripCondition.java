package io.pagereach.engine.campaign;

/** Which recipients of the previous drip step receive the next one. */
public enum DripCondition {
  NONE,
  REPLIED,
  NOT_REPLIED,
  CLICKED,
  NOT_CLICKED
}
