package io.pagereach.engine.segment;

public enum SegmentType {
  /** Membership is the result of evaluating the filter tree. */
  DYNAMIC,
  /** Membership is an explicit contact list. */
  STATIC
}
