package io.pagereach.engine.audience;

public enum AudienceType {
  ALL,
  SEGMENT,
  PAGES,
  MANUAL,
  /** Contact ids produced by an upstream CSV import; resolves like MANUAL. */
  CSV
}
