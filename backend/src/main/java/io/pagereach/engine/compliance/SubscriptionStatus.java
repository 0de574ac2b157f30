package io.pagereach.engine.compliance;

public enum SubscriptionStatus {
  PENDING,
  ACTIVE,
  CANCELLED,
  EXPIRED
}
