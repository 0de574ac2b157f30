package io.pagereach.engine.audit;

/** Records campaign lifecycle transitions and bypass usage. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   */
  void log(AuditEventRecord record);
}
