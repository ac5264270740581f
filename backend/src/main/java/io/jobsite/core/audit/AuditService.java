package io.jobsite.core.audit;

import java.util.List;
import java.util.UUID;

/** Records and reads audit events. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   */
  void log(AuditEventRecord record);

  /** Events recorded for one entity, newest first. */
  List<AuditEvent> findForEntity(String entityType, UUID entityId);
}
