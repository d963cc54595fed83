package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.audit.AuditActionKind;
import ca.gc.cra.warden.domain.audit.AuditRecord;
import java.util.List;

/**
 * Port querying the platform's audit log.
 *
 * <p>Audit entries are written asynchronously by the platform and can lag the event that caused them by a few
 * seconds; callers are expected to wait briefly before querying.</p>
 *
 * @since 0.1.0
 */
public interface AuditDirectoryPort {

  /**
   * Returns the most recent audit records of one kind, newest first.
   *
   * @param communityId community identifier
   * @param kind action category to query
   * @param limit maximum number of records to return; must be positive
   * @return up to {@code limit} records, newest first
   * @throws GatewayException on permission or transport failures
   */
  List<AuditRecord> recent(long communityId, AuditActionKind kind, int limit) throws GatewayException;
}
