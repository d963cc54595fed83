package ca.gc.cra.warden.testutil;

import ca.gc.cra.warden.application.port.AuditDirectoryPort;
import ca.gc.cra.warden.application.port.GatewayErrorKind;
import ca.gc.cra.warden.application.port.GatewayException;
import ca.gc.cra.warden.domain.audit.AuditActionKind;
import ca.gc.cra.warden.domain.audit.AuditRecord;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * In-memory audit log. Records are returned newest first; pages can be queued to change what later queries see.
 */
public final class FakeAuditDirectory implements AuditDirectoryPort {
  private final Map<AuditActionKind, List<AuditRecord>> records = new EnumMap<>(AuditActionKind.class);
  private final Map<AuditActionKind, Deque<List<AuditRecord>>> scripted = new EnumMap<>(AuditActionKind.class);
  private final List<Integer> limits = new ArrayList<>();
  private GatewayErrorKind failure;
  private int calls;

  public static AuditRecord record(
      long recordId, AuditActionKind kind, long actorId, long targetId, Instant createdAt) {
    return new AuditRecord(recordId, kind, OptionalLong.of(actorId), OptionalLong.of(targetId), createdAt);
  }

  /** Adds a record in front of the existing ones (newest first). */
  public synchronized FakeAuditDirectory add(AuditRecord record) {
    records.computeIfAbsent(record.kind(), k -> new ArrayList<>()).add(0, record);
    return this;
  }

  /** Queues a page returned by the next query for {@code kind}, ahead of the stored records. */
  public synchronized FakeAuditDirectory enqueuePage(AuditActionKind kind, List<AuditRecord> page) {
    scripted.computeIfAbsent(kind, k -> new ArrayDeque<>()).addLast(List.copyOf(page));
    return this;
  }

  public synchronized void failWith(GatewayErrorKind kind) {
    this.failure = kind;
  }

  @Override
  public synchronized List<AuditRecord> recent(long communityId, AuditActionKind kind, int limit)
      throws GatewayException {
    calls++;
    limits.add(limit);
    if (failure != null) {
      throw new GatewayException(failure, "audit log unavailable");
    }
    Deque<List<AuditRecord>> queue = scripted.get(kind);
    List<AuditRecord> source = queue != null && !queue.isEmpty()
        ? queue.removeFirst()
        : records.getOrDefault(kind, List.of());
    return List.copyOf(source.subList(0, Math.min(limit, source.size())));
  }

  public synchronized int calls() {
    return calls;
  }

  public synchronized List<Integer> limits() {
    return List.copyOf(limits);
  }
}
