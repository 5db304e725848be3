package io.b2mash.rental.leaseflow.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.rental.leaseflow.contract.Actor;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class DatabaseAuditServiceTest {

  private static final Instant NOW = Instant.parse("2026-10-01T10:00:00.123456789Z");
  private static final UUID CONTRACT_ID = UUID.randomUUID();

  @Mock private AuditEventRepository auditEventRepository;

  private DatabaseAuditService service;

  @BeforeEach
  void setUp() {
    service = new DatabaseAuditService(auditEventRepository, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void log_firstEntry_startsChainAtOne() {
    when(auditEventRepository.findFirstByContractIdOrderBySequenceNumberDesc(CONTRACT_ID))
        .thenReturn(Optional.empty());

    service.log(record("contract.created"));

    var saved = ArgumentCaptor.forClass(AuditEvent.class);
    verify(auditEventRepository).save(saved.capture());
    assertThat(saved.getValue().getSequenceNumber()).isEqualTo(1);
    assertThat(saved.getValue().getPreviousHash()).isNull();
    assertThat(saved.getValue().getOccurredAt())
        .isEqualTo(Instant.parse("2026-10-01T10:00:00.123456Z"));
    assertThat(saved.getValue().hasValidHash()).isTrue();
  }

  @Test
  void log_nextEntry_linksToPreviousHash() {
    var previous = new AuditEvent(record("contract.created"), 7, null, NOW);
    when(auditEventRepository.findFirstByContractIdOrderBySequenceNumberDesc(CONTRACT_ID))
        .thenReturn(Optional.of(previous));

    service.log(record("contract.status_changed"));

    var saved = ArgumentCaptor.forClass(AuditEvent.class);
    verify(auditEventRepository).save(saved.capture());
    assertThat(saved.getValue().getSequenceNumber()).isEqualTo(8);
    assertThat(saved.getValue().getPreviousHash()).isEqualTo(previous.getIntegrityHash());
  }

  @Test
  void log_withoutContract_isRejected() {
    var record =
        AuditEventBuilder.builder()
            .eventType("contract.created")
            .entityType("contract")
            .entityId(UUID.randomUUID())
            .build();

    assertThatThrownBy(() -> service.log(record)).isInstanceOf(NullPointerException.class);
  }

  @Test
  void findFirstTamperedEntry_intactChain_returnsNull() {
    assertThat(service.findFirstTamperedEntry(chain(3))).isNull();
  }

  @Test
  void findFirstTamperedEntry_editedDetails_isDetected() {
    var history = chain(3);
    ReflectionTestUtils.setField(history.get(1), "details", Map.of("to", "ACTIVE"));

    assertThat(service.findFirstTamperedEntry(history)).isSameAs(history.get(1));
  }

  @Test
  void findFirstTamperedEntry_removedEntry_isDetected() {
    var history = chain(3);
    var gap = List.of(history.get(0), history.get(2));

    assertThat(service.findFirstTamperedEntry(gap)).isSameAs(history.get(2));
  }

  @Test
  void builder_skipsNullDetailsAndDefaultsToSystem() {
    var record =
        AuditEventBuilder.builder()
            .eventType("invitation.expired")
            .entityType("invitation")
            .entityId(UUID.randomUUID())
            .contractId(CONTRACT_ID)
            .detail("kept", 1)
            .detail("dropped", null)
            .build();

    assertThat(record.actorType()).isEqualTo(AuditEventBuilder.SYSTEM_ACTOR);
    assertThat(record.source()).isEqualTo("INTERNAL");
    assertThat(record.details()).containsOnlyKeys("kept");
  }

  private List<AuditEvent> chain(int length) {
    var entries = new ArrayList<AuditEvent>();
    String previousHash = null;
    for (int i = 1; i <= length; i++) {
      var entry = new AuditEvent(record("step." + i), i, previousHash, NOW.plusSeconds(i));
      entries.add(entry);
      previousHash = entry.getIntegrityHash();
    }
    return entries;
  }

  private static AuditEventRecord record(String eventType) {
    return AuditEventBuilder.builder()
        .eventType(eventType)
        .entityType("contract")
        .entityId(CONTRACT_ID)
        .contractId(CONTRACT_ID)
        .actor(Actor.landlord(UUID.fromString("00000000-0000-0000-0000-00000000000a")))
        .detail("to", "TENANT_REVIEW")
        .build();
  }
}
