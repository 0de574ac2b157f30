package io.pagereach.engine.stats;

import static io.pagereach.engine.campaign.CampaignFixtures.running;
import static io.pagereach.engine.testutil.TestEntities.withField;
import static io.pagereach.engine.testutil.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.pagereach.engine.audience.AudienceResolver;
import io.pagereach.engine.audit.AuditEventRecord;
import io.pagereach.engine.audit.AuditService;
import io.pagereach.engine.campaign.Campaign;
import io.pagereach.engine.campaign.CampaignLifecycleService;
import io.pagereach.engine.campaign.CampaignRepository;
import io.pagereach.engine.campaign.CampaignStatus;
import io.pagereach.engine.campaign.RunPlanner;
import io.pagereach.engine.campaign.VariantAssigner;
import io.pagereach.engine.dispatch.DispatchSignals;
import io.pagereach.engine.event.CampaignStatusChangedEvent;
import io.pagereach.engine.testutil.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class CampaignStatsServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");
  private static final UUID CAMPAIGN_ID = UUID.randomUUID();

  @Mock private CampaignRecipientRepository recipientRepository;
  @Mock private CampaignRepository campaignRepository;
  @Mock private AudienceResolver audienceResolver;
  @Mock private AuditService auditService;
  @Mock private ApplicationEventPublisher eventPublisher;
  @Mock private PlatformTransactionManager txManager;

  private MutableClock clock;
  private CampaignStatsService service;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    var lifecycle =
        new CampaignLifecycleService(
            campaignRepository,
            recipientRepository,
            audienceResolver,
            new VariantAssigner(),
            new RunPlanner(),
            new DispatchSignals(),
            auditService,
            eventPublisher,
            clock);
    service =
        new CampaignStatsService(
            recipientRepository, campaignRepository, lifecycle, txManager, clock);
  }

  @Test
  void record_duplicateReportsFromManyThreads_completeCampaignExactlyOnce() throws Exception {
    var ledger = new InMemoryLedger(10);
    ledger.install();
    var contacts = new ArrayList<UUID>();
    for (int i = 0; i < 10; i++) {
      contacts.add(UUID.randomUUID());
    }

    // each contact reported three times: 7 sent, 3 failed
    var reports = new ArrayList<Runnable>();
    for (int copy = 0; copy < 3; copy++) {
      for (int i = 0; i < contacts.size(); i++) {
        var outcome = i < 7 ? RecipientOutcome.SENT : RecipientOutcome.FAILED_EXHAUSTED;
        var contactId = contacts.get(i);
        reports.add(() -> service.record(CAMPAIGN_ID, 1, contactId, outcome));
      }
    }
    Collections.shuffle(reports);

    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      var futures = new ArrayList<Future<?>>();
      for (Runnable report : reports) {
        futures.add(pool.submit(report));
      }
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(ledger.sent.get()).isEqualTo(7);
    assertThat(ledger.failed.get()).isEqualTo(3);
    assertThat(ledger.status.get()).isEqualTo(CampaignStatus.COMPLETED);

    var audits = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(audits.capture());
    assertThat(audits.getValue().eventType()).isEqualTo("campaign.completed");
    var events = ArgumentCaptor.forClass(Object.class);
    verify(eventPublisher).publishEvent(events.capture());
    assertThat(((CampaignStatusChangedEvent) events.getValue()).newStatus())
        .isEqualTo("COMPLETED");
  }

  @Test
  void record_sameReportTwice_countsOnce() {
    var ledger = new InMemoryLedger(5);
    ledger.install();
    var contactId = UUID.randomUUID();

    assertThat(service.record(CAMPAIGN_ID, 1, contactId, RecipientOutcome.SENT)).isTrue();
    assertThat(service.record(CAMPAIGN_ID, 1, contactId, RecipientOutcome.FAILED_PERMANENT))
        .isFalse();

    assertThat(ledger.sent.get()).isEqualTo(1);
    assertThat(ledger.failed.get()).isZero();
    verify(campaignRepository, never()).incrementFailed(CAMPAIGN_ID);
  }

  @Test
  void record_blockedOutcome_countsTowardsCompletion() {
    var ledger = new InMemoryLedger(2);
    ledger.install();

    service.record(CAMPAIGN_ID, 1, UUID.randomUUID(), RecipientOutcome.BLOCKED);
    assertThat(ledger.status.get()).isEqualTo(CampaignStatus.RUNNING);
    service.record(CAMPAIGN_ID, 1, UUID.randomUUID(), RecipientOutcome.SENT);

    assertThat(ledger.blocked.get()).isEqualTo(1);
    assertThat(ledger.status.get()).isEqualTo(CampaignStatus.COMPLETED);
  }

  @Test
  void checkCompletion_lifecycleFailure_isContained() {
    when(campaignRepository.findById(CAMPAIGN_ID)).thenThrow(new IllegalStateException("db down"));

    assertThat(service.checkCompletion(CAMPAIGN_ID)).isFalse();
  }

  @Test
  void recordDeliveryReceipts_countsEachRowOnce() {
    var row = sentRow(NOW.minus(Duration.ofMinutes(5)));
    when(recipientRepository.findByPlatformMessageIdIn(List.of("m-1", "m-1-dup")))
        .thenReturn(List.of(row, row));
    when(recipientRepository.markDelivered(row.getId(), NOW, RecipientOutcome.SENT))
        .thenReturn(1)
        .thenReturn(0);

    assertThat(service.recordDeliveryReceipts(List.of("m-1", "m-1-dup"))).isEqualTo(1);
    verify(campaignRepository, times(1)).incrementDelivered(CAMPAIGN_ID);
  }

  @Test
  void recordRead_marksDeliveredAndOpened() {
    var row = sentRow(NOW.minus(Duration.ofHours(1)));
    var contactId = row.getContactId();
    when(recipientRepository.findUnreadUpTo(contactId, RecipientOutcome.SENT, NOW))
        .thenReturn(List.of(row));
    when(recipientRepository.markDelivered(row.getId(), NOW, RecipientOutcome.SENT)).thenReturn(1);
    when(recipientRepository.markRead(row.getId(), NOW, RecipientOutcome.SENT)).thenReturn(1);

    assertThat(service.recordRead(contactId, NOW)).isEqualTo(1);
    verify(campaignRepository).incrementDelivered(CAMPAIGN_ID);
    verify(campaignRepository).incrementOpened(CAMPAIGN_ID);
  }

  @Test
  void recordReply_withinAttributionWindow_countsReply() {
    var row = sentRow(NOW.minus(Duration.ofDays(2)));
    when(recipientRepository.findFirstByContactIdAndOutcomeOrderByCompletedAtDesc(
            row.getContactId(), RecipientOutcome.SENT))
        .thenReturn(Optional.of(row));
    when(recipientRepository.markReplied(row.getId(), NOW, RecipientOutcome.SENT)).thenReturn(1);

    assertThat(service.recordReply(row.getContactId(), NOW)).isTrue();
    verify(campaignRepository).incrementReplied(CAMPAIGN_ID);
  }

  @Test
  void recordReply_afterAttributionWindow_isIgnored() {
    var row = sentRow(NOW.minus(Duration.ofDays(8)));
    when(recipientRepository.findFirstByContactIdAndOutcomeOrderByCompletedAtDesc(
            row.getContactId(), RecipientOutcome.SENT))
        .thenReturn(Optional.of(row));

    assertThat(service.recordReply(row.getContactId(), NOW)).isFalse();
    verify(recipientRepository, never()).markReplied(any(), any(), any());
    verify(campaignRepository, never()).incrementReplied(any());
  }

  @Test
  void recordEngagement_clickOnLatestRun_countsOnce() {
    var row = sentRow(NOW.minus(Duration.ofHours(3)));
    when(recipientRepository.findFirstByCampaignIdAndContactIdOrderByRunNumberDesc(
            CAMPAIGN_ID, row.getContactId()))
        .thenReturn(Optional.of(row));
    when(recipientRepository.markClicked(row.getId(), NOW, RecipientOutcome.SENT))
        .thenReturn(1)
        .thenReturn(0);

    assertThat(service.recordEngagement(CAMPAIGN_ID, row.getContactId(), EngagementType.CLICKED))
        .isTrue();
    assertThat(service.recordEngagement(CAMPAIGN_ID, row.getContactId(), EngagementType.CLICKED))
        .isFalse();
    verify(campaignRepository, times(1)).incrementClicked(CAMPAIGN_ID);
  }

  private static CampaignRecipient sentRow(Instant completedAt) {
    var row =
        withId(
            new CampaignRecipient(CAMPAIGN_ID, 1, 1, UUID.randomUUID(), UUID.randomUUID(), null),
            UUID.randomUUID());
    withField(row, "outcome", RecipientOutcome.SENT);
    return withField(row, "completedAt", completedAt);
  }

  /**
   * Stands in for the guarded UPDATE statements: the outcome claim is a putIfAbsent on the ledger
   * key, the counter increments are bounded by the total and finishing a run is a status CAS.
   */
  private final class InMemoryLedger {

    private final int total;
    private final Map<UUID, RecipientOutcome> outcomes = new ConcurrentHashMap<>();
    private final AtomicInteger sent = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger blocked = new AtomicInteger();
    private final AtomicReference<CampaignStatus> status =
        new AtomicReference<>(CampaignStatus.RUNNING);

    private InMemoryLedger(int total) {
      this.total = total;
    }

    void install() {
      when(recipientRepository.recordOutcome(
              eq(CAMPAIGN_ID),
              eq(1),
              any(UUID.class),
              any(RecipientOutcome.class),
              any(),
              any(),
              any(),
              any(),
              any(),
              any(),
              anyInt(),
              any(Instant.class)))
          .thenAnswer(
              invocation -> {
                UUID contactId = invocation.getArgument(2);
                RecipientOutcome outcome = invocation.getArgument(3);
                return outcomes.putIfAbsent(contactId, outcome) == null ? 1 : 0;
              });
      lenient()
          .when(campaignRepository.incrementSent(CAMPAIGN_ID))
          .thenAnswer(invocation -> increment(sent));
      lenient()
          .when(campaignRepository.incrementFailed(CAMPAIGN_ID))
          .thenAnswer(invocation -> increment(failed));
      lenient()
          .when(campaignRepository.incrementBlocked(CAMPAIGN_ID))
          .thenAnswer(invocation -> increment(blocked));
      when(campaignRepository.findById(CAMPAIGN_ID)).thenAnswer(invocation -> snapshot());
      lenient()
          .when(
              campaignRepository.finishRun(
                  eq(CAMPAIGN_ID), eq(1), eq(CampaignStatus.RUNNING), any(), any(), any(), any()))
          .thenAnswer(
              invocation ->
                  processed() >= total
                          && status.compareAndSet(
                              CampaignStatus.RUNNING, invocation.getArgument(3))
                      ? 1
                      : 0);
    }

    private synchronized int increment(AtomicInteger counter) {
      if (processed() >= total) {
        return 0;
      }
      counter.incrementAndGet();
      return 1;
    }

    private synchronized int processed() {
      return sent.get() + failed.get() + blocked.get();
    }

    private synchronized Optional<Campaign> snapshot() {
      var campaign = running(CAMPAIGN_ID, total, sent.get(), failed.get(), blocked.get());
      withField(campaign, "status", status.get());
      return Optional.of(campaign);
    }
  }
}
