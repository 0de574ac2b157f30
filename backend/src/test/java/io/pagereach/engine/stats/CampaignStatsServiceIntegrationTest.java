package io.pagereach.engine.stats;

import static io.pagereach.engine.campaign.CampaignFixtures.WORKSPACE_ID;
import static io.pagereach.engine.campaign.CampaignFixtures.oneTimeDraft;
import static io.pagereach.engine.campaign.CampaignFixtures.withRun;
import static io.pagereach.engine.campaign.CampaignFixtures.withStatus;
import static org.assertj.core.api.Assertions.assertThat;

import io.pagereach.engine.TestcontainersConfiguration;
import io.pagereach.engine.campaign.Campaign;
import io.pagereach.engine.campaign.CampaignLifecycleService;
import io.pagereach.engine.campaign.CampaignRepository;
import io.pagereach.engine.campaign.CampaignStatus;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.IntFunction;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class CampaignStatsServiceIntegrationTest {

  private static final UUID PAGE_ID = UUID.randomUUID();

  @Autowired private CampaignStatsService statsService;
  @Autowired private CampaignLifecycleService lifecycleService;
  @Autowired private CampaignRepository campaignRepository;
  @Autowired private CampaignRecipientRepository recipientRepository;
  @Autowired private JdbcTemplate jdbcTemplate;

  @Test
  void duplicateReportsForOneRecipient_countOnce() throws Exception {
    var contacts = contactIds(2);
    var campaign = runningCampaign(contacts);
    UUID contactId = contacts.get(0);

    var results =
        concurrently(
            6,
            i -> () -> statsService.record(campaign.getId(), 1, contactId, RecipientOutcome.SENT));

    assertThat(results).filteredOn(Boolean::booleanValue).hasSize(1);
    var reloaded = campaignRepository.findById(campaign.getId()).orElseThrow();
    assertThat(reloaded.getSentCount()).isEqualTo(1);
    assertThat(reloaded.getStatus()).isEqualTo(CampaignStatus.RUNNING);
  }

  @Test
  void counters_neverExceedTotalRecipients() {
    var campaign = runningCampaign(contactIds(1));

    assertThat(campaignRepository.incrementSent(campaign.getId())).isEqualTo(1);
    assertThat(campaignRepository.incrementFailed(campaign.getId())).isZero();
    assertThat(campaignRepository.incrementBlocked(campaign.getId())).isZero();

    var reloaded = campaignRepository.findById(campaign.getId()).orElseThrow();
    assertThat(reloaded.getProcessedCount()).isEqualTo(1);
  }

  @Test
  void lastOutcomesRecordedConcurrently_finishRunExactlyOnce() throws Exception {
    var contacts = contactIds(4);
    var campaign = runningCampaign(contacts);

    var results =
        concurrently(
            4,
            i ->
                () ->
                    statsService.record(
                        campaign.getId(), 1, contacts.get(i), RecipientOutcome.SENT));

    assertThat(results).containsOnly(true);
    var reloaded = campaignRepository.findById(campaign.getId()).orElseThrow();
    assertThat(reloaded.getStatus()).isEqualTo(CampaignStatus.COMPLETED);
    assertThat(reloaded.getSentCount()).isEqualTo(4);
    assertThat(reloaded.getCompletedAt()).isNotNull();
    assertThat(lifecycleService.completeRunIfFinished(campaign.getId())).isFalse();
    assertThat(auditCount(campaign.getId(), "campaign.completed")).isEqualTo(1);
  }

  private Campaign runningCampaign(List<UUID> contactIds) {
    var campaign = new Campaign(WORKSPACE_ID, oneTimeDraft("Stats " + UUID.randomUUID()));
    withRun(withStatus(campaign, CampaignStatus.RUNNING), 1, contactIds.size(), 0, 0, 0);
    var saved = campaignRepository.saveAndFlush(campaign);
    recipientRepository.saveAllAndFlush(
        IntStream.range(0, contactIds.size())
            .mapToObj(
                i ->
                    new CampaignRecipient(
                        saved.getId(), 1, i + 1, contactIds.get(i), PAGE_ID, null))
            .toList());
    return saved;
  }

  private long auditCount(UUID campaignId, String eventType) {
    return jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM audit_events WHERE entity_id = ? AND event_type = ?",
        Long.class,
        campaignId,
        eventType);
  }

  private static List<UUID> contactIds(int count) {
    return IntStream.range(0, count).mapToObj(i -> UUID.randomUUID()).toList();
  }

  private static List<Boolean> concurrently(int threads, IntFunction<BooleanSupplier> task)
      throws Exception {
    var latch = new CountDownLatch(1);
    var results = new ConcurrentLinkedQueue<Boolean>();
    var errors = new ConcurrentLinkedQueue<Throwable>();
    var executor = Executors.newFixedThreadPool(threads);
    for (int i = 0; i < threads; i++) {
      var call = task.apply(i);
      executor.submit(
          () -> {
            try {
              latch.await();
              results.add(call.getAsBoolean());
            } catch (Exception e) {
              errors.add(e);
            }
          });
    }
    latch.countDown();

    executor.shutdown();
    assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
    assertThat(errors).isEmpty();
    return List.copyOf(results);
  }
}
