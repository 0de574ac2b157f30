package io.pagereach.engine.trigger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import io.pagereach.engine.TestcontainersConfiguration;
import io.pagereach.engine.audience.AudienceDescriptor;
import io.pagereach.engine.audience.AudienceType;
import io.pagereach.engine.campaign.Campaign;
import io.pagereach.engine.campaign.CampaignDraft;
import io.pagereach.engine.campaign.CampaignRepository;
import io.pagereach.engine.campaign.CampaignService;
import io.pagereach.engine.campaign.CampaignStatus;
import io.pagereach.engine.campaign.CampaignType;
import io.pagereach.engine.contact.Contact;
import io.pagereach.engine.contact.ContactRepository;
import io.pagereach.engine.integration.messaging.MessageContent;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
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
class TriggerCampaignIntegrationTest {

  private static final int THREADS = 5;

  @Autowired private TriggerCampaignService triggerService;
  @Autowired private CampaignService campaignService;
  @Autowired private CampaignRepository campaignRepository;
  @Autowired private ContactRepository contactRepository;
  @Autowired private JdbcTemplate jdbcTemplate;

  @Test
  void newContactEvent_firesAndDeliversToTheContact() {
    var workspaceId = UUID.randomUUID();
    var campaign =
        activeTrigger(workspaceId, TriggerConfig.defaults(List.of(newContactCondition())));
    var contact = inWindowContact(workspaceId);

    var fired = triggerService.evaluateContactEvent(newContactEvent(contact));

    assertThat(fired).containsExactly(campaign.getId());
    await()
        .atMost(Duration.ofSeconds(30))
        .untilAsserted(
            () ->
                assertThat(campaignRepository.findById(campaign.getId()))
                    .get()
                    .extracting(Campaign::getSentCount)
                    .isEqualTo(1));
    assertThat(campaignRepository.findStatusById(campaign.getId()))
        .contains(CampaignStatus.RUNNING);
    assertThat(triggerService.getTriggerStats(campaign.getId()).totalTriggered()).isEqualTo(1L);
  }

  @Test
  void concurrentEvents_unlimitedTrigger_recordOneFiringPerOrdinal() throws Exception {
    var workspaceId = UUID.randomUUID();
    var campaign =
        activeTrigger(
            workspaceId, new TriggerConfig(List.of(newContactCondition()), true, 0, 0));
    var contact = inWindowContact(workspaceId);

    var results = fireConcurrently(newContactEvent(contact));

    assertThat(results).hasSize(THREADS).allSatisfy(ids -> assertThat(ids).hasSize(1));
    assertThat(firingOrdinals(campaign.getId(), contact.getId()))
        .containsExactly(1, 2, 3, 4, 5);
    assertThat(campaignRepository.findById(campaign.getId()))
        .get()
        .extracting(Campaign::getTotalRecipients)
        .isEqualTo(THREADS);
  }

  @Test
  void concurrentEvents_defaultLimits_recordASingleFiring() throws Exception {
    var workspaceId = UUID.randomUUID();
    var campaign =
        activeTrigger(workspaceId, TriggerConfig.defaults(List.of(newContactCondition())));
    var contact = inWindowContact(workspaceId);

    var results = fireConcurrently(newContactEvent(contact));

    assertThat(results.stream().filter(ids -> !ids.isEmpty())).hasSize(1);
    assertThat(firingOrdinals(campaign.getId(), contact.getId())).containsExactly(1);
  }

  private ConcurrentLinkedQueue<List<UUID>> fireConcurrently(TriggerEvent event)
      throws InterruptedException {
    var latch = new CountDownLatch(1);
    var results = new ConcurrentLinkedQueue<List<UUID>>();
    var errors = new ConcurrentLinkedQueue<Throwable>();
    var executor = Executors.newFixedThreadPool(THREADS);
    for (int i = 0; i < THREADS; i++) {
      executor.submit(
          () -> {
            try {
              latch.await();
              results.add(triggerService.evaluateContactEvent(event));
            } catch (Throwable t) {
              errors.add(t);
            }
          });
    }
    latch.countDown();
    executor.shutdown();
    assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
    assertThat(errors).isEmpty();
    return results;
  }

  private List<Integer> firingOrdinals(UUID campaignId, UUID contactId) {
    return jdbcTemplate.queryForList(
        "SELECT run_number FROM campaign_recipients"
            + " WHERE campaign_id = ? AND contact_id = ? ORDER BY run_number",
        Integer.class,
        campaignId,
        contactId);
  }

  private Campaign activeTrigger(UUID workspaceId, TriggerConfig config) {
    var draft =
        campaignService.createDraft(
            workspaceId,
            new CampaignDraft(
                "Welcome",
                null,
                CampaignType.TRIGGER,
                new AudienceDescriptor(workspaceId, AudienceType.ALL, null, List.of(), List.of()),
                MessageContent.text("Thanks for reaching out"),
                null,
                null,
                false,
                null,
                null,
                null,
                List.of(),
                List.of(),
                null));
    triggerService.configure(draft.getId(), config);
    return triggerService.activateTrigger(draft.getId());
  }

  private Contact inWindowContact(UUID workspaceId) {
    var contact = new Contact(workspaceId, UUID.randomUUID(), "psid-" + UUID.randomUUID());
    contact.setLastMessageFromContactAt(Instant.now().minus(Duration.ofMinutes(5)));
    return contactRepository.saveAndFlush(contact);
  }

  private static TriggerCondition newContactCondition() {
    return TriggerCondition.of(TriggerEventType.NEW_CONTACT);
  }

  private static TriggerEvent newContactEvent(Contact contact) {
    return TriggerEvent.of(contact.getId(), TriggerEventType.NEW_CONTACT);
  }
}
