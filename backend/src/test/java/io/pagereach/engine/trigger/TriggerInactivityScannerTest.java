package io.pagereach.engine.trigger;

import static io.pagereach.engine.campaign.CampaignFixtures.WORKSPACE_ID;
import static io.pagereach.engine.campaign.CampaignFixtures.trigger;
import static io.pagereach.engine.testutil.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.pagereach.engine.campaign.CampaignRepository;
import io.pagereach.engine.campaign.CampaignStatus;
import io.pagereach.engine.campaign.CampaignType;
import io.pagereach.engine.contact.Contact;
import io.pagereach.engine.contact.ContactRepository;
import io.pagereach.engine.testutil.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
class TriggerInactivityScannerTest {

  private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");
  private static final UUID CAMPAIGN_ID = UUID.randomUUID();
  private static final UUID PAGE_ID = UUID.randomUUID();

  @Mock private CampaignRepository campaignRepository;
  @Mock private ContactRepository contactRepository;
  @Mock private TriggerCampaignService triggerService;

  private TriggerInactivityScanner scanner;

  @BeforeEach
  void setUp() {
    scanner =
        new TriggerInactivityScanner(
            campaignRepository, contactRepository, triggerService, new MutableClock(NOW), 2);
  }

  @Test
  void scan_pagesThroughCandidatesFromShortestInactivityPeriod() {
    var config =
        new TriggerConfig(
            List.of(TriggerCondition.inactivity(7), TriggerCondition.inactivity(3)), false, 0, 2);
    var campaign = trigger(CAMPAIGN_ID, CampaignStatus.RUNNING, config);
    var first = contact();
    var second = contact();
    var third = contact();
    var cutoff = NOW.minus(Duration.ofDays(3));
    when(contactRepository.findInactiveTriggerCandidates(
            WORKSPACE_ID, CAMPAIGN_ID, cutoff, 2L, PageRequest.of(0, 2)))
        .thenReturn(List.of(first, second));
    when(contactRepository.findInactiveTriggerCandidates(
            WORKSPACE_ID, CAMPAIGN_ID, cutoff, 2L, PageRequest.of(1, 2)))
        .thenReturn(List.of(third));
    when(triggerService.fireIfMatches(eq(campaign), any(), any())).thenReturn(true, false, true);

    assertThat(scanner.scan(campaign, config)).isEqualTo(2);
    verify(triggerService)
        .fireIfMatches(
            campaign, TriggerEvent.of(third.getId(), TriggerEventType.INACTIVITY), third);
  }

  @Test
  void scan_skipsCampaignsWithoutInactivityCondition() {
    var tagOnly =
        trigger(
            CAMPAIGN_ID,
            CampaignStatus.RUNNING,
            TriggerConfig.defaults(
                List.of(TriggerCondition.tag(TriggerEventType.TAG_ADDED, "vip"))));
    when(campaignRepository.findByTypeAndStatus(CampaignType.TRIGGER, CampaignStatus.RUNNING))
        .thenReturn(List.of(tagOnly));

    scanner.scan();

    verify(contactRepository, never())
        .findInactiveTriggerCandidates(any(), any(), any(), anyLong(), any());
  }

  @Test
  void scan_failingCampaign_doesNotStopOthers() {
    var config = TriggerConfig.defaults(List.of(TriggerCondition.inactivity(7)));
    var failing = trigger(UUID.randomUUID(), CampaignStatus.RUNNING, config);
    var healthy = trigger(CAMPAIGN_ID, CampaignStatus.RUNNING, config);
    when(campaignRepository.findByTypeAndStatus(CampaignType.TRIGGER, CampaignStatus.RUNNING))
        .thenReturn(List.of(failing, healthy));
    when(contactRepository.findInactiveTriggerCandidates(
            eq(WORKSPACE_ID), eq(failing.getId()), any(), eq(1L), any()))
        .thenThrow(new IllegalStateException("connection reset"));
    var contact = contact();
    when(contactRepository.findInactiveTriggerCandidates(
            eq(WORKSPACE_ID), eq(CAMPAIGN_ID), any(), eq(1L), any()))
        .thenReturn(List.of(contact));

    scanner.scan();

    verify(triggerService)
        .fireIfMatches(
            healthy, TriggerEvent.of(contact.getId(), TriggerEventType.INACTIVITY), contact);
  }

  private static Contact contact() {
    var id = UUID.randomUUID();
    return withId(new Contact(WORKSPACE_ID, PAGE_ID, "psid-" + id), id);
  }
}
