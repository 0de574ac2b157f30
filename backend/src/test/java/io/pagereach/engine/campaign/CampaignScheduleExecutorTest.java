package io.pagereach.engine.campaign;

import static io.pagereach.engine.campaign.CampaignFixtures.draft;
import static io.pagereach.engine.campaign.CampaignFixtures.running;
import static io.pagereach.engine.campaign.CampaignFixtures.trigger;
import static io.pagereach.engine.campaign.CampaignFixtures.withStatus;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.pagereach.engine.dispatch.DispatchSignals;
import io.pagereach.engine.exception.InvalidStateException;
import io.pagereach.engine.stats.CampaignRecipientRepository;
import io.pagereach.engine.testutil.MutableClock;
import io.pagereach.engine.trigger.TriggerCondition;
import io.pagereach.engine.trigger.TriggerConfig;
import io.pagereach.engine.trigger.TriggerEventType;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CampaignScheduleExecutorTest {

  private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

  @Mock private CampaignRepository campaignRepository;
  @Mock private CampaignRecipientRepository recipientRepository;
  @Mock private CampaignLifecycleService lifecycleService;
  @Mock private CampaignDispatchCoordinator coordinator;

  private CampaignScheduleExecutor executor;

  @BeforeEach
  void setUp() {
    executor =
        new CampaignScheduleExecutor(
            campaignRepository,
            recipientRepository,
            lifecycleService,
            coordinator,
            new DispatchSignals(),
            new MutableClock(NOW));
  }

  @Test
  void launchDueCampaigns_oneFailure_doesNotStopOthers() {
    var failing = withStatus(draft(UUID.randomUUID()), CampaignStatus.SCHEDULED);
    var healthy = withStatus(draft(UUID.randomUUID()), CampaignStatus.SCHEDULED);
    when(campaignRepository.findByStatusAndScheduledAtLessThanEqual(CampaignStatus.SCHEDULED, NOW))
        .thenReturn(List.of(failing, healthy));
    when(lifecycleService.startScheduledRun(failing.getId()))
        .thenThrow(new InvalidStateException("Empty audience", "nobody"));
    when(lifecycleService.startScheduledRun(healthy.getId())).thenReturn(true);

    executor.launchDueCampaigns();

    verify(lifecycleService).startScheduledRun(healthy.getId());
  }

  @Test
  void continueRunningCampaigns_nothingPending_checksCompletion() {
    var campaign = running(UUID.randomUUID(), 5, 5, 0, 0);
    when(campaignRepository.findByStatus(CampaignStatus.RUNNING)).thenReturn(List.of(campaign));
    when(recipientRepository.countByCampaignIdAndRunNumberAndOutcomeIsNull(campaign.getId(), 1))
        .thenReturn(0L);

    executor.continueRunningCampaigns();

    verify(lifecycleService).completeRunIfFinished(campaign.getId());
    verify(coordinator, never()).startPass(any(), anyInt());
  }

  @Test
  void continueRunningCampaigns_deferredRecipientsDue_startsPass() {
    var campaign = running(UUID.randomUUID(), 250, 200, 0, 0);
    when(campaignRepository.findByStatus(CampaignStatus.RUNNING)).thenReturn(List.of(campaign));
    when(recipientRepository.countByCampaignIdAndRunNumberAndOutcomeIsNull(campaign.getId(), 1))
        .thenReturn(50L);
    when(recipientRepository.countDue(campaign.getId(), 1, NOW)).thenReturn(50L);

    executor.continueRunningCampaigns();

    verify(coordinator).startPass(campaign.getId(), 1);
  }

  @Test
  void continueRunningCampaigns_deferralNotExpired_waits() {
    var campaign = running(UUID.randomUUID(), 250, 200, 0, 0);
    when(campaignRepository.findByStatus(CampaignStatus.RUNNING)).thenReturn(List.of(campaign));
    when(recipientRepository.countByCampaignIdAndRunNumberAndOutcomeIsNull(campaign.getId(), 1))
        .thenReturn(50L);
    when(recipientRepository.countDue(campaign.getId(), 1, NOW)).thenReturn(0L);

    executor.continueRunningCampaigns();

    verify(coordinator, never()).startPass(any(), anyInt());
    verify(lifecycleService, never()).completeRunIfFinished(any());
  }

  @Test
  void continueRunningCampaigns_triggerWithDueFirings_startsPassWithoutCompleting() {
    var campaign = triggerCampaign();
    when(campaignRepository.findByStatus(CampaignStatus.RUNNING)).thenReturn(List.of(campaign));
    when(recipientRepository.countDueInAnyRun(campaign.getId(), NOW)).thenReturn(3L);

    executor.continueRunningCampaigns();

    verify(coordinator).startPass(campaign.getId(), campaign.getRunNumber());
    verify(lifecycleService, never()).completeRunIfFinished(any());
  }

  @Test
  void continueRunningCampaigns_idleTrigger_staysRunning() {
    var campaign = triggerCampaign();
    when(campaignRepository.findByStatus(CampaignStatus.RUNNING)).thenReturn(List.of(campaign));
    when(recipientRepository.countDueInAnyRun(campaign.getId(), NOW)).thenReturn(0L);

    executor.continueRunningCampaigns();

    verify(coordinator, never()).startPass(any(), anyInt());
    verify(lifecycleService, never()).completeRunIfFinished(any());
  }

  @Test
  void launchDueCampaigns_skipsTriggerCampaigns() {
    var campaign = triggerCampaign();
    when(campaignRepository.findByStatusAndScheduledAtLessThanEqual(CampaignStatus.SCHEDULED, NOW))
        .thenReturn(List.of(campaign));

    executor.launchDueCampaigns();

    verify(lifecycleService, never()).startScheduledRun(any());
  }

  private static Campaign triggerCampaign() {
    return trigger(
        UUID.randomUUID(),
        CampaignStatus.RUNNING,
        TriggerConfig.defaults(List.of(TriggerCondition.of(TriggerEventType.NEW_CONTACT))));
  }
}
