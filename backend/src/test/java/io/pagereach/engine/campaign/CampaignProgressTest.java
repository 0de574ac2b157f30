package io.pagereach.engine.campaign;

import static io.pagereach.engine.campaign.CampaignFixtures.draft;
import static io.pagereach.engine.campaign.CampaignFixtures.running;
import static io.pagereach.engine.testutil.TestEntities.withField;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class CampaignProgressTest {

  @Test
  void of_partiallyProcessedRun_reportsPendingAndPercent() {
    var campaign = running(UUID.randomUUID(), 250, 190, 6, 4);
    withField(campaign, "deliveredCount", 95);

    var progress = CampaignProgress.of(campaign);

    assertThat(progress.pending()).isEqualTo(50);
    assertThat(progress.percent()).isEqualTo(80.0);
    assertThat(progress.deliveryRate()).isEqualTo(0.5);
  }

  @Test
  void of_draftWithoutRecipients_isZero() {
    var progress = CampaignProgress.of(draft(UUID.randomUUID()));

    assertThat(progress.percent()).isZero();
    assertThat(progress.pending()).isZero();
    assertThat(progress.replyRate()).isZero();
  }
}
