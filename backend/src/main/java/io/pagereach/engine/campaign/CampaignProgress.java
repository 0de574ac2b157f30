package io.pagereach.engine.campaign;

import java.util.UUID;

/**
 * Point-in-time counters of a campaign. Counters are cumulative across runs.
 *
 * @param pending recipients without a terminal outcome yet
 * @param percent processed share of {@code total}, 0-100
 */
public record CampaignProgress(
    UUID campaignId,
    CampaignStatus status,
    int runNumber,
    int total,
    int sent,
    int delivered,
    int failed,
    int blocked,
    int opened,
    int clicked,
    int replied,
    int unsubscribed,
    int pending,
    double percent) {

  public static CampaignProgress of(Campaign campaign) {
    int total = campaign.getTotalRecipients();
    int processed = campaign.getProcessedCount();
    return new CampaignProgress(
        campaign.getId(),
        campaign.getStatus(),
        campaign.getRunNumber(),
        total,
        campaign.getSentCount(),
        campaign.getDeliveredCount(),
        campaign.getFailedCount(),
        campaign.getBlockedCount(),
        campaign.getOpenedCount(),
        campaign.getClickedCount(),
        campaign.getRepliedCount(),
        campaign.getUnsubscribedCount(),
        Math.max(0, total - processed),
        total == 0 ? 0.0 : Math.min(100.0, processed * 100.0 / total));
  }

  public double deliveryRate() {
    return rate(delivered, sent);
  }

  public double openRate() {
    return rate(opened, sent);
  }

  public double clickRate() {
    return rate(clicked, sent);
  }

  public double replyRate() {
    return rate(replied, sent);
  }

  static double rate(int numerator, int denominator) {
    return denominator == 0 ? 0.0 : (double) numerator / denominator;
  }
}
