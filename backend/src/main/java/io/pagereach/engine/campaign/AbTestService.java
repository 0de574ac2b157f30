package io.pagereach.engine.campaign;

import io.pagereach.engine.exception.ResourceNotFoundException;
import io.pagereach.engine.stats.CampaignRecipientRepository;
import io.pagereach.engine.stats.CampaignRecipientRepository.VariantCounts;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Per-variant results and winner selection for A/B campaigns. */
@Service
public class AbTestService {

  private final CampaignRepository campaignRepository;
  private final CampaignRecipientRepository recipientRepository;

  public AbTestService(
      CampaignRepository campaignRepository, CampaignRecipientRepository recipientRepository) {
    this.campaignRepository = campaignRepository;
    this.recipientRepository = recipientRepository;
  }

  /** One result per configured variant, in configuration order; empty for non-A/B campaigns. */
  @Transactional(readOnly = true)
  public List<VariantResult> results(UUID campaignId) {
    var campaign = require(campaignId);
    if (!campaign.isAbTest()) {
      return List.of();
    }
    Map<String, VariantCounts> counts =
        recipientRepository.countByVariant(campaignId).stream()
            .collect(Collectors.toMap(VariantCounts::getVariantName, Function.identity()));
    return campaign.getAbVariants().stream()
        .map(variant -> toResult(variant, counts.get(variant.name())))
        .toList();
  }

  /**
   * The variant with the highest rate for the campaign's winner criterion, DELIVERY when none was
   * set. Variants with nothing sent are not candidates; the earlier variant wins a tie.
   */
  @Transactional(readOnly = true)
  public Optional<VariantResult> winner(UUID campaignId) {
    var campaign = require(campaignId);
    var criteria =
        campaign.getAbWinnerCriteria() != null
            ? campaign.getAbWinnerCriteria()
            : AbWinnerCriteria.DELIVERY;
    return results(campaignId).stream()
        .filter(result -> result.sent() > 0)
        .reduce(
            (best, candidate) ->
                candidate.rateFor(criteria) > best.rateFor(criteria) ? candidate : best);
  }

  private static VariantResult toResult(AbVariant variant, VariantCounts counts) {
    if (counts == null) {
      return new VariantResult(variant.name(), variant.percentage(), 0, 0, 0, 0, 0, 0, 0);
    }
    return new VariantResult(
        variant.name(),
        variant.percentage(),
        counts.getRecipients(),
        counts.getSent(),
        counts.getFailed(),
        counts.getDelivered(),
        counts.getOpened(),
        counts.getClicked(),
        counts.getReplied());
  }

  private Campaign require(UUID campaignId) {
    return campaignRepository
        .findById(campaignId)
        .orElseThrow(() -> new ResourceNotFoundException("Campaign", campaignId));
  }
}
