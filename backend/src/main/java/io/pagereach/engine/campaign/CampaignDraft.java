package io.pagereach.engine.campaign;

import io.pagereach.engine.audience.AudienceDescriptor;
import io.pagereach.engine.compliance.BypassMethod;
import io.pagereach.engine.compliance.MessageTag;
import io.pagereach.engine.integration.messaging.MessageContent;
import java.util.List;

/** Editable definition of a campaign, used for create and for edits while in DRAFT. */
public record CampaignDraft(
    String name,
    String description,
    CampaignType type,
    AudienceDescriptor audience,
    MessageContent content,
    BypassMethod bypassMethod,
    MessageTag messageTag,
    boolean sponsored,
    String recurringTopic,
    String timezone,
    RecurringPattern recurringPattern,
    List<DripStep> dripSequence,
    List<AbVariant> abVariants,
    AbWinnerCriteria abWinnerCriteria) {

  public CampaignDraft {
    dripSequence = dripSequence != null ? List.copyOf(dripSequence) : List.of();
    abVariants = abVariants != null ? List.copyOf(abVariants) : List.of();
  }

  public static CampaignDraft oneTime(
      String name, AudienceDescriptor audience, MessageContent content) {
    return new CampaignDraft(
        name,
        null,
        CampaignType.ONE_TIME,
        audience,
        content,
        null,
        null,
        false,
        null,
        null,
        null,
        List.of(),
        List.of(),
        null);
  }
}
