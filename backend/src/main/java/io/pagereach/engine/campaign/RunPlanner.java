package io.pagereach.engine.campaign;

import io.pagereach.engine.integration.messaging.MessageContent;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Works out what a run sends and when the next run of a campaign is due.
 *
 * <p>ONE_TIME, SCHEDULED and TRIGGER campaigns have a single run. A RECURRING campaign's next run
 * is the first pattern occurrence strictly after the finished run started, unless that falls at or
 * after {@code endsAt}. A DRIP campaign's run {@code n} sends step {@code n}; step {@code n + 1}
 * is due {@code delayMinutes} after run {@code n} finished.
 */
@Component
public class RunPlanner {

  /** Occurrence search horizon; covers a full year plus the longest month. */
  private static final int SEARCH_DAYS = 400;

  public Optional<Instant> nextRunAt(Campaign campaign, Instant runStartedAt, Instant finishedAt) {
    return switch (campaign.getType()) {
      case RECURRING ->
          nextOccurrence(campaign.getRecurringPattern(), campaign.getZoneId(), runStartedAt);
      case DRIP -> nextDripStep(campaign, finishedAt);
      default -> Optional.empty();
    };
  }

  public boolean hasRun(Campaign campaign, int runNumber) {
    if (campaign.getType() == CampaignType.DRIP) {
      return runNumber >= 1 && runNumber <= campaign.getDripSequence().size();
    }
    return runNumber >= 1;
  }

  /** Content for a recipient of the given run; {@code variantName} is null outside A/B tests. */
  public MessageContent contentFor(Campaign campaign, int runNumber, String variantName) {
    if (campaign.getType() == CampaignType.DRIP) {
      var steps = campaign.getDripSequence();
      return steps.get(Math.min(runNumber, steps.size()) - 1).content();
    }
    if (variantName != null) {
      for (AbVariant variant : campaign.getAbVariants()) {
        if (variant.name().equals(variantName)) {
          return variant.content();
        }
      }
    }
    return campaign.getMessageContent();
  }

  /** The drip step a run sends; null outside drip campaigns or past the last step. */
  public DripStep dripStep(Campaign campaign, int runNumber) {
    if (campaign.getType() != CampaignType.DRIP || !hasRun(campaign, runNumber)) {
      return null;
    }
    return campaign.getDripSequence().get(runNumber - 1);
  }

  private Optional<Instant> nextDripStep(Campaign campaign, Instant finishedAt) {
    var next = dripStep(campaign, campaign.getRunNumber() + 1);
    if (next == null) {
      return Optional.empty();
    }
    return Optional.of(finishedAt.plusSeconds(60L * Math.max(0, next.delayMinutes())));
  }

  static Optional<Instant> nextOccurrence(RecurringPattern pattern, ZoneId zone, Instant after) {
    if (pattern == null || pattern.frequency() == null) {
      return Optional.empty();
    }
    LocalTime time = pattern.time() != null ? LocalTime.parse(pattern.time()) : LocalTime.MIDNIGHT;
    LocalDate date = after.atZone(zone).toLocalDate();
    for (int i = 0; i < SEARCH_DAYS; i++, date = date.plusDays(1)) {
      if (!matches(pattern, date)) {
        continue;
      }
      Instant candidate = ZonedDateTime.of(date, time, zone).toInstant();
      if (!candidate.isAfter(after)) {
        continue;
      }
      if (pattern.endsAt() != null && !candidate.isBefore(pattern.endsAt())) {
        return Optional.empty();
      }
      return Optional.of(candidate);
    }
    return Optional.empty();
  }

  private static boolean matches(RecurringPattern pattern, LocalDate date) {
    return switch (pattern.frequency()) {
      case DAILY -> true;
      case WEEKLY -> pattern.daysOfWeek().contains(date.getDayOfWeek().getValue() % 7);
      case MONTHLY -> {
        int day = pattern.dayOfMonth() != null ? pattern.dayOfMonth() : 1;
        yield date.getDayOfMonth() == Math.min(day, date.lengthOfMonth());
      }
    };
  }
}
