package io.pagereach.engine.compliance;

import io.pagereach.engine.audit.AuditEventBuilder;
import io.pagereach.engine.audit.AuditService;
import io.pagereach.engine.contact.ContactRef;
import io.pagereach.engine.stats.CampaignRecipientRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Decides which send method, if any, is legal for one recipient right now. The first eligible
 * method in {@link BypassMethod} order wins.
 *
 * <p>OTN tokens and recurring subscriptions are <em>reserved</em> here with a compare-and-set
 * keyed by the recipient's reservation key, so repeating a resolution with the same key returns the
 * same artifact. A reservation is turned into a consumption by {@link #confirm} only after the
 * transport accepted the send, and handed back by {@link #release} when it did not. A resolver
 * that loses a CAS moves on to the next candidate or method.
 */
@Service
public class BypassResolver {

  private static final Logger log = LoggerFactory.getLogger(BypassResolver.class);

  private final OtnTokenRepository otnTokenRepository;
  private final RecurringSubscriptionRepository subscriptionRepository;
  private final CampaignRecipientRepository recipientRepository;
  private final AuditService auditService;
  private final ComplianceProperties properties;
  private final Clock clock;

  public BypassResolver(
      OtnTokenRepository otnTokenRepository,
      RecurringSubscriptionRepository subscriptionRepository,
      CampaignRecipientRepository recipientRepository,
      AuditService auditService,
      ComplianceProperties properties,
      Clock clock) {
    this.otnTokenRepository = otnTokenRepository;
    this.subscriptionRepository = subscriptionRepository;
    this.recipientRepository = recipientRepository;
    this.auditService = auditService;
    this.properties = properties;
    this.clock = clock;
  }

  @Transactional
  public BypassResolution resolve(
      ContactRef contact, BypassPreference preference, String reservationKey) {
    Instant now = clock.instant();
    if (!contact.subscribed()) {
      return BypassResolution.blocked("contact unsubscribed");
    }
    if (MessagingWindow.isOpen(contact.lastMessageFromContactAt(), now)) {
      return BypassResolution.withinWindow();
    }

    for (BypassMethod method : preference.fallbackMethods()) {
      Optional<BypassResolution> resolution =
          switch (method) {
            case OTN_TOKEN -> reserveOtnToken(contact, reservationKey, now);
            case RECURRING_NOTIFICATION ->
                reserveSubscription(contact, preference.recurringTopic(), reservationKey, now);
            case MESSAGE_TAG_CONFIRMED_EVENT_UPDATE,
                MESSAGE_TAG_POST_PURCHASE_UPDATE,
                MESSAGE_TAG_ACCOUNT_UPDATE,
                MESSAGE_TAG_HUMAN_AGENT ->
                resolveTag(contact, method.messageTag(), now);
            case SPONSORED_MESSAGE -> Optional.of(BypassResolution.sponsored());
            case WITHIN_WINDOW, BLOCKED -> Optional.empty();
          };
      if (resolution.isPresent()) {
        log.debug(
            "Resolved {} for contact {} (key {})", method, contact.contactId(), reservationKey);
        return resolution.get();
      }
    }
    return BypassResolution.blocked("outside 24h window and no eligible bypass");
  }

  /**
   * Marks the reserved artifact consumed after the transport accepted the send. OTN tokens become
   * permanently used; recurring subscriptions advance {@code lastSentAt}.
   */
  @Transactional
  public void confirm(BypassResolution resolution) {
    if (!resolution.method().usesArtifact()) {
      return;
    }
    Instant now = clock.instant();
    int updated =
        switch (resolution.method()) {
          case OTN_TOKEN ->
              otnTokenRepository.consume(
                  resolution.artifactId(), resolution.reservationKey(), now);
          case RECURRING_NOTIFICATION ->
              subscriptionRepository.advance(
                  resolution.artifactId(), resolution.reservationKey(), now);
          default -> 0;
        };
    if (updated == 0) {
      // Lease expired and someone else took the artifact after our send went out.
      log.warn(
          "Could not mark {} {} consumed for key {}; reservation no longer held",
          resolution.method(),
          resolution.artifactId(),
          resolution.reservationKey());
      return;
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("bypass.consumed")
            .entityType(
                resolution.method() == BypassMethod.OTN_TOKEN
                    ? "otn_token"
                    : "recurring_subscription")
            .entityId(resolution.artifactId())
            .source("DISPATCH")
            .details(
                Map.of(
                    "method", resolution.method().name(),
                    "reservation_key", resolution.reservationKey()))
            .build());
  }

  /** Hands a reserved artifact back after a failed send so it is not burned. */
  @Transactional
  public void release(BypassResolution resolution) {
    if (!resolution.method().usesArtifact()) {
      return;
    }
    if (resolution.method() == BypassMethod.OTN_TOKEN) {
      otnTokenRepository.release(resolution.artifactId(), resolution.reservationKey());
    } else {
      subscriptionRepository.release(resolution.artifactId(), resolution.reservationKey());
    }
  }

  private Optional<BypassResolution> reserveOtnToken(
      ContactRef contact, String key, Instant now) {
    Instant leaseCutoff = now.minus(properties.reservationLease());

    var alreadyHeld = otnTokenRepository.findFirstByReservationKeyAndUsedFalse(key);
    if (alreadyHeld.isPresent() && alreadyHeld.get().isUsable(now)) {
      var token = alreadyHeld.get();
      return Optional.of(
          BypassResolution.reserved(BypassMethod.OTN_TOKEN, token.getId(), token.getToken(), key));
    }

    var candidates =
        otnTokenRepository.findReservable(
            contact.contactId(), contact.pageId(), key, now, leaseCutoff);
    for (OtnToken token : candidates) {
      if (!token.isUsable(now)) {
        continue;
      }
      if (otnTokenRepository.reserve(token.getId(), key, now, leaseCutoff) == 1) {
        return Optional.of(
            BypassResolution.reserved(
                BypassMethod.OTN_TOKEN, token.getId(), token.getToken(), key));
      }
      log.debug("Lost reservation race for OTN token {}", token.getId());
    }
    return Optional.empty();
  }

  private Optional<BypassResolution> reserveSubscription(
      ContactRef contact, String topic, String key, Instant now) {
    Instant leaseCutoff = now.minus(properties.reservationLease());
    var candidates =
        subscriptionRepository.findReservable(
            contact.contactId(),
            contact.pageId(),
            SubscriptionStatus.ACTIVE,
            topic,
            key,
            leaseCutoff);
    for (RecurringSubscription subscription : candidates) {
      if (!subscription.isEligible(now)) {
        continue;
      }
      Instant eligibleBefore = now.minus(subscription.getFrequency().interval());
      int reserved =
          subscriptionRepository.reserve(
              subscription.getId(),
              key,
              SubscriptionStatus.ACTIVE,
              now,
              eligibleBefore,
              leaseCutoff);
      if (reserved == 1) {
        return Optional.of(
            BypassResolution.reserved(
                BypassMethod.RECURRING_NOTIFICATION,
                subscription.getId(),
                subscription.getToken(),
                key));
      }
      log.debug("Lost reservation race for recurring subscription {}", subscription.getId());
    }
    return Optional.empty();
  }

  private Optional<BypassResolution> resolveTag(ContactRef contact, MessageTag tag, Instant now) {
    if (tag == MessageTag.HUMAN_AGENT
        && !MessagingWindow.isWithin(
            contact.lastMessageFromContactAt(), now, MessagingWindow.HUMAN_AGENT)) {
      return Optional.empty();
    }
    if (properties.enforceTagCooldowns()) {
      var lastTagSend = recipientRepository.findLastTagSendAt(contact.contactId(), tag);
      if (lastTagSend != null && lastTagSend.plus(tag.cooldown()).isAfter(now)) {
        log.debug("Tag {} cooling down for contact {}", tag, contact.contactId());
        return Optional.empty();
      }
    }
    return Optional.of(BypassResolution.tagged(tag));
  }
}
