package io.pagereach.engine.compliance;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Recurring-notification opt-in for a (contact, page, topic) triple. {@code lastSentAt} only moves
 * forward; sends are only allowed once the frequency interval has elapsed since it.
 */
@Entity
@Table(name = "recurring_subscriptions")
public class RecurringSubscription {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "contact_id", nullable = false)
  private UUID contactId;

  @Column(name = "page_id", nullable = false)
  private UUID pageId;

  @Column(name = "topic", nullable = false, length = 100)
  private String topic;

  @Enumerated(EnumType.STRING)
  @Column(name = "frequency", nullable = false, length = 20)
  private RecurringFrequency frequency;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private SubscriptionStatus status = SubscriptionStatus.PENDING;

  @Column(name = "token", length = 512)
  private String token;

  @Column(name = "expires_at")
  private Instant expiresAt;

  @Column(name = "last_sent_at")
  private Instant lastSentAt;

  @Column(name = "send_count", nullable = false)
  private int sendCount;

  @Column(name = "reservation_key", length = 128)
  private String reservationKey;

  @Column(name = "reserved_at")
  private Instant reservedAt;

  @Column(name = "cancelled_at")
  private Instant cancelledAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected RecurringSubscription() {}

  public RecurringSubscription(
      UUID contactId, UUID pageId, String topic, RecurringFrequency frequency) {
    this.contactId = contactId;
    this.pageId = pageId;
    this.topic = topic;
    this.frequency = frequency;
    this.createdAt = Instant.now();
  }

  public void activate(String token, Instant expiresAt) {
    this.token = token;
    this.expiresAt = expiresAt;
    this.status = SubscriptionStatus.ACTIVE;
  }

  public void cancel(Instant when) {
    this.status = SubscriptionStatus.CANCELLED;
    this.cancelledAt = when;
  }

  /** Earliest instant a send becomes legal again; null when never sent. */
  public Instant nextAllowedAt() {
    return lastSentAt != null ? lastSentAt.plus(frequency.interval()) : null;
  }

  public boolean isEligible(Instant now) {
    if (status != SubscriptionStatus.ACTIVE) {
      return false;
    }
    if (expiresAt != null && !expiresAt.isAfter(now)) {
      return false;
    }
    return lastSentAt == null
        || Duration.between(lastSentAt, now).compareTo(frequency.interval()) >= 0;
  }

  public UUID getId() {
    return id;
  }

  public UUID getContactId() {
    return contactId;
  }

  public UUID getPageId() {
    return pageId;
  }

  public String getTopic() {
    return topic;
  }

  public RecurringFrequency getFrequency() {
    return frequency;
  }

  public SubscriptionStatus getStatus() {
    return status;
  }

  public String getToken() {
    return token;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getLastSentAt() {
    return lastSentAt;
  }

  public int getSendCount() {
    return sendCount;
  }

  public String getReservationKey() {
    return reservationKey;
  }

  public Instant getCancelledAt() {
    return cancelledAt;
  }
}
