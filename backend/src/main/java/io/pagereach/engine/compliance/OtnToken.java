package io.pagereach.engine.compliance;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * One-time notification token for a (contact, page) pair. The platform issues the token value
 * when the user opts in; until then the row only records the request. Once {@code used} is set it
 * is never cleared.
 *
 * <p>Reservation columns are written only through the CAS queries in {@link OtnTokenRepository}.
 */
@Entity
@Table(name = "otn_tokens")
public class OtnToken {

  public static final int MAX_TITLE_LENGTH = 65;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "contact_id", nullable = false)
  private UUID contactId;

  @Column(name = "page_id", nullable = false)
  private UUID pageId;

  @Column(name = "title", nullable = false, length = MAX_TITLE_LENGTH)
  private String title;

  @Column(name = "payload", length = 255)
  private String payload;

  @Column(name = "token", length = 512)
  private String token;

  @Column(name = "is_used", nullable = false)
  private boolean used;

  @Column(name = "requested_at", nullable = false)
  private Instant requestedAt;

  @Column(name = "opted_in_at")
  private Instant optedInAt;

  @Column(name = "expires_at")
  private Instant expiresAt;

  @Column(name = "used_at")
  private Instant usedAt;

  @Column(name = "reservation_key", length = 128)
  private String reservationKey;

  @Column(name = "reserved_at")
  private Instant reservedAt;

  protected OtnToken() {}

  public OtnToken(UUID contactId, UUID pageId, String title, String payload) {
    if (title == null || title.isBlank() || title.length() > MAX_TITLE_LENGTH) {
      throw new IllegalArgumentException(
          "OTN title must be 1-" + MAX_TITLE_LENGTH + " characters");
    }
    this.contactId = contactId;
    this.pageId = pageId;
    this.title = title;
    this.payload = payload;
    this.requestedAt = Instant.now();
  }

  /** Records the user's opt-in. The platform-issued token is usable until {@code expiresAt}. */
  public void optIn(String token, Instant optedInAt, Instant expiresAt) {
    this.token = token;
    this.optedInAt = optedInAt;
    this.expiresAt = expiresAt;
  }

  public boolean isUsable(Instant now) {
    return !used
        && token != null
        && !token.isBlank()
        && (expiresAt == null || expiresAt.isAfter(now));
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

  public String getTitle() {
    return title;
  }

  public String getPayload() {
    return payload;
  }

  public String getToken() {
    return token;
  }

  public boolean isUsed() {
    return used;
  }

  public Instant getRequestedAt() {
    return requestedAt;
  }

  public Instant getOptedInAt() {
    return optedInAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getUsedAt() {
    return usedAt;
  }

  public String getReservationKey() {
    return reservationKey;
  }

  public Instant getReservedAt() {
    return reservedAt;
  }
}
