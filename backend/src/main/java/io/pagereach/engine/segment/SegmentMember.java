package io.pagereach.engine.segment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/** Explicit member of a static segment, or cached member of a dynamic one. */
@Entity
@Table(
    name = "segment_members",
    uniqueConstraints = @UniqueConstraint(columnNames = {"segment_id", "contact_id"}))
public class SegmentMember {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "segment_id", nullable = false)
  private UUID segmentId;

  @Column(name = "contact_id", nullable = false)
  private UUID contactId;

  @Column(name = "added_at", nullable = false, updatable = false)
  private Instant addedAt;

  protected SegmentMember() {}

  public SegmentMember(UUID segmentId, UUID contactId) {
    this.segmentId = segmentId;
    this.contactId = contactId;
    this.addedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getSegmentId() {
    return segmentId;
  }

  public UUID getContactId() {
    return contactId;
  }

  public Instant getAddedAt() {
    return addedAt;
  }
}
