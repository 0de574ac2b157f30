package io.pagereach.engine.segment;

import io.pagereach.engine.segment.filter.FilterGroup;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Named audience. {@code contactCount} is only as fresh as {@code lastCalculatedAt}; callers that
 * need exact membership recalculate first.
 */
@Entity
@Table(name = "segments")
public class Segment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "workspace_id", nullable = false)
  private UUID workspaceId;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 20)
  private SegmentType type;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "filters", columnDefinition = "jsonb")
  private FilterGroup filters;

  @Column(name = "contact_count", nullable = false)
  private int contactCount;

  @Column(name = "last_calculated_at")
  private Instant lastCalculatedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Segment() {}

  public Segment(
      UUID workspaceId, String name, String description, SegmentType type, FilterGroup filters) {
    this.workspaceId = workspaceId;
    this.name = name;
    this.description = description;
    this.type = type;
    this.filters = type == SegmentType.DYNAMIC ? filters : null;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  public void recordCalculation(int contactCount, Instant calculatedAt) {
    this.contactCount = contactCount;
    this.lastCalculatedAt = calculatedAt;
    this.updatedAt = calculatedAt;
  }

  public void updateFilters(FilterGroup filters) {
    this.filters = filters;
    this.updatedAt = Instant.now();
  }

  public boolean isDynamic() {
    return type == SegmentType.DYNAMIC;
  }

  public UUID getId() {
    return id;
  }

  public UUID getWorkspaceId() {
    return workspaceId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public SegmentType getType() {
    return type;
  }

  public FilterGroup getFilters() {
    return filters != null ? filters : FilterGroup.matchAll();
  }

  public int getContactCount() {
    return contactCount;
  }

  public Instant getLastCalculatedAt() {
    return lastCalculatedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
