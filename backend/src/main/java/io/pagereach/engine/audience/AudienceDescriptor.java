package io.pagereach.engine.audience;

import java.util.List;
import java.util.UUID;

public record AudienceDescriptor(
    UUID workspaceId,
    AudienceType type,
    UUID segmentId,
    List<UUID> pageIds,
    List<UUID> contactIds) {

  public AudienceDescriptor {
    pageIds = pageIds != null ? List.copyOf(pageIds) : List.of();
    contactIds = contactIds != null ? List.copyOf(contactIds) : List.of();
  }
}
