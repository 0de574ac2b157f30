package io.pagereach.engine.segment.filter;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** A node of a segment filter tree: either a single condition or a group of nodes. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
  @JsonSubTypes.Type(value = FilterCondition.class, name = "condition"),
  @JsonSubTypes.Type(value = FilterGroup.class, name = "group")
})
public sealed interface FilterNode permits FilterCondition, FilterGroup {

  <R> R accept(FilterVisitor<R> visitor);
}
