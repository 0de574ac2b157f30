package io.pagereach.engine.segment.filter;

public interface FilterVisitor<R> {

  R visitCondition(FilterCondition condition);

  R visitGroup(FilterGroup group);
}
