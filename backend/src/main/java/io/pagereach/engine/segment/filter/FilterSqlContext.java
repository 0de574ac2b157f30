package io.pagereach.engine.segment.filter;

import java.time.Instant;
import java.util.Map;

/** Named parameter bindings and the evaluation instant of one translated filter tree. */
public final class FilterSqlContext {

  private final Map<String, Object> params;
  private final Instant now;
  private int next;

  FilterSqlContext(Map<String, Object> params, Instant now) {
    this.params = params;
    this.now = now;
  }

  /** Binds the value under a fresh name and returns the placeholder to splice into SQL. */
  String bind(Object value) {
    String name = "f" + next++;
    params.put(name, value);
    return ":" + name;
  }

  /** Fresh alias for a set-returning function in a subquery. */
  String alias() {
    return "el" + next++;
  }

  Instant now() {
    return now;
  }
}
