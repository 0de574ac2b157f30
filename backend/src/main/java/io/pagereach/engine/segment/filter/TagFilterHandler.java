package io.pagereach.engine.segment.filter;

import java.util.Set;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Translates conditions on the contact's tag list. Element operators hold when any tag passes, as
 * an EXISTS over the unnested jsonb array.
 */
@Component
public class TagFilterHandler {

  private static final Set<String> FIELDS = Set.of("tags", "hasTag");
  private static final String TAGS = "COALESCE(c.tags, jsonb_build_array())";

  public boolean supports(String field) {
    return FIELDS.contains(field);
  }

  public String buildPredicate(FilterCondition condition, FilterSqlContext context) {
    return OperatorPredicates.build(condition.operator(), condition.value(), TAG_LIST, context);
  }

  private static final FieldShape TAG_LIST =
      new FieldShape() {
        @Override
        public String anyElement(Function<SqlOperand, String> test, FilterSqlContext context) {
          String alias = context.alias();
          return "EXISTS (SELECT 1 FROM jsonb_array_elements_text("
              + TAGS
              + ") AS "
              + alias
              + "(v) WHERE "
              + test.apply(SqlOperand.text(alias + ".v"))
              + ")";
        }

        @Override
        public String isEmpty() {
          return "(jsonb_array_length(" + TAGS + ") = 0)";
        }

        @Override
        public SqlOperand whole() {
          return null;
        }
      };
}
