package io.pagereach.engine.segment.filter;

import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Translates conditions on a custom-field value read from the {@code custom_fields} jsonb column.
 * Array values behave like tags: element operators hold when any element passes.
 */
@Component
public class CustomFieldFilterHandler {

  public String buildPredicate(FilterCondition condition, FilterSqlContext context) {
    String key =
        ContactFieldResolver.CUSTOM_FIELD.equals(condition.field())
            ? condition.customFieldKey()
            : condition.field();
    if (key == null) {
      return OperatorPredicates.build(
          condition.operator(),
          condition.value(),
          FieldShape.scalar(SqlOperand.json("CAST(NULL AS jsonb)")),
          context);
    }
    String value = "(c.custom_fields -> CAST(" + context.bind(key) + " AS text))";
    return OperatorPredicates.build(
        condition.operator(), condition.value(), new CustomFieldShape(value), context);
  }

  private record CustomFieldShape(String value) implements FieldShape {

    @Override
    public String anyElement(Function<SqlOperand, String> test, FilterSqlContext context) {
      String alias = context.alias();
      return "(CASE WHEN jsonb_typeof("
          + value
          + ") = 'array' THEN EXISTS (SELECT 1 FROM jsonb_array_elements("
          + value
          + ") AS "
          + alias
          + "(v) WHERE "
          + test.apply(SqlOperand.json(alias + ".v"))
          + ") ELSE "
          + test.apply(SqlOperand.json(value))
          + " END)";
    }

    @Override
    public String isEmpty() {
      return "("
          + value
          + " IS NULL OR jsonb_typeof("
          + value
          + ") = 'null' OR "
          + value
          + " IN (jsonb_build_array(), jsonb_build_object()) OR (jsonb_typeof("
          + value
          + ") = 'string' AND (jsonb_build_array("
          + value
          + ") ->> 0) ~ '^\\s*$'))";
    }

    @Override
    public SqlOperand whole() {
      return SqlOperand.json(value);
    }
  }
}
