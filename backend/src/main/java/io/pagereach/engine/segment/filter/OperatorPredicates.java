package io.pagereach.engine.segment.filter;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * SQL counterpart of {@link FilterEvaluator#evaluate}. Every predicate produced here is true or
 * false, never NULL, so NOT and the surrounding groups behave as they do in memory.
 */
final class OperatorPredicates {

  static final String TRUE = "TRUE";
  static final String FALSE = "FALSE";

  private OperatorPredicates() {}

  static String build(
      FilterOperator operator, Object expected, FieldShape field, FilterSqlContext context) {
    if (operator == null) {
      return FALSE;
    }
    return switch (operator) {
      case EQUALS -> field.anyElement(e -> equalTo(e, expected, context), context);
      case NOT_EQUALS -> not(field.anyElement(e -> equalTo(e, expected, context), context));
      case CONTAINS -> field.anyElement(e -> like(e, expected, true, true, context), context);
      case NOT_CONTAINS ->
          not(field.anyElement(e -> like(e, expected, true, true, context), context));
      case STARTS_WITH -> field.anyElement(e -> like(e, expected, false, true, context), context);
      case ENDS_WITH -> field.anyElement(e -> like(e, expected, true, false, context), context);
      case GREATER_THAN, AFTER -> compare(field.whole(), expected, ">", context);
      case GREATER_THAN_OR_EQUAL -> compare(field.whole(), expected, ">=", context);
      case LESS_THAN, BEFORE -> compare(field.whole(), expected, "<", context);
      case LESS_THAN_OR_EQUAL -> compare(field.whole(), expected, "<=", context);
      case BETWEEN -> between(field.whole(), expected, context);
      case IN -> in(field, expected, context);
      case NOT_IN -> not(in(field, expected, context));
      case IS_EMPTY -> field.isEmpty();
      case IS_NOT_EMPTY -> not(field.isEmpty());
      case IS_TRUE -> textIs(field.whole(), "true");
      case IS_FALSE -> textIs(field.whole(), "false");
      case WITHIN_LAST_DAYS -> withinLastDays(field.whole(), expected, context);
      case NOT_WITHIN_LAST_DAYS -> not(withinLastDays(field.whole(), expected, context));
    };
  }

  static String not(String predicate) {
    return "(NOT " + predicate + ")";
  }

  private static String orFalse(String expression) {
    return "COALESCE(" + expression + ", FALSE)";
  }

  private static String equalTo(SqlOperand e, Object expected, FilterSqlContext context) {
    if (expected == null) {
      return e.isNull();
    }
    Double number = FilterEvaluator.toNumber(expected);
    if (number != null) {
      return orFalse(e.asNumber() + " = " + context.bind(number));
    }
    if (expected instanceof Boolean) {
      return orFalse("lower(" + e.asText() + ") = " + context.bind(expected.toString()));
    }
    String value = String.valueOf(expected);
    return switch (e.kind()) {
      case TEXT -> orFalse(e.sql() + " = " + context.bind(value));
      case BOOLEAN ->
          orFalse("lower(" + e.asText() + ") = " + context.bind(value.toLowerCase(Locale.ROOT)));
      case TIMESTAMP -> {
        Instant at = parseInstant(value);
        yield at != null ? orFalse(e.sql() + " = " + context.bind(utc(at))) : FALSE;
      }
      case JSON ->
          orFalse(
              "CASE WHEN "
                  + e.isBoolean()
                  + " THEN lower("
                  + e.asText()
                  + ") = "
                  + context.bind(value.toLowerCase(Locale.ROOT))
                  + " ELSE "
                  + e.asText()
                  + " = "
                  + context.bind(value)
                  + " END");
    };
  }

  private static String like(
      SqlOperand e, Object expected, boolean leading, boolean trailing, FilterSqlContext context) {
    if (expected == null) {
      return FALSE;
    }
    String pattern =
        (leading ? "%" : "")
            + escapeLike(String.valueOf(expected).toLowerCase(Locale.ROOT))
            + (trailing ? "%" : "");
    return orFalse("lower(" + e.asText() + ") LIKE " + context.bind(pattern) + " ESCAPE '\\'");
  }

  private static String compare(
      SqlOperand e, Object expected, String op, FilterSqlContext context) {
    if (e == null || expected == null) {
      return FALSE;
    }
    Double number = FilterEvaluator.toNumber(expected);
    if (number != null) {
      return orFalse(e.asNumber() + " " + op + " " + context.bind(number));
    }
    Instant at = FilterEvaluator.toInstant(expected);
    if (at != null) {
      return orFalse(e.asInstant() + " " + op + " " + context.bind(utc(at)));
    }
    return FALSE;
  }

  private static String between(SqlOperand e, Object expected, FilterSqlContext context) {
    if (!(expected instanceof List<?> bounds) || bounds.size() != 2) {
      return FALSE;
    }
    return "("
        + compare(e, bounds.get(0), ">=", context)
        + " AND "
        + compare(e, bounds.get(1), "<=", context)
        + ")";
  }

  private static String in(FieldShape field, Object expected, FilterSqlContext context) {
    if (!(expected instanceof Collection<?> candidates) || candidates.isEmpty()) {
      return FALSE;
    }
    return field.anyElement(
        e ->
            candidates.stream()
                .map(candidate -> equalTo(e, candidate, context))
                .collect(Collectors.joining(" OR ", "(", ")")),
        context);
  }

  private static String textIs(SqlOperand e, String value) {
    if (e == null || e.kind() == SqlOperand.Kind.TIMESTAMP) {
      return FALSE;
    }
    return orFalse("lower(" + e.asText() + ") = '" + value + "'");
  }

  private static String withinLastDays(SqlOperand e, Object expected, FilterSqlContext context) {
    Double days = FilterEvaluator.toNumber(expected);
    if (e == null || days == null) {
      return FALSE;
    }
    Instant since = context.now().minus(Duration.ofMinutes(Math.round(days * 24 * 60)));
    return orFalse(e.asInstant() + " >= " + context.bind(utc(since)));
  }

  /** A full ISO instant; a date alone never equals an instant's text form. */
  private static Instant parseInstant(String value) {
    return value.trim().contains("T") ? FilterEvaluator.toInstant(value) : null;
  }

  private static java.time.OffsetDateTime utc(Instant at) {
    return at.atOffset(ZoneOffset.UTC);
  }

  static String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }
}
