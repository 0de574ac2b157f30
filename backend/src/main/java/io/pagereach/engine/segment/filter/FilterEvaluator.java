package io.pagereach.engine.segment.filter;

import io.pagereach.engine.contact.Contact;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Evaluates a filter tree against a single contact in memory. Queries over a whole workspace go
 * through {@link FilterSqlTranslator}, which produces the same matches in SQL.
 *
 * <p>String operators are case-insensitive except EQUALS, which is exact. Ordering operators
 * compare numerically when both sides are numbers (or numeric strings) and chronologically when
 * both sides are instants or ISO dates; anything else does not match. Against a multi-valued field
 * such as tags, a condition matches when any element matches.
 */
@Component
public class FilterEvaluator {

  private final Clock clock;

  public FilterEvaluator(Clock clock) {
    this.clock = clock;
  }

  public boolean matches(FilterGroup root, Contact contact) {
    return root.accept(new ContactMatcher(contact, clock.instant()));
  }

  private static final class ContactMatcher implements FilterVisitor<Boolean> {

    private final Contact contact;
    private final Instant now;

    private ContactMatcher(Contact contact, Instant now) {
      this.contact = contact;
      this.now = now;
    }

    @Override
    public Boolean visitGroup(FilterGroup group) {
      boolean result;
      if (group.children().isEmpty()) {
        result = true;
      } else if (group.logic() == FilterLogic.OR) {
        result = group.children().stream().anyMatch(child -> child.accept(this));
      } else {
        result = group.children().stream().allMatch(child -> child.accept(this));
      }
      return group.negate() != result;
    }

    @Override
    public Boolean visitCondition(FilterCondition condition) {
      Object actual = ContactFieldResolver.resolve(contact, condition, now);
      boolean result = evaluate(condition.operator(), actual, condition.value(), now);
      return condition.not() != result;
    }
  }

  static boolean evaluate(FilterOperator operator, Object actual, Object expected, Instant now) {
    if (operator == null) {
      return false;
    }
    return switch (operator) {
      case EQUALS -> anyElement(actual, a -> valueEquals(a, expected));
      case NOT_EQUALS -> !anyElement(actual, a -> valueEquals(a, expected));
      case CONTAINS -> anyElement(actual, a -> text(a, expected, String::contains));
      case NOT_CONTAINS -> !anyElement(actual, a -> text(a, expected, String::contains));
      case STARTS_WITH -> anyElement(actual, a -> text(a, expected, String::startsWith));
      case ENDS_WITH -> anyElement(actual, a -> text(a, expected, String::endsWith));
      case GREATER_THAN, AFTER -> compared(actual, expected, c -> c > 0);
      case GREATER_THAN_OR_EQUAL -> compared(actual, expected, c -> c >= 0);
      case LESS_THAN, BEFORE -> compared(actual, expected, c -> c < 0);
      case LESS_THAN_OR_EQUAL -> compared(actual, expected, c -> c <= 0);
      case BETWEEN -> between(actual, expected);
      case IN -> in(actual, expected);
      case NOT_IN -> !in(actual, expected);
      case IS_EMPTY -> isEmpty(actual);
      case IS_NOT_EMPTY -> !isEmpty(actual);
      case IS_TRUE -> "true".equalsIgnoreCase(String.valueOf(actual));
      case IS_FALSE -> "false".equalsIgnoreCase(String.valueOf(actual));
      case WITHIN_LAST_DAYS -> withinLastDays(actual, expected, now);
      case NOT_WITHIN_LAST_DAYS -> actual == null || !withinLastDays(actual, expected, now);
    };
  }

  private interface ElementTest {
    boolean test(Object element);
  }

  private interface TextTest {
    boolean test(String actual, String expected);
  }

  private interface ComparisonTest {
    boolean test(int comparison);
  }

  private static boolean anyElement(Object actual, ElementTest test) {
    if (actual instanceof Collection<?> values) {
      return values.stream().anyMatch(test::test);
    }
    return test.test(actual);
  }

  private static boolean valueEquals(Object actual, Object expected) {
    if (actual == null || expected == null) {
      return actual == expected;
    }
    Double left = toNumber(actual);
    Double right = toNumber(expected);
    if (left != null && right != null) {
      return left.compareTo(right) == 0;
    }
    if (actual instanceof Boolean || expected instanceof Boolean) {
      return String.valueOf(actual).equalsIgnoreCase(String.valueOf(expected));
    }
    return String.valueOf(actual).equals(String.valueOf(expected));
  }

  private static boolean text(Object actual, Object expected, TextTest test) {
    if (actual == null || expected == null) {
      return false;
    }
    return test.test(
        String.valueOf(actual).toLowerCase(Locale.ROOT),
        String.valueOf(expected).toLowerCase(Locale.ROOT));
  }

  private static boolean compared(Object actual, Object expected, ComparisonTest test) {
    Integer comparison = compare(actual, expected);
    return comparison != null && test.test(comparison);
  }

  private static boolean between(Object actual, Object expected) {
    if (!(expected instanceof List<?> bounds) || bounds.size() != 2) {
      return false;
    }
    Integer low = compare(actual, bounds.get(0));
    Integer high = compare(actual, bounds.get(1));
    return low != null && high != null && low >= 0 && high <= 0;
  }

  private static boolean in(Object actual, Object expected) {
    if (!(expected instanceof Collection<?> candidates)) {
      return false;
    }
    return anyElement(actual, a -> candidates.stream().anyMatch(c -> valueEquals(a, c)));
  }

  private static boolean isEmpty(Object actual) {
    if (actual == null) {
      return true;
    }
    if (actual instanceof String s) {
      return s.isBlank();
    }
    if (actual instanceof Collection<?> c) {
      return c.isEmpty();
    }
    if (actual instanceof Map<?, ?> m) {
      return m.isEmpty();
    }
    return false;
  }

  private static boolean withinLastDays(Object actual, Object expected, Instant now) {
    Instant at = toInstant(actual);
    Double days = toNumber(expected);
    if (at == null || days == null) {
      return false;
    }
    return !at.isBefore(now.minus(Duration.ofMinutes(Math.round(days * 24 * 60))));
  }

  /** Numeric comparison first, then chronological; null when the operands are not comparable. */
  private static Integer compare(Object actual, Object expected) {
    if (actual == null || expected == null) {
      return null;
    }
    Double left = toNumber(actual);
    Double right = toNumber(expected);
    if (left != null && right != null) {
      return left.compareTo(right);
    }
    Instant leftAt = toInstant(actual);
    Instant rightAt = toInstant(expected);
    if (leftAt != null && rightAt != null) {
      return leftAt.compareTo(rightAt);
    }
    return null;
  }

  static Double toNumber(Object value) {
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    if (value instanceof String s && !s.isBlank()) {
      try {
        return Double.valueOf(s.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  static Instant toInstant(Object value) {
    if (value instanceof Instant i) {
      return i;
    }
    if (value instanceof String s && !s.isBlank()) {
      try {
        return Instant.parse(s.trim());
      } catch (DateTimeParseException e) {
        try {
          return LocalDate.parse(s.trim()).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException ignored) {
          return null;
        }
      }
    }
    return null;
  }
}
