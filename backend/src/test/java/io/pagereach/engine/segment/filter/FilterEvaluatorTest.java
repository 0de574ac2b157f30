package io.pagereach.engine.segment.filter;

import static org.assertj.core.api.Assertions.assertThat;

import io.pagereach.engine.contact.Contact;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FilterEvaluatorTest {

  private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

  private FilterEvaluator evaluator;
  private Contact alice;
  private Contact bob;

  @BeforeEach
  void setUp() {
    evaluator = new FilterEvaluator(Clock.fixed(NOW, ZoneOffset.UTC));

    alice = new Contact(UUID.randomUUID(), UUID.randomUUID(), "psid-alice");
    alice.setNames("Alice", "Moyo");
    alice.setLocale("en_ZA");
    alice.setTags(List.of("vip", "newsletter"));
    alice.setCustomFields(Map.of("age", 34, "city", "Cape Town"));
    alice.setLastMessageFromContactAt(NOW.minus(Duration.ofHours(3)));

    bob = new Contact(UUID.randomUUID(), UUID.randomUUID(), "psid-bob");
    bob.setNames("Bob", "Smith");
    bob.setLocale("en_US");
    bob.setCustomFields(Map.of("age", "19"));
    bob.setLastMessageFromContactAt(NOW.minus(Duration.ofDays(10)));
  }

  @Test
  void matches_emptyGroup_matchesEveryone() {
    assertThat(filter(FilterGroup.matchAll(), List.of(alice, bob)))
        .containsExactly(alice, bob);
  }

  @Test
  void filter_ageAndVipTag_resolvesOnlyMatchingContact() {
    var first = contact(30, "vip");
    var second = contact(20, "vip");
    var third = contact(40, "none");
    var tree =
        FilterGroup.and(
            cond("age", FilterOperator.GREATER_THAN, 25),
            cond("tags", FilterOperator.EQUALS, "vip"));

    assertThat(filter(tree, List.of(first, second, third))).containsExactly(first);
  }

  @Test
  void matches_equalsIsExactButContainsIgnoresCase() {
    assertThat(
            evaluator.matches(
                FilterGroup.and(cond("firstName", FilterOperator.EQUALS, "alice")), alice))
        .isFalse();
    assertThat(
            evaluator.matches(
                FilterGroup.and(cond("firstName", FilterOperator.CONTAINS, "LIC")), alice))
        .isTrue();
    assertThat(
            evaluator.matches(
                FilterGroup.and(cond("locale", FilterOperator.STARTS_WITH, "EN_")), bob))
        .isTrue();
  }

  @Test
  void matches_customFieldComparesNumerically() {
    var adults = FilterGroup.and(cond("age", FilterOperator.GREATER_THAN_OR_EQUAL, 21));

    assertThat(filter(adults, List.of(alice, bob))).containsExactly(alice);
  }

  @Test
  void matches_customFieldAddressedByKey() {
    var condition =
        new FilterCondition(
            ContactFieldResolver.CUSTOM_FIELD, "city", FilterOperator.EQUALS, "Cape Town", false);

    assertThat(evaluator.matches(FilterGroup.and(condition), alice)).isTrue();
    assertThat(evaluator.matches(FilterGroup.and(condition), bob)).isFalse();
  }

  @Test
  void matches_between_isInclusive() {
    var band = FilterGroup.and(cond("age", FilterOperator.BETWEEN, List.of(19, 34)));

    assertThat(filter(band, List.of(alice, bob))).containsExactly(alice, bob);
  }

  @Test
  void matches_tagCondition_matchesAnyElement() {
    var vip = FilterGroup.and(cond("tags", FilterOperator.EQUALS, "vip"));
    var notVip = FilterGroup.and(cond("tags", FilterOperator.EQUALS, "vip").negated());

    assertThat(filter(vip, List.of(alice, bob))).containsExactly(alice);
    assertThat(filter(notVip, List.of(alice, bob))).containsExactly(bob);
  }

  @Test
  void matches_inAndNotIn() {
    var locales = FilterGroup.and(cond("locale", FilterOperator.IN, List.of("en_US", "fr_FR")));
    var others = FilterGroup.and(cond("locale", FilterOperator.NOT_IN, List.of("en_US")));

    assertThat(filter(locales, List.of(alice, bob))).containsExactly(bob);
    assertThat(filter(others, List.of(alice, bob))).containsExactly(alice);
  }

  @Test
  void matches_isEmptyOnMissingValues() {
    var noTags = FilterGroup.and(cond("tags", FilterOperator.IS_EMPTY, null));
    var noCity = FilterGroup.and(cond("city", FilterOperator.IS_EMPTY, null));

    assertThat(filter(noTags, List.of(alice, bob))).containsExactly(bob);
    assertThat(filter(noCity, List.of(alice, bob))).containsExactly(bob);
  }

  @Test
  void matches_virtualWindowField() {
    var inWindow = FilterGroup.and(cond("within24hWindow", FilterOperator.IS_TRUE, null));

    assertThat(filter(inWindow, List.of(alice, bob))).containsExactly(alice);
  }

  @Test
  void matches_withinLastDays() {
    var recent =
        FilterGroup.and(cond("lastMessageFromContactAt", FilterOperator.WITHIN_LAST_DAYS, 7));
    var stale =
        FilterGroup.and(
            cond("lastMessageFromContactAt", FilterOperator.NOT_WITHIN_LAST_DAYS, 7));

    assertThat(filter(recent, List.of(alice, bob))).containsExactly(alice);
    assertThat(filter(stale, List.of(alice, bob))).containsExactly(bob);
  }

  @Test
  void matches_dateOperatorsAcceptIsoDates() {
    var before =
        FilterGroup.and(cond("lastMessageFromContactAt", FilterOperator.BEFORE, "2026-03-01"));

    assertThat(filter(before, List.of(alice, bob))).containsExactly(bob);
  }

  @Test
  void matches_nestedGroupsWithOrAndNegation() {
    var tree =
        FilterGroup.and(
            cond("locale", FilterOperator.STARTS_WITH, "en"),
            FilterGroup.or(
                cond("tags", FilterOperator.EQUALS, "vip"),
                cond("age", FilterOperator.LESS_THAN, 20)));
    var negated = new FilterGroup(tree.logic(), tree.children(), true);

    assertThat(filter(tree, List.of(alice, bob))).containsExactly(alice, bob);
    assertThat(filter(negated, List.of(alice, bob))).isEmpty();
  }

  @Test
  void matches_incomparableOperands_doNotMatch() {
    var condition = FilterGroup.and(cond("firstName", FilterOperator.GREATER_THAN, 5));

    assertThat(filter(condition, List.of(alice, bob))).isEmpty();
  }

  private List<Contact> filter(FilterGroup tree, List<Contact> contacts) {
    return contacts.stream().filter(c -> evaluator.matches(tree, c)).toList();
  }

  private static Contact contact(int age, String tag) {
    var contact = new Contact(UUID.randomUUID(), UUID.randomUUID(), "psid-" + age);
    contact.setCustomFields(Map.of("age", age));
    contact.setTags(List.of(tag));
    return contact;
  }

  private static FilterCondition cond(String field, FilterOperator operator, Object value) {
    return FilterCondition.of(field, operator, value);
  }
}
