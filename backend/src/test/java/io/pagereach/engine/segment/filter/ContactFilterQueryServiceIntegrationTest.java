package io.pagereach.engine.segment.filter;

import static org.assertj.core.api.Assertions.assertThat;

import io.pagereach.engine.TestcontainersConfiguration;
import io.pagereach.engine.audience.AudienceDescriptor;
import io.pagereach.engine.audience.AudienceResolver;
import io.pagereach.engine.audience.AudienceType;
import io.pagereach.engine.contact.Contact;
import io.pagereach.engine.contact.ContactRef;
import io.pagereach.engine.contact.ContactRepository;
import io.pagereach.engine.segment.SegmentMemberRepository;
import io.pagereach.engine.segment.SegmentService;
import io.pagereach.engine.segment.SegmentType;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ContactFilterQueryServiceIntegrationTest {

  private static final UUID WORKSPACE_ID = UUID.randomUUID();
  private static final UUID PAGE_ID = UUID.randomUUID();

  @Autowired private ContactFilterQueryService queryService;
  @Autowired private FilterEvaluator evaluator;
  @Autowired private ContactRepository contactRepository;
  @Autowired private SegmentService segmentService;
  @Autowired private SegmentMemberRepository memberRepository;
  @Autowired private AudienceResolver audienceResolver;

  private List<Contact> contacts;

  @BeforeAll
  void seedContacts() {
    Instant now = Instant.now();
    var ana = contact("Ana", "en_US", List.of("vip", "lead"), now.minus(Duration.ofHours(2)));
    ana.setCustomFields(
        Map.of("plan", "pro", "score", 42, "interests", List.of("shoes", "bags"), "beta", true));
    var bob = contact("Bob", "fr_FR", List.of("lead"), now.minus(Duration.ofDays(10)));
    bob.setCustomFields(Map.of("plan", "free", "score", 7, "renewal", "2026-01-15"));
    var nameless = contact(null, "en_GB", List.of(), null);
    nameless.setCustomFields(Map.of("score", "15", "plan", ""));
    nameless.setSubscribed(false);
    var blank = contact("  ", null, List.of("VIP"), now.minus(Duration.ofHours(30)));
    blank.setCustomFields(Map.of("plan", "PRO", "beta", "TRUE", "renewal", "2025-06-01"));
    contactRepository.saveAllAndFlush(List.of(ana, bob, nameless, blank));
    contacts =
        contactRepository.findAllById(
            List.of(ana.getId(), bob.getId(), nameless.getId(), blank.getId()));
  }

  static Stream<FilterGroup> filterTrees() {
    return Stream.of(
        FilterGroup.matchAll(),
        FilterGroup.and(FilterCondition.of("firstName", FilterOperator.EQUALS, "Ana")),
        FilterGroup.and(FilterCondition.of("firstName", FilterOperator.IS_EMPTY, null)),
        FilterGroup.and(FilterCondition.of("firstName", FilterOperator.IS_EMPTY, null).negated()),
        FilterGroup.and(
            FilterCondition.of("firstName", FilterOperator.IN, List.of("Ana", "Bob"))),
        FilterGroup.and(FilterCondition.of("locale", FilterOperator.STARTS_WITH, "EN")),
        FilterGroup.and(FilterCondition.of("locale", FilterOperator.NOT_CONTAINS, "fr")),
        FilterGroup.and(FilterCondition.of("tags", FilterOperator.CONTAINS, "vip")),
        FilterGroup.and(FilterCondition.of("tags", FilterOperator.EQUALS, "lead")),
        FilterGroup.and(FilterCondition.of("tags", FilterOperator.IS_EMPTY, null)),
        FilterGroup.and(FilterCondition.of("subscribed", FilterOperator.IS_FALSE, null)),
        FilterGroup.and(FilterCondition.of("within24hWindow", FilterOperator.IS_TRUE, null)),
        FilterGroup.and(
            FilterCondition.of("lastMessageFromContactAt", FilterOperator.WITHIN_LAST_DAYS, 3)),
        FilterGroup.and(
            FilterCondition.of(
                "lastMessageFromContactAt", FilterOperator.NOT_WITHIN_LAST_DAYS, 3)),
        FilterGroup.and(customField("plan", FilterOperator.EQUALS, "pro")),
        FilterGroup.and(customField("plan", FilterOperator.IS_EMPTY, null)),
        FilterGroup.and(customField("score", FilterOperator.GREATER_THAN, 10)),
        FilterGroup.and(customField("score", FilterOperator.BETWEEN, List.of(5, 20))),
        FilterGroup.and(customField("score", FilterOperator.EQUALS, "42")),
        FilterGroup.and(customField("interests", FilterOperator.CONTAINS, "shoe")),
        FilterGroup.and(customField("beta", FilterOperator.IS_TRUE, null)),
        FilterGroup.and(customField("renewal", FilterOperator.BEFORE, "2025-12-31")),
        FilterGroup.and(FilterCondition.of("score", FilterOperator.LESS_THAN_OR_EQUAL, 15)),
        FilterGroup.or(
            FilterCondition.of("locale", FilterOperator.STARTS_WITH, "fr"),
            FilterCondition.of("tags", FilterOperator.CONTAINS, "vip")),
        new FilterGroup(
            FilterLogic.AND,
            List.of(FilterCondition.of("tags", FilterOperator.CONTAINS, "lead")),
            true));
  }

  @ParameterizedTest
  @MethodSource("filterTrees")
  void findMatching_selectsSameContactsAsInMemoryEvaluation(FilterGroup filters) {
    var expected =
        contacts.stream()
            .filter(c -> evaluator.matches(filters, c))
            .map(Contact::getId)
            .collect(Collectors.toSet());

    var matched = ids(queryService.findMatching(WORKSPACE_ID, filters, false));

    assertThat(matched).isEqualTo(expected);
    assertThat(queryService.countMatching(WORKSPACE_ID, filters)).isEqualTo(expected.size());
  }

  @Test
  void findMatching_subscribedOnly_dropsUnsubscribedContacts() {
    var filters = FilterGroup.and(customField("score", FilterOperator.GREATER_THAN, 10));

    var matched = queryService.findMatching(WORKSPACE_ID, filters, true);

    assertThat(matched).extracting(Contact::getFirstName).containsExactly("Ana");
  }

  @Test
  void recalculate_dynamicSegment_replacesMembershipAndFeedsAudience() {
    var segment =
        segmentService.create(
            WORKSPACE_ID,
            "Leads",
            null,
            SegmentType.DYNAMIC,
            FilterGroup.and(FilterCondition.of("tags", FilterOperator.CONTAINS, "lead")));

    var first = segmentService.recalculate(segment.getId());
    segmentService.updateFilters(
        segment.getId(),
        FilterGroup.and(FilterCondition.of("tags", FilterOperator.CONTAINS, "vip")));
    var second = segmentService.recalculate(segment.getId());

    assertThat(first.contactCount()).isEqualTo(2);
    assertThat(second.contactCount()).isEqualTo(2);
    assertThat(memberRepository.countBySegmentId(segment.getId())).isEqualTo(2);
    var audience =
        audienceResolver.resolve(
            new AudienceDescriptor(
                WORKSPACE_ID, AudienceType.SEGMENT, segment.getId(), List.of(), List.of()));
    assertThat(audience)
        .extracting(ContactRef::psid)
        .containsExactlyInAnyOrder(psidOf("Ana"), psidOf("  "));
  }

  private Contact contact(
      String firstName, String locale, List<String> tags, Instant lastInbound) {
    var contact = new Contact(WORKSPACE_ID, PAGE_ID, "psid-" + UUID.randomUUID());
    contact.setNames(firstName, null);
    contact.setLocale(locale);
    contact.setTags(tags);
    contact.setLastMessageFromContactAt(lastInbound);
    return contact;
  }

  private String psidOf(String firstName) {
    return contacts.stream()
        .filter(c -> firstName.equals(c.getFirstName()))
        .findFirst()
        .orElseThrow()
        .getPsid();
  }

  private static FilterCondition customField(String key, FilterOperator operator, Object value) {
    return new FilterCondition("customField", key, operator, value, false);
  }

  private static Set<UUID> ids(List<Contact> contacts) {
    return contacts.stream().map(Contact::getId).collect(Collectors.toSet());
  }
}
