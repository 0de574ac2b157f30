package io.pagereach.engine.campaign;

import static org.assertj.core.api.Assertions.assertThat;

import io.pagereach.engine.contact.ContactRef;
import io.pagereach.engine.integration.messaging.MessageContent;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class VariantAssignerTest {

  private final VariantAssigner assigner = new VariantAssigner();
  private final UUID campaignId = UUID.randomUUID();

  @Test
  void assign_evenSplitOfOddAudience_givesRemainderToLastVariant() {
    var audience = audience(101);

    var assignment = assigner.assign(campaignId, 1, audience, variants(50, 50));

    assertThat(counts(assignment.values())).containsEntry("A", 50L).containsEntry("B", 51L);
  }

  @Test
  void assign_threeVariants_coversWholeAudience() {
    var audience = audience(10);

    var assignment = assigner.assign(campaignId, 1, audience, variants(33, 33, 34));

    assertThat(assignment).hasSize(10);
    assertThat(counts(assignment.values()))
        .containsEntry("A", 3L)
        .containsEntry("B", 3L)
        .containsEntry("C", 4L);
  }

  @Test
  void assign_sameSnapshot_isDeterministic() {
    var audience = audience(40);
    var variants = variants(30, 70);

    var first = assigner.assign(campaignId, 1, audience, variants);
    var second = assigner.assign(campaignId, 1, audience, variants);

    assertThat(second).isEqualTo(first);
  }

  @Test
  void assign_keepsAudienceOrder() {
    var audience = audience(20);

    var assignment = assigner.assign(campaignId, 1, audience, variants(50, 50));

    assertThat(assignment.keySet())
        .containsExactlyElementsOf(audience.stream().map(ContactRef::contactId).toList());
  }

  @Test
  void assign_noVariants_isEmpty() {
    assertThat(assigner.assign(campaignId, 1, audience(5), List.of())).isEmpty();
  }

  private static List<ContactRef> audience(int size) {
    var pageId = UUID.randomUUID();
    return IntStream.range(0, size)
        .mapToObj(i -> new ContactRef(UUID.randomUUID(), pageId, "psid-" + i, null, true))
        .toList();
  }

  private static List<AbVariant> variants(int... percentages) {
    return IntStream.range(0, percentages.length)
        .mapToObj(
            i ->
                new AbVariant(
                    String.valueOf((char) ('A' + i)),
                    MessageContent.text("Variant " + i),
                    percentages[i]))
        .toList();
  }

  private static Map<String, Long> counts(Collection<String> names) {
    return names.stream()
        .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
  }
}
