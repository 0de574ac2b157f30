package io.pagereach.engine.campaign;

import io.pagereach.engine.contact.ContactRef;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Splits a run's audience between A/B variants. The audience is shuffled with a seed derived from
 * the campaign id and run number, so the same snapshot always yields the same assignment. Each
 * variant but the last takes {@code floor(size * percentage / 100)} contacts; the last variant
 * takes the remainder.
 */
@Component
public class VariantAssigner {

  /** Returns contact id to variant name, in audience order. Empty when there are no variants. */
  public Map<UUID, String> assign(
      UUID campaignId, int runNumber, List<ContactRef> audience, List<AbVariant> variants) {
    if (variants.isEmpty() || audience.isEmpty()) {
      return Map.of();
    }
    var shuffled = new ArrayList<>(audience);
    Collections.shuffle(shuffled, new Random(seed(campaignId, runNumber)));

    var byContact = new HashMap<UUID, String>();
    int offset = 0;
    for (int i = 0; i < variants.size(); i++) {
      var variant = variants.get(i);
      int count =
          i == variants.size() - 1
              ? shuffled.size() - offset
              : (int) ((long) shuffled.size() * variant.percentage() / 100);
      for (int j = offset; j < offset + count; j++) {
        byContact.put(shuffled.get(j).contactId(), variant.name());
      }
      offset += count;
    }

    var ordered = new LinkedHashMap<UUID, String>();
    for (ContactRef contact : audience) {
      ordered.put(contact.contactId(), byContact.get(contact.contactId()));
    }
    return ordered;
  }

  static long seed(UUID campaignId, int runNumber) {
    return campaignId.getMostSignificantBits() ^ campaignId.getLeastSignificantBits() ^ runNumber;
  }
}
