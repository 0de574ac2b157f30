package io.pagereach.engine.audience;

import static org.assertj.core.api.Assertions.assertThat;

import io.pagereach.engine.TestcontainersConfiguration;
import io.pagereach.engine.contact.Contact;
import io.pagereach.engine.contact.ContactRef;
import io.pagereach.engine.contact.ContactRepository;
import io.pagereach.engine.segment.SegmentService;
import io.pagereach.engine.segment.SegmentType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class AudienceResolverIntegrationTest {

  private static final UUID PAGE_ID = UUID.randomUUID();

  @Autowired private AudienceResolver resolver;
  @Autowired private SegmentService segmentService;
  @Autowired private ContactRepository contactRepository;
  @Autowired private JdbcTemplate jdbcTemplate;

  @Test
  void staticSegment_resolvesSubscribedMembersOfItsWorkspaceOnly() {
    var workspaceId = UUID.randomUUID();
    var first = save(new Contact(workspaceId, PAGE_ID, psid()));
    var unsubscribed = new Contact(workspaceId, PAGE_ID, psid());
    unsubscribed.setSubscribed(false);
    save(unsubscribed);
    var foreign = save(new Contact(UUID.randomUUID(), PAGE_ID, psid()));
    var second = save(new Contact(workspaceId, PAGE_ID, psid()));
    var segment =
        segmentService.create(workspaceId, "Imported", null, SegmentType.STATIC, null);
    segmentService.addMembers(
        segment.getId(),
        List.of(second.getId(), unsubscribed.getId(), foreign.getId(), first.getId()));

    var audience =
        resolver.resolve(
            new AudienceDescriptor(
                workspaceId, AudienceType.SEGMENT, segment.getId(), List.of(), List.of()));

    assertThat(audience)
        .extracting(ContactRef::contactId)
        .containsExactly(first.getId(), second.getId());
  }

  @Test
  void manualAudienceAboveChunkSize_returnsEveryContactInDatabaseOrder() {
    var workspaceId = UUID.randomUUID();
    int size = AudienceResolver.ID_CHUNK_SIZE * 2 + 150;
    contactRepository.saveAllAndFlush(
        IntStream.range(0, size)
            .mapToObj(i -> new Contact(workspaceId, PAGE_ID, psid()))
            .toList());
    List<UUID> databaseOrder =
        jdbcTemplate.queryForList(
            "SELECT id FROM contacts WHERE workspace_id = ? ORDER BY created_at, id",
            UUID.class,
            workspaceId);
    var requested = new ArrayList<>(databaseOrder);
    Collections.shuffle(requested);
    requested.add(requested.get(0));

    var audience =
        resolver.resolve(
            new AudienceDescriptor(workspaceId, AudienceType.MANUAL, null, List.of(), requested));

    assertThat(audience).extracting(ContactRef::contactId).isEqualTo(databaseOrder);
  }

  private Contact save(Contact contact) {
    return contactRepository.saveAndFlush(contact);
  }

  private static String psid() {
    return "psid-" + UUID.randomUUID();
  }
}
