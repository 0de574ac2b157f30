package io.pagereach.engine.contact;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A messaging-platform user reachable through one page. The engine only reads contacts; webhook
 * ingestion owns the interaction timestamps and the subscribed flag.
 */
@Entity
@Table(name = "contacts")
public class Contact {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "workspace_id", nullable = false)
  private UUID workspaceId;

  @Column(name = "page_id", nullable = false)
  private UUID pageId;

  @Column(name = "psid", nullable = false, length = 64)
  private String psid;

  @Column(name = "first_name", length = 100)
  private String firstName;

  @Column(name = "last_name", length = 100)
  private String lastName;

  @Column(name = "full_name", length = 200)
  private String fullName;

  @Column(name = "locale", length = 20)
  private String locale;

  @Column(name = "gender", length = 20)
  private String gender;

  @Column(name = "source", length = 50)
  private String source;

  @Column(name = "is_subscribed", nullable = false)
  private boolean subscribed = true;

  @Column(name = "last_message_from_contact_at")
  private Instant lastMessageFromContactAt;

  @Column(name = "last_message_to_contact_at")
  private Instant lastMessageToContactAt;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "custom_fields", columnDefinition = "jsonb")
  private Map<String, Object> customFields = new HashMap<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "tags", columnDefinition = "jsonb")
  private List<String> tags = new ArrayList<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Contact() {}

  public Contact(UUID workspaceId, UUID pageId, String psid) {
    this.workspaceId = workspaceId;
    this.pageId = pageId;
    this.psid = psid;
    this.createdAt = Instant.now();
  }

  public ContactRef toRef() {
    return new ContactRef(id, pageId, psid, lastMessageFromContactAt, subscribed);
  }

  public UUID getId() {
    return id;
  }

  public UUID getWorkspaceId() {
    return workspaceId;
  }

  public UUID getPageId() {
    return pageId;
  }

  public String getPsid() {
    return psid;
  }

  public String getFirstName() {
    return firstName;
  }

  public String getLastName() {
    return lastName;
  }

  public String getFullName() {
    return fullName;
  }

  public void setNames(String firstName, String lastName) {
    this.firstName = firstName;
    this.lastName = lastName;
    this.fullName =
        String.join(" ", firstName != null ? firstName : "", lastName != null ? lastName : "")
            .trim();
  }

  public String getLocale() {
    return locale;
  }

  public void setLocale(String locale) {
    this.locale = locale;
  }

  public String getGender() {
    return gender;
  }

  public void setGender(String gender) {
    this.gender = gender;
  }

  public String getSource() {
    return source;
  }

  public void setSource(String source) {
    this.source = source;
  }

  public boolean isSubscribed() {
    return subscribed;
  }

  public void setSubscribed(boolean subscribed) {
    this.subscribed = subscribed;
  }

  public Instant getLastMessageFromContactAt() {
    return lastMessageFromContactAt;
  }

  public void setLastMessageFromContactAt(Instant lastMessageFromContactAt) {
    this.lastMessageFromContactAt = lastMessageFromContactAt;
  }

  public Instant getLastMessageToContactAt() {
    return lastMessageToContactAt;
  }

  public void setLastMessageToContactAt(Instant lastMessageToContactAt) {
    this.lastMessageToContactAt = lastMessageToContactAt;
  }

  public Map<String, Object> getCustomFields() {
    return customFields != null ? customFields : Map.of();
  }

  public void setCustomFields(Map<String, Object> customFields) {
    this.customFields = customFields;
  }

  public List<String> getTags() {
    return tags != null ? tags : List.of();
  }

  public void setTags(List<String> tags) {
    this.tags = tags;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
