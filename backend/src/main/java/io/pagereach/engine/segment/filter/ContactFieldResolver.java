package io.pagereach.engine.segment.filter;

import io.pagereach.engine.compliance.MessagingWindow;
import io.pagereach.engine.contact.Contact;
import java.time.Instant;

/**
 * Reads the value a condition refers to. Unknown field names fall through to the contact's
 * custom-field map, so {@code age} and {@code customField/age} address the same value.
 */
final class ContactFieldResolver {

  static final String CUSTOM_FIELD = "customField";

  private ContactFieldResolver() {}

  static Object resolve(Contact contact, FilterCondition condition, Instant now) {
    String field = condition.field();
    if (field == null) {
      return null;
    }
    return switch (field) {
      case "firstName" -> contact.getFirstName();
      case "lastName" -> contact.getLastName();
      case "fullName" -> contact.getFullName();
      case "locale" -> contact.getLocale();
      case "gender" -> contact.getGender();
      case "source" -> contact.getSource();
      case "pageId" -> contact.getPageId() != null ? contact.getPageId().toString() : null;
      case "subscribed", "isSubscribed" -> contact.isSubscribed();
      case "lastMessageFromContactAt" -> contact.getLastMessageFromContactAt();
      case "lastMessageToContactAt" -> contact.getLastMessageToContactAt();
      case "createdAt" -> contact.getCreatedAt();
      case "tags", "hasTag" -> contact.getTags();
      case "within24hWindow", "isWithin24HWindow" ->
          MessagingWindow.isOpen(contact.getLastMessageFromContactAt(), now);
      case CUSTOM_FIELD -> contact.getCustomFields().get(condition.customFieldKey());
      default -> contact.getCustomFields().get(field);
    };
  }
}
