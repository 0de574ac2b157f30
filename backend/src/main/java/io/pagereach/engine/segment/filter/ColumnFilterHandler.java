package io.pagereach.engine.segment.filter;

import io.pagereach.engine.compliance.MessagingWindow;
import java.time.ZoneOffset;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Translates conditions on the contact's own columns, including the virtual window flag. */
@Component
public class ColumnFilterHandler {

  private static final Map<String, SqlOperand> COLUMNS =
      Map.ofEntries(
          Map.entry("firstName", SqlOperand.text("c.first_name")),
          Map.entry("lastName", SqlOperand.text("c.last_name")),
          Map.entry("fullName", SqlOperand.text("c.full_name")),
          Map.entry("locale", SqlOperand.text("c.locale")),
          Map.entry("gender", SqlOperand.text("c.gender")),
          Map.entry("source", SqlOperand.text("c.source")),
          Map.entry("pageId", SqlOperand.text("CAST(c.page_id AS text)")),
          Map.entry("subscribed", SqlOperand.bool("c.is_subscribed")),
          Map.entry("isSubscribed", SqlOperand.bool("c.is_subscribed")),
          Map.entry(
              "lastMessageFromContactAt", SqlOperand.timestamp("c.last_message_from_contact_at")),
          Map.entry("lastMessageToContactAt", SqlOperand.timestamp("c.last_message_to_contact_at")),
          Map.entry("createdAt", SqlOperand.timestamp("c.created_at")));

  private static final String NULL_FIELD = "CAST(NULL AS text)";

  public boolean supports(String field) {
    return field == null
        || COLUMNS.containsKey(field)
        || "within24hWindow".equals(field)
        || "isWithin24HWindow".equals(field);
  }

  public String buildPredicate(FilterCondition condition, FilterSqlContext context) {
    SqlOperand operand = operandFor(condition.field(), context);
    return OperatorPredicates.build(
        condition.operator(), condition.value(), FieldShape.scalar(operand), context);
  }

  private SqlOperand operandFor(String field, FilterSqlContext context) {
    if (field == null) {
      return SqlOperand.text(NULL_FIELD);
    }
    SqlOperand column = COLUMNS.get(field);
    if (column != null) {
      return column;
    }
    String windowStart =
        context.bind(context.now().minus(MessagingWindow.STANDARD).atOffset(ZoneOffset.UTC));
    return SqlOperand.bool(
        "(c.last_message_from_contact_at IS NOT NULL AND c.last_message_from_contact_at >= "
            + windowStart
            + ")");
  }
}
