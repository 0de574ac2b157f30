package io.pagereach.engine.integration.messaging;

import java.util.List;

/**
 * Message body as stored on a campaign and handed to the transport unchanged.
 *
 * @param attachmentType image, video, audio or file; null when there is no attachment
 */
public record MessageContent(
    String text, String attachmentUrl, String attachmentType, List<QuickReply> quickReplies) {

  public static MessageContent text(String text) {
    return new MessageContent(text, null, null, List.of());
  }

  public boolean isEmpty() {
    return (text == null || text.isBlank()) && attachmentUrl == null;
  }

  public record QuickReply(String title, String payload) {}
}
