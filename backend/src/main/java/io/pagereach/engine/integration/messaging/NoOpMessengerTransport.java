package io.pagereach.engine.integration.messaging;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Component;

/**
 * Fallback transport used when no platform client is configured. Logs the send instead of
 * performing it.
 */
@Component
@ConditionalOnMissingBean(value = MessengerTransport.class, ignored = NoOpMessengerTransport.class)
public class NoOpMessengerTransport implements MessengerTransport {

  private static final Logger log = LoggerFactory.getLogger(NoOpMessengerTransport.class);

  @Override
  public String transportId() {
    return "noop";
  }

  @Override
  public SendResult send(OutboundMessage message) {
    log.info(
        "NoOp transport: would send to {} via {}{}",
        message.recipientPsid(),
        message.method(),
        message.messageTag() != null ? " (" + message.messageTag() + ")" : "");
    return SendResult.sent("NOOP-" + UUID.randomUUID());
  }
}
