package io.pagereach.engine.integration.messaging;

import io.pagereach.engine.compliance.BypassMethod;
import io.pagereach.engine.compliance.MessageTag;

/**
 * One send request for the transport.
 *
 * @param bypassToken OTN or recurring-notification token when the method needs one
 */
public record OutboundMessage(
    String pageAccessToken,
    String recipientPsid,
    MessageContent content,
    BypassMethod method,
    MessageTag messageTag,
    String bypassToken) {}
