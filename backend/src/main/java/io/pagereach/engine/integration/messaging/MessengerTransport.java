package io.pagereach.engine.integration.messaging;

/**
 * Port for the social platform's send API. Implementations report every fault through {@link
 * SendResult}; an exception escaping {@link #send} is treated as a transient fault.
 */
public interface MessengerTransport {

  /** Transport identifier (e.g., "graph-api", "noop"). */
  String transportId();

  SendResult send(OutboundMessage message);
}
