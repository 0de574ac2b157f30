package io.pagereach.engine.contact;

import java.time.Instant;
import java.util.UUID;

/**
 * Detached view of a contact handed between the audience resolver, the bypass resolver and the
 * dispatcher. Safe to pass across threads.
 */
public record ContactRef(
    UUID contactId,
    UUID pageId,
    String psid,
    Instant lastMessageFromContactAt,
    boolean subscribed) {}
