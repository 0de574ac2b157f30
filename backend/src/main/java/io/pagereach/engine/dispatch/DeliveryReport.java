package io.pagereach.engine.dispatch;

import io.pagereach.engine.compliance.BypassMethod;
import io.pagereach.engine.compliance.MessageTag;
import io.pagereach.engine.stats.RecipientOutcome;
import java.util.UUID;

/** Terminal outcome of one recipient, emitted exactly once per target by the dispatcher. */
public record DeliveryReport(
    UUID campaignId,
    int runNumber,
    UUID contactId,
    RecipientOutcome outcome,
    BypassMethod method,
    MessageTag messageTag,
    UUID artifactId,
    String platformMessageId,
    String errorCode,
    String errorMessage,
    int attempts) {}
