package io.pagereach.engine.campaign;

import io.pagereach.engine.integration.messaging.MessageContent;

/** One arm of an A/B test. Percentages across a campaign's variants sum to 100. */
public record AbVariant(String name, MessageContent content, int percentage) {}
