package io.pagereach.engine.campaign;

import io.pagereach.engine.integration.messaging.MessageContent;

/**
 * @param delayMinutes wait after the previous step's run finished; ignored for the first step
 */
public record DripStep(int delayMinutes, MessageContent content, DripCondition condition) {

  public DripStep {
    condition = condition != null ? condition : DripCondition.NONE;
  }
}
