package io.pagereach.engine.integration.messaging;

/**
 * Transport outcome. A failed result with {@code retryable=true} is a transient fault (network,
 * 5xx, platform throttling); any other failure is permanent.
 */
public record SendResult(
    boolean success,
    String platformMessageId,
    String errorCode,
    String errorMessage,
    boolean retryable) {

  public static SendResult sent(String platformMessageId) {
    return new SendResult(true, platformMessageId, null, null, false);
  }

  public static SendResult transientFailure(String errorCode, String errorMessage) {
    return new SendResult(false, null, errorCode, errorMessage, true);
  }

  public static SendResult permanentFailure(String errorCode, String errorMessage) {
    return new SendResult(false, null, errorCode, errorMessage, false);
  }
}
