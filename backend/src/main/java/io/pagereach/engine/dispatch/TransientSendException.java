package io.pagereach.engine.dispatch;

import io.pagereach.engine.integration.messaging.SendResult;

/** Signals a retryable transport failure to the retry template. */
public class TransientSendException extends RuntimeException {

  private final transient SendResult result;

  public TransientSendException(SendResult result) {
    super(result.errorCode() + ": " + result.errorMessage());
    this.result = result;
  }

  public TransientSendException(SendResult result, Throwable cause) {
    super(result.errorCode() + ": " + result.errorMessage(), cause);
    this.result = result;
  }

  public SendResult result() {
    return result;
  }
}
