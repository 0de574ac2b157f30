package io.pagereach.engine.dispatch;

import io.pagereach.engine.compliance.BypassResolution;
import io.pagereach.engine.compliance.BypassResolver;
import io.pagereach.engine.integration.messaging.MessengerTransport;
import io.pagereach.engine.integration.messaging.OutboundMessage;
import io.pagereach.engine.integration.messaging.SendResult;
import io.pagereach.engine.integration.secret.PageTokenProvider;
import io.pagereach.engine.integration.secret.PageTokenUnavailableException;
import io.pagereach.engine.stats.RecipientOutcome;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Runs dispatch passes: pulls recipients from a {@link RecipientQueue} in batches, attempts every
 * recipient of a batch concurrently, waits for the whole batch to settle and then pauses for the
 * configured inter-batch delay.
 *
 * <p>Per recipient the pipeline is: send slot (page, workspace and contact ceilings), bypass
 * resolution, page token, send with retries, artifact confirm or release, outcome report. A
 * recipient over any ceiling is deferred until the saturated windows reopen and produces no
 * outcome. Every other recipient produces exactly one {@link DeliveryReport}.
 */
@Service
public class CampaignDispatcher {

  private static final Logger log = LoggerFactory.getLogger(CampaignDispatcher.class);

  private final DispatchProperties properties;
  private final SendRateLimiter rateLimiter;
  private final BypassResolver bypassResolver;
  private final MessengerTransport transport;
  private final PageTokenProvider pageTokenProvider;
  private final RetryTemplate sendRetryTemplate;
  private final Executor sendExecutor;
  private final Executor passExecutor;
  private final DispatchSignals signals;
  private final Clock clock;

  public CampaignDispatcher(
      DispatchProperties properties,
      SendRateLimiter rateLimiter,
      BypassResolver bypassResolver,
      MessengerTransport transport,
      PageTokenProvider pageTokenProvider,
      @Qualifier("sendRetryTemplate") RetryTemplate sendRetryTemplate,
      @Qualifier("sendExecutor") Executor sendExecutor,
      @Qualifier("passExecutor") Executor passExecutor,
      DispatchSignals signals,
      Clock clock) {
    this.properties = properties;
    this.rateLimiter = rateLimiter;
    this.bypassResolver = bypassResolver;
    this.transport = transport;
    this.pageTokenProvider = pageTokenProvider;
    this.sendRetryTemplate = sendRetryTemplate;
    this.sendExecutor = sendExecutor;
    this.passExecutor = passExecutor;
    this.signals = signals;
    this.clock = clock;
  }

  public CompletableFuture<DispatchSummary> dispatchAsync(
      UUID campaignId, RecipientQueue queue, DeliveryListener listener) {
    return CompletableFuture.supplyAsync(
        () -> dispatch(campaignId, queue, listener), passExecutor);
  }

  /**
   * Runs one pass for the campaign on the calling thread. Returns a skipped summary when another
   * pass for the same campaign is already running; that pass then drains its queue once more.
   */
  public DispatchSummary dispatch(
      UUID campaignId, RecipientQueue queue, DeliveryListener listener) {
    var started = signals.tryStart(campaignId);
    if (started.isEmpty()) {
      log.debug("Dispatch pass for campaign {} already active, skipping", campaignId);
      return DispatchSummary.skipped(campaignId);
    }
    var control = started.get();
    var tally = new Tally();
    int batches = 0;
    boolean stopped = false;

    try {
      while (true) {
        if (control.isStopRequested()) {
          stopped = true;
          break;
        }
        List<DispatchTarget> batch = queue.nextBatch(properties.batchSize());
        if (batch.isEmpty()) {
          if (signals.finishIfIdle(control)) {
            break;
          }
          log.debug(
              "Dispatch pass for campaign {} requested again, draining once more", campaignId);
          continue;
        }
        runBatch(batch, queue, listener, tally);
        batches++;
        if (!pauseBetweenBatches()) {
          stopped = true;
          break;
        }
      }
    } finally {
      signals.finish(control);
    }

    var summary =
        new DispatchSummary(
            campaignId,
            batches,
            tally.sent.get(),
            tally.failed.get(),
            tally.blocked.get(),
            tally.deferred.get(),
            stopped,
            false);
    log.info(
        "Dispatch pass for campaign {} finished: {} batches, {} sent, {} failed, {} blocked,"
            + " {} deferred{}",
        campaignId,
        batches,
        summary.sent(),
        summary.failed(),
        summary.blocked(),
        summary.deferred(),
        stopped ? " (stopped)" : "");
    return summary;
  }

  private void runBatch(
      List<DispatchTarget> batch, RecipientQueue queue, DeliveryListener listener, Tally tally) {
    var attempts = new ArrayList<CompletableFuture<Void>>(batch.size());
    for (DispatchTarget target : batch) {
      attempts.add(
          CompletableFuture.runAsync(() -> attempt(target, queue, listener, tally), sendExecutor)
              .exceptionally(
                  ex -> {
                    log.error(
                        "Unhandled failure dispatching contact {} of campaign {}",
                        target.contact().contactId(),
                        target.campaignId(),
                        ex);
                    return null;
                  }));
    }
    CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0])).join();
  }

  private void attempt(
      DispatchTarget target, RecipientQueue queue, DeliveryListener listener, Tally tally) {
    UUID pageId = target.pageId();
    var slot = target.slot();
    if (!rateLimiter.tryAcquire(slot)) {
      var notBefore = clock.instant().plus(rateLimiter.timeUntilAvailable(slot));
      queue.defer(target, notBefore);
      tally.deferred.incrementAndGet();
      log.debug(
          "Send limit reached for page {}, deferred contact {} until {}",
          pageId,
          target.contact().contactId(),
          notBefore);
      return;
    }

    BypassResolution resolution;
    try {
      resolution =
          bypassResolver.resolve(target.contact(), target.preference(), target.reservationKey());
    } catch (RuntimeException e) {
      rateLimiter.release(slot);
      log.warn(
          "Bypass resolution failed for contact {}: {}",
          target.contact().contactId(),
          e.getMessage());
      report(listener, tally, failure(target, null, "RESOLUTION_ERROR", e.getMessage(), 0, false));
      return;
    }

    if (resolution.isBlocked()) {
      rateLimiter.release(slot);
      report(
          listener,
          tally,
          new DeliveryReport(
              target.campaignId(),
              target.runNumber(),
              target.contact().contactId(),
              RecipientOutcome.BLOCKED,
              resolution.method(),
              null,
              null,
              null,
              "NO_LEGAL_METHOD",
              resolution.blockReason(),
              0));
      return;
    }

    String pageToken;
    try {
      pageToken = pageTokenProvider.accessToken(pageId);
    } catch (PageTokenUnavailableException e) {
      rateLimiter.release(slot);
      bypassResolver.release(resolution);
      report(
          listener,
          tally,
          failure(target, resolution, "PAGE_TOKEN_UNAVAILABLE", e.getMessage(), 0, false));
      return;
    }

    var message =
        new OutboundMessage(
            pageToken,
            target.contact().psid(),
            target.content(),
            resolution.method(),
            resolution.messageTag(),
            resolution.artifactValue());
    var attempts = new AtomicInteger();
    SendResult result = sendWithRetry(message, attempts);

    if (result.success()) {
      bypassResolver.confirm(resolution);
      report(
          listener,
          tally,
          new DeliveryReport(
              target.campaignId(),
              target.runNumber(),
              target.contact().contactId(),
              RecipientOutcome.SENT,
              resolution.method(),
              resolution.messageTag(),
              resolution.artifactId(),
              result.platformMessageId(),
              null,
              null,
              attempts.get()));
      return;
    }

    bypassResolver.release(resolution);
    log.warn(
        "Send to contact {} of campaign {} failed after {} attempt(s): {} {}",
        target.contact().contactId(),
        target.campaignId(),
        attempts.get(),
        result.errorCode(),
        result.errorMessage());
    report(
        listener,
        tally,
        failure(
            target,
            resolution,
            result.errorCode(),
            result.errorMessage(),
            attempts.get(),
            result.retryable()));
  }

  private SendResult sendWithRetry(OutboundMessage message, AtomicInteger attempts) {
    return sendRetryTemplate.execute(
        context -> {
          attempts.incrementAndGet();
          SendResult result;
          try {
            result = transport.send(message);
          } catch (RuntimeException e) {
            throw new TransientSendException(
                SendResult.transientFailure("TRANSPORT_EXCEPTION", e.getMessage()), e);
          }
          if (!result.success() && result.retryable()) {
            throw new TransientSendException(result);
          }
          return result;
        },
        context -> {
          if (context.getLastThrowable() instanceof TransientSendException transientFailure) {
            return transientFailure.result();
          }
          return SendResult.transientFailure(
              "RETRY_EXHAUSTED", String.valueOf(context.getLastThrowable()));
        });
  }

  private void report(DeliveryListener listener, Tally tally, DeliveryReport report) {
    switch (report.outcome()) {
      case SENT -> tally.sent.incrementAndGet();
      case BLOCKED -> tally.blocked.incrementAndGet();
      case FAILED_PERMANENT, FAILED_EXHAUSTED -> tally.failed.incrementAndGet();
    }
    listener.onOutcome(report);
  }

  private static DeliveryReport failure(
      DispatchTarget target,
      BypassResolution resolution,
      String errorCode,
      String errorMessage,
      int attempts,
      boolean exhausted) {
    return new DeliveryReport(
        target.campaignId(),
        target.runNumber(),
        target.contact().contactId(),
        exhausted ? RecipientOutcome.FAILED_EXHAUSTED : RecipientOutcome.FAILED_PERMANENT,
        resolution != null ? resolution.method() : null,
        resolution != null ? resolution.messageTag() : null,
        resolution != null ? resolution.artifactId() : null,
        null,
        errorCode,
        errorMessage,
        attempts);
  }

  private boolean pauseBetweenBatches() {
    long millis = properties.batchDelay().toMillis();
    if (millis <= 0) {
      return true;
    }
    try {
      Thread.sleep(millis);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static final class Tally {
    private final AtomicInteger sent = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger blocked = new AtomicInteger();
    private final AtomicInteger deferred = new AtomicInteger();
  }
}
