package io.pagereach.engine.dispatch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Send ceilings shared by every campaign: sends per page per hour, sends per workspace per hour
 * and sends per contact per minute. Each key gets a fixed window opened by its first send. A slot
 * is only granted when all three scopes have room; a scope that granted before another refused is
 * rolled back, so a refused send consumes nothing.
 */
@Component
public class SendRateLimiter {

  static final Duration HOUR = Duration.ofHours(1);
  static final Duration MINUTE = Duration.ofMinutes(1);

  private final FixedWindow page;
  private final FixedWindow workspace;
  private final FixedWindow contact;

  @Autowired
  public SendRateLimiter(DispatchProperties properties) {
    this(
        properties.pageHourlyLimit(),
        properties.workspaceHourlyLimit(),
        properties.contactMinuteLimit(),
        Ticker.systemTicker());
  }

  SendRateLimiter(
      int pageHourlyLimit, int workspaceHourlyLimit, int contactMinuteLimit, Ticker ticker) {
    this.page = new FixedWindow(pageHourlyLimit, HOUR, ticker);
    this.workspace = new FixedWindow(workspaceHourlyLimit, HOUR, ticker);
    this.contact = new FixedWindow(contactMinuteLimit, MINUTE, ticker);
  }

  /** Takes one slot in each scope, or none at all. */
  public boolean tryAcquire(SendSlot slot) {
    if (!page.tryAcquire(slot.pageId())) {
      return false;
    }
    if (slot.workspaceId() != null && !workspace.tryAcquire(slot.workspaceId())) {
      page.release(slot.pageId());
      return false;
    }
    if (!contact.tryAcquire(slot.contactId())) {
      page.release(slot.pageId());
      if (slot.workspaceId() != null) {
        workspace.release(slot.workspaceId());
      }
      return false;
    }
    return true;
  }

  /** Returns an unused slot to every scope, e.g. when the recipient turned out to be blocked. */
  public void release(SendSlot slot) {
    page.release(slot.pageId());
    if (slot.workspaceId() != null) {
      workspace.release(slot.workspaceId());
    }
    contact.release(slot.contactId());
  }

  /**
   * Time until every saturated scope of the slot has reopened; zero when nothing is saturated.
   */
  public Duration timeUntilAvailable(SendSlot slot) {
    var wait = page.waitFor(slot.pageId());
    if (slot.workspaceId() != null) {
      wait = max(wait, workspace.waitFor(slot.workspaceId()));
    }
    return max(wait, contact.waitFor(slot.contactId()));
  }

  public RateLimitStatus getPageStatus(UUID pageId) {
    return page.status(pageId);
  }

  public RateLimitStatus getWorkspaceStatus(UUID workspaceId) {
    return workspace.status(workspaceId);
  }

  public RateLimitStatus getContactStatus(UUID contactId) {
    return contact.status(contactId);
  }

  private static Duration max(Duration a, Duration b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  /** The scopes one send counts against. {@code workspaceId} may be null for unowned pages. */
  public record SendSlot(UUID pageId, UUID workspaceId, UUID contactId) {}

  public record RateLimitStatus(int currentCount, int limit, boolean allowed) {}

  /**
   * Counter per key over a fixed window; the counter only changes through increment-and-check, so
   * concurrent dispatchers cannot overshoot the limit.
   */
  private static final class FixedWindow {

    private final int limit;
    private final Duration length;
    private final Ticker ticker;
    private final Cache<UUID, Window> windows;

    private FixedWindow(int limit, Duration length, Ticker ticker) {
      this.limit = limit;
      this.length = length;
      this.ticker = ticker;
      this.windows =
          Caffeine.newBuilder()
              .expireAfterWrite(length)
              .maximumSize(100_000)
              .ticker(ticker)
              .build();
    }

    boolean tryAcquire(UUID key) {
      var window = windows.get(key, k -> new Window(ticker.read()));
      if (window.count.incrementAndGet() > limit) {
        window.count.decrementAndGet();
        return false;
      }
      return true;
    }

    void release(UUID key) {
      var window = windows.getIfPresent(key);
      if (window != null) {
        window.count.updateAndGet(current -> current > 0 ? current - 1 : 0);
      }
    }

    /** Remaining window length when the key is at its limit, otherwise zero. */
    Duration waitFor(UUID key) {
      var window = windows.getIfPresent(key);
      if (window == null || window.count.get() < limit) {
        return Duration.ZERO;
      }
      var remaining = length.minusNanos(ticker.read() - window.openedAtNanos);
      return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    RateLimitStatus status(UUID key) {
      var window = windows.getIfPresent(key);
      int currentCount = window != null ? window.count.get() : 0;
      return new RateLimitStatus(currentCount, limit, currentCount < limit);
    }
  }

  private static final class Window {

    private final long openedAtNanos;
    private final AtomicInteger count = new AtomicInteger();

    private Window(long openedAtNanos) {
      this.openedAtNanos = openedAtNanos;
    }
  }
}
