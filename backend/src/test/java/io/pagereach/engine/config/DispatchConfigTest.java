package io.pagereach.engine.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.pagereach.engine.dispatch.DispatchProperties;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class DispatchConfigTest {

  private final DispatchConfig config = new DispatchConfig();

  @Test
  void sendExecutor_queueHoldsAFullBatchForEveryPass() {
    var executor = config.sendExecutor(properties(50, 2, 4));
    try {
      var pool = executor.getThreadPoolExecutor();
      assertThat(pool.getQueue().remainingCapacity()).isEqualTo(200);
      assertThat(pool.getRejectedExecutionHandler())
          .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);
    } finally {
      executor.shutdown();
    }
  }

  @Test
  void sendExecutor_fullQueue_runsAttemptOnSubmittingThread() throws Exception {
    var executor = config.sendExecutor(properties(1, 1, 1));
    var release = new CountDownLatch(1);
    try {
      // Occupy the only worker, then fill the one-slot queue
      executor.execute(() -> await(release));
      executor.execute(() -> await(release));

      var ranOn = new AtomicReference<Thread>();
      executor.execute(() -> ranOn.set(Thread.currentThread()));

      assertThat(ranOn.get()).isSameAs(Thread.currentThread());
    } finally {
      release.countDown();
      executor.shutdown();
    }
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static DispatchProperties properties(int batchSize, int workerThreads, int passThreads) {
    return new DispatchProperties(
        batchSize,
        Duration.ZERO,
        200,
        1000,
        10,
        3,
        Duration.ofSeconds(1),
        2.0,
        Duration.ofSeconds(30),
        workerThreads,
        passThreads);
  }
}
