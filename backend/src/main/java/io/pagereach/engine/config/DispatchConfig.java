package io.pagereach.engine.config;

import io.pagereach.engine.dispatch.DispatchProperties;
import io.pagereach.engine.dispatch.TransientSendException;
import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class DispatchConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Runs individual send attempts. Every concurrent pass can queue a full batch; should the queue
   * still fill up, the pass thread runs the attempt itself.
   */
  @Bean(name = "sendExecutor")
  public ThreadPoolTaskExecutor sendExecutor(DispatchProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.batchSize() * properties.passThreads());
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setThreadNamePrefix("dispatch-send-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  /** Runs whole dispatch passes, one thread per campaign being dispatched. */
  @Bean(name = "passExecutor")
  public ThreadPoolTaskExecutor passExecutor(DispatchProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.passThreads());
    executor.setMaxPoolSize(properties.passThreads());
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("dispatch-pass-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(60);
    executor.initialize();
    return executor;
  }

  /** Exponential backoff on transient transport failures only. */
  @Bean(name = "sendRetryTemplate")
  public RetryTemplate sendRetryTemplate(DispatchProperties properties) {
    return sendRetryTemplate(
        properties.maxAttempts(),
        properties.initialBackoff().toMillis(),
        properties.backoffMultiplier(),
        properties.maxBackoff().toMillis());
  }

  public static RetryTemplate sendRetryTemplate(
      int maxAttempts, long initialBackoffMillis, double multiplier, long maxBackoffMillis) {
    return RetryTemplate.builder()
        .maxAttempts(maxAttempts)
        .exponentialBackoff(initialBackoffMillis, multiplier, maxBackoffMillis)
        .retryOn(TransientSendException.class)
        .build();
  }
}
