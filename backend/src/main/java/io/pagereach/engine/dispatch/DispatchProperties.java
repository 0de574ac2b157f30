package io.pagereach.engine.dispatch;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Dispatch throughput and retry settings.
 *
 * @param batchSize recipients pulled and attempted together
 * @param batchDelay pause after each batch has settled
 * @param pageHourlyLimit sends allowed per page per hour across all campaigns
 * @param workspaceHourlyLimit sends allowed per workspace per hour across all its pages
 * @param contactMinuteLimit sends allowed to one contact per minute
 * @param maxAttempts transport attempts per recipient, first try included
 * @param initialBackoff wait before the second attempt
 * @param backoffMultiplier growth factor between attempts
 * @param maxBackoff ceiling on a single wait
 * @param workerThreads threads running individual send attempts
 * @param passThreads campaigns that can be dispatching at the same time
 */
@Validated
@ConfigurationProperties(prefix = "engine.dispatch")
public record DispatchProperties(
    @Min(1) @DefaultValue("50") int batchSize,
    @NotNull @DefaultValue("100ms") Duration batchDelay,
    @Min(1) @DefaultValue("200") int pageHourlyLimit,
    @Min(1) @DefaultValue("1000") int workspaceHourlyLimit,
    @Min(1) @DefaultValue("10") int contactMinuteLimit,
    @Min(1) @DefaultValue("3") int maxAttempts,
    @NotNull @DefaultValue("1s") Duration initialBackoff,
    @DecimalMin("1.0") @DefaultValue("2.0") double backoffMultiplier,
    @NotNull @DefaultValue("30s") Duration maxBackoff,
    @Min(1) @DefaultValue("8") int workerThreads,
    @Min(1) @DefaultValue("4") int passThreads) {}
