package io.pagereach.engine.compliance;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * @param reservationLease how long an OTN token or subscription reservation stays exclusive; a
 *     reservation older than this is treated as abandoned by a crashed worker
 * @param enforceTagCooldowns whether repeated tag sends to one contact honour the per-tag cooldown
 */
@Validated
@ConfigurationProperties(prefix = "engine.compliance")
public record ComplianceProperties(
    @NotNull @DefaultValue("15m") Duration reservationLease,
    @DefaultValue("true") boolean enforceTagCooldowns) {}
