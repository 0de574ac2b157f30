package io.pagereach.engine.segment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically recalculates every dynamic segment. Each segment runs in its own transaction via
 * the service proxy, so one failing segment does not stop the others.
 */
@Component
public class SegmentRefreshExecutor {

  private static final Logger log = LoggerFactory.getLogger(SegmentRefreshExecutor.class);

  private final SegmentService segmentService;

  public SegmentRefreshExecutor(SegmentService segmentService) {
    this.segmentService = segmentService;
  }

  @Scheduled(cron = "${engine.scheduler.segment-refresh-cron:0 0 * * * *}")
  public void recalculateAllDynamic() {
    var segments = segmentService.findDynamicSegments();
    int refreshed = 0;
    for (var segment : segments) {
      try {
        segmentService.recalculate(segment.getId());
        refreshed++;
      } catch (Exception e) {
        log.error("Failed to recalculate segment {}: {}", segment.getId(), e.getMessage(), e);
      }
    }
    log.info("Segment refresh completed: {} of {} dynamic segments", refreshed, segments.size());
  }
}
