package org.assetwatch.anomaly.task.manager.job;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.io.IOException;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.assetwatch.anomaly.datamodel.DetectionContext;
import org.assetwatch.anomaly.datamodel.DetectionTask;
import org.assetwatch.anomaly.datamodel.ScanPair;
import org.assetwatch.anomaly.datamodel.queue.DetectionTaskQueue;
import org.assetwatch.anomaly.datamodel.store.StoreUnavailableException;
import org.assetwatch.anomaly.task.manager.scanner.PairScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One scheduler tick: list live pairs and enqueue a detection task for each. Ticks never overlap;
 * a tick that arrives while another is still dispatching is dropped.
 */
public class ScanDispatcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(ScanDispatcher.class);
  private static final String PAIRS_SCANNED_COUNTER = "assetwatch.anomaly.scan.pairs";
  private static final String TASKS_ENQUEUED_COUNTER = "assetwatch.anomaly.scan.tasks.enqueued";
  private static final String ENQUEUE_FAILURE_COUNTER = "assetwatch.anomaly.scan.enqueue.error";
  private static final String SKIPPED_TICK_COUNTER = "assetwatch.anomaly.scan.skipped";

  private final DetectionContext context;
  private final PairScanner pairScanner;
  private final DetectionTaskQueue taskQueue;
  private final AtomicBoolean scanInProgress = new AtomicBoolean(false);
  private final Counter pairsScannedCounter = Metrics.counter(PAIRS_SCANNED_COUNTER);
  private final Counter tasksEnqueuedCounter = Metrics.counter(TASKS_ENQUEUED_COUNTER);
  private final Counter enqueueFailureCounter = Metrics.counter(ENQUEUE_FAILURE_COUNTER);
  private final Counter skippedTickCounter = Metrics.counter(SKIPPED_TICK_COUNTER);

  public ScanDispatcher(DetectionContext context) {
    this.context = context;
    this.pairScanner = new PairScanner(context);
    this.taskQueue = context.requireTaskQueue();
  }

  public ScanSummary runScan() {
    if (!scanInProgress.compareAndSet(false, true)) {
      skippedTickCounter.increment();
      LOGGER.warn("[scheduler] Previous anomaly scan still running, skipping this tick");
      return ScanSummary.skippedTick();
    }
    try {
      return dispatch(UUID.randomUUID().toString(), context.now());
    } finally {
      scanInProgress.set(false);
    }
  }

  private ScanSummary dispatch(String scanId, Instant now) {
    Set<ScanPair> pairs;
    try {
      pairs = pairScanner.scan(now);
    } catch (StoreUnavailableException e) {
      LOGGER.error("[scheduler] Unable to list recent asset/metric pairs for scan {}", scanId, e);
      return ScanSummary.builder().scanId(scanId).failed(true).build();
    }

    if (pairs.isEmpty()) {
      ScanSummary summary = ScanSummary.builder().scanId(scanId).build();
      LOGGER.info("[scheduler] {}", summary.getMessage());
      return summary;
    }

    int enqueued = 0;
    int failures = 0;
    for (ScanPair pair : pairs) {
      try {
        taskQueue.enqueue(DetectionTask.forPair(pair, scanId, now));
        enqueued++;
        if (context.getConfig().isVerboseLogging()) {
          LOGGER.info("[scheduler] Enqueued anomaly detection for {}", pair);
        } else {
          LOGGER.debug("[scheduler] Enqueued anomaly detection for {}", pair);
        }
      } catch (IOException | RuntimeException e) {
        failures++;
        enqueueFailureCounter.increment();
        LOGGER.warn("[scheduler] Failed to enqueue anomaly detection for {}", pair, e);
      }
    }
    pairsScannedCounter.increment(pairs.size());
    tasksEnqueuedCounter.increment(enqueued);

    ScanSummary summary =
        ScanSummary.builder()
            .scanId(scanId)
            .pairsFound(pairs.size())
            .tasksEnqueued(enqueued)
            .enqueueFailures(failures)
            .build();
    LOGGER.info("[scheduler] {}", summary.getMessage());
    return summary;
  }
}
