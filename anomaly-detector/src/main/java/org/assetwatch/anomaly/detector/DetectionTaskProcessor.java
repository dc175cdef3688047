package org.assetwatch.anomaly.detector;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.tuple.Pair;
import org.assetwatch.anomaly.datamodel.AnomalyFinding;
import org.assetwatch.anomaly.datamodel.DetectionContext;
import org.assetwatch.anomaly.datamodel.DetectionTask;
import org.assetwatch.anomaly.datamodel.ScanPair;
import org.assetwatch.anomaly.datamodel.TelemetrySample;
import org.assetwatch.anomaly.datamodel.config.DetectionConfig;
import org.assetwatch.anomaly.datamodel.store.StoreUnavailableException;
import org.assetwatch.anomaly.detector.evaluator.DetectionResult;
import org.assetwatch.anomaly.detector.evaluator.ZScoreAnomalyDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

public class DetectionTaskProcessor {
  private static final Logger LOGGER = LoggerFactory.getLogger(DetectionTaskProcessor.class);
  private static final String DETECTION_TIMER = "assetwatch.anomaly.detector.task.latency";
  private static final String DETECTION_ERROR_COUNTER = "assetwatch.anomaly.detector.task.error";

  static final String MDC_SCAN_ID = "scanId";
  static final String MDC_ASSET_ID = "assetId";
  static final String MDC_METRIC = "metric";

  private final DetectionConfig config;
  private final DetectionContext context;
  private final WindowFetcher windowFetcher;
  private final ZScoreAnomalyDetector detector;
  private final AnomalyPersister persister;
  private final Timer detectionTimer;
  private final Counter detectionErrorCounter;

  public DetectionTaskProcessor(DetectionContext context) {
    this.context = context;
    this.config = context.getConfig();
    this.windowFetcher = new WindowFetcher(context);
    this.detector = new ZScoreAnomalyDetector();
    this.persister = new AnomalyPersister(context.getFindingsRepository());
    this.detectionTimer = Metrics.timer(DETECTION_TIMER);
    this.detectionErrorCounter = Metrics.counter(DETECTION_ERROR_COUNTER);
  }

  public String process(DetectionTask detectionTask) throws StoreUnavailableException {
    ScanPair pair = detectionTask.toPair();
    Instant startTime = Instant.now();
    Instant windowEnd = context.now();
    putMdc(detectionTask);
    try {
      List<TelemetrySample> samples = windowFetcher.fetch(pair, windowEnd);
      DetectionResult result =
          detector.detect(samples, config.getZScoreThreshold(), config.getMinimumSampleCount());
      return handleResult(pair, result);
    } catch (StoreUnavailableException e) {
      detectionErrorCounter.increment();
      Pair<Instant, Instant> window = windowFetcher.window(windowEnd);
      LOGGER.error(
          "[anomaly] Store unavailable while scanning {} over window [{}, {}]",
          pair,
          window.getLeft(),
          window.getRight(),
          e);
      throw e;
    } finally {
      detectionTimer.record(
          Duration.between(startTime, Instant.now()).toMillis(), TimeUnit.MILLISECONDS);
      clearMdc();
    }
  }

  private String handleResult(ScanPair pair, DetectionResult result)
      throws StoreUnavailableException {
    switch (result.getOutcome()) {
      case INSUFFICIENT_DATA:
        LOGGER.info(
            "[anomaly] Insufficient data for {}: {} samples, need {}",
            pair,
            result.getSampleCount(),
            config.getMinimumSampleCount());
        return String.format("Not enough data points for %s in the last window.", pair);
      case DEGENERATE_WINDOW:
        LOGGER.info(
            "[anomaly] Zero variance over {} samples for {}", result.getSampleCount(), pair);
        return String.format("Standard deviation is zero for %s.", pair);
      case NO_ANOMALIES:
        LOGGER.debug(
            "[anomaly] No anomalies for {}: n={}, mean={}, std={}",
            pair,
            result.getSampleCount(),
            result.getMean(),
            result.getStdDev());
        return String.format("No anomalies detected for %s.", pair);
      case ANOMALIES_FOUND:
        for (AnomalyFinding candidate : result.getFindings()) {
          AnomalyFinding stored = persister.persist(candidate);
          if (config.isVerboseLogging()) {
            LOGGER.info("[anomaly] {}", stored.getExplanation());
          } else {
            LOGGER.debug("[anomaly] {}", stored.getExplanation());
          }
        }
        LOGGER.info("[anomaly] {} anomalies for {}", result.getFindings().size(), pair);
        return String.format("Detected %d anomalies for %s.", result.getFindings().size(), pair);
      default:
        throw new IllegalStateException("Unknown detection outcome " + result.getOutcome());
    }
  }

  private static void putMdc(DetectionTask detectionTask) {
    if (detectionTask.getScanId() != null) {
      MDC.put(MDC_SCAN_ID, detectionTask.getScanId());
    }
    MDC.put(MDC_ASSET_ID, detectionTask.getAssetId());
    MDC.put(MDC_METRIC, detectionTask.getMetric());
  }

  private static void clearMdc() {
    MDC.remove(MDC_SCAN_ID);
    MDC.remove(MDC_ASSET_ID);
    MDC.remove(MDC_METRIC);
  }
}
