package org.assetwatch.anomaly.detector.evaluator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.assetwatch.anomaly.datamodel.AnomalyFinding;
import org.assetwatch.anomaly.datamodel.TelemetrySample;

/**
 * Flags samples whose absolute z-score against their own window is strictly above the threshold.
 * Pure: no I/O, no clock.
 */
public class ZScoreAnomalyDetector {

  public DetectionResult detect(
      List<TelemetrySample> samples, double threshold, int minimumSampleCount) {
    if (samples.size() < minimumSampleCount) {
      return DetectionResult.builder()
          .outcome(DetectionOutcome.INSUFFICIENT_DATA)
          .sampleCount(samples.size())
          .build();
    }

    double mean = EvaluatorUtil.populationMean(samples);
    double stdDev = EvaluatorUtil.populationStdDev(samples, mean);
    if (EvaluatorUtil.isConstant(samples) || stdDev == 0) {
      return DetectionResult.builder()
          .outcome(DetectionOutcome.DEGENERATE_WINDOW)
          .sampleCount(samples.size())
          .mean(mean)
          .build();
    }

    List<TelemetrySample> ordered = new ArrayList<>(samples);
    ordered.sort(Comparator.comparing(TelemetrySample::getTimestamp));

    List<AnomalyFinding> findings = new ArrayList<>();
    for (TelemetrySample sample : ordered) {
      double absoluteZ = Math.abs((sample.getValue() - mean) / stdDev);
      if (EvaluatorUtil.exceedsThreshold(absoluteZ, threshold)) {
        findings.add(toFinding(sample, absoluteZ, mean, stdDev, samples.size()));
      }
    }

    return DetectionResult.builder()
        .outcome(
            findings.isEmpty() ? DetectionOutcome.NO_ANOMALIES : DetectionOutcome.ANOMALIES_FOUND)
        .sampleCount(samples.size())
        .mean(mean)
        .stdDev(stdDev)
        .findings(findings)
        .build();
  }

  private static AnomalyFinding toFinding(
      TelemetrySample sample, double absoluteZ, double mean, double stdDev, int windowSize) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put(AnomalyFinding.DETAIL_MEAN, mean);
    details.put(AnomalyFinding.DETAIL_STD_DEV, stdDev);
    details.put(AnomalyFinding.DETAIL_WINDOW_SIZE, windowSize);

    return AnomalyFinding.builder()
        .id(UUID.randomUUID())
        .sourceSampleId(sample.getId())
        .assetId(sample.getAssetId())
        .metric(sample.getMetric())
        .timestamp(sample.getTimestamp())
        .score(absoluteZ)
        .explanation(explain(sample, absoluteZ, mean))
        .details(details)
        .build();
  }

  static String explain(TelemetrySample sample, double absoluteZ, double mean) {
    return String.format(
        Locale.ROOT,
        "Anomaly detected for %s/%s: Value %s is %.2f standard deviations from the mean of %.2f.",
        sample.getAssetId(),
        sample.getMetric(),
        sample.getValue(),
        absoluteZ,
        mean);
  }
}
