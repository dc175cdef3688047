package org.assetwatch.anomaly.detector.evaluator;

public enum DetectionOutcome {
  INSUFFICIENT_DATA,
  DEGENERATE_WINDOW,
  NO_ANOMALIES,
  ANOMALIES_FOUND
}
