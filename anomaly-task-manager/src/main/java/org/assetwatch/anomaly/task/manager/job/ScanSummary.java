package org.assetwatch.anomaly.task.manager.job;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScanSummary {
  String scanId;
  int pairsFound;
  int tasksEnqueued;
  int enqueueFailures;
  boolean skipped;
  boolean failed;

  static ScanSummary skippedTick() {
    return ScanSummary.builder().skipped(true).build();
  }

  public String getMessage() {
    if (skipped) {
      return "Previous scan still running; tick skipped.";
    }
    if (failed) {
      return "Unable to list recent asset/metric pairs.";
    }
    if (pairsFound == 0) {
      return "No recent asset/metric pairs to scan.";
    }
    return String.format(
        "Enqueued %d anomaly detection tasks from %d distinct pairs.", tasksEnqueued, pairsFound);
  }
}
