package org.assetwatch.anomaly.datamodel;

import java.time.Instant;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DetectionTask {
  public static final String DETECT_TASK_NAME = "detect";

  @Builder.Default String taskName = DETECT_TASK_NAME;
  @NonNull String assetId;
  @NonNull String metric;
  String scanId;
  Instant enqueuedAt;

  public static DetectionTask forPair(ScanPair pair, String scanId, Instant enqueuedAt) {
    return DetectionTask.builder()
        .assetId(pair.getAssetId())
        .metric(pair.getMetric())
        .scanId(scanId)
        .enqueuedAt(enqueuedAt)
        .build();
  }

  public ScanPair toPair() {
    return ScanPair.of(assetId, metric);
  }
}
