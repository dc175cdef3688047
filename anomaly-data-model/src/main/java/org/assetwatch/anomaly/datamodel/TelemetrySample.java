package org.assetwatch.anomaly.datamodel;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class TelemetrySample {
  @NonNull UUID id;
  @NonNull String assetId;
  @NonNull String metric;
  @NonNull Instant timestamp;
  double value;
  String unit;
  @Builder.Default Map<String, String> tags = Map.of();

  public ScanPair getPair() {
    return ScanPair.of(assetId, metric);
  }
}
