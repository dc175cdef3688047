package org.assetwatch.anomaly.datamodel;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A persisted record that one sample deviated from its window. At most one finding exists per
 * non-null {@code sourceSampleId}.
 */
@Value
@Builder(toBuilder = true)
public class AnomalyFinding {
  public static final String DETAIL_MEAN = "mean";
  public static final String DETAIL_STD_DEV = "std_dev";
  public static final String DETAIL_WINDOW_SIZE = "window_size";

  @NonNull UUID id;
  UUID sourceSampleId;
  @NonNull String assetId;
  @NonNull String metric;
  @NonNull Instant timestamp;
  double score;
  String explanation;
  @Builder.Default Map<String, Object> details = Map.of();
}
