package org.assetwatch.anomaly.detector;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.assetwatch.anomaly.datamodel.TelemetrySample;

final class TestSamples {
  private TestSamples() {}

  static TelemetrySample sample(String assetId, String metric, Instant timestamp, double value) {
    return TelemetrySample.builder()
        .id(UUID.randomUUID())
        .assetId(assetId)
        .metric(metric)
        .timestamp(timestamp)
        .value(value)
        .build();
  }

  /** {@code count} samples of {@code value} one second apart, ending at {@code end}. */
  static List<TelemetrySample> flat(
      String assetId, String metric, Instant end, int count, double value) {
    List<TelemetrySample> samples = new ArrayList<>();
    for (int i = count; i > 0; i--) {
      samples.add(sample(assetId, metric, end.minusSeconds(i), value));
    }
    return samples;
  }
}
