package org.assetwatch.anomaly.detector;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.apache.commons.lang3.tuple.Pair;
import org.assetwatch.anomaly.datamodel.DetectionContext;
import org.assetwatch.anomaly.datamodel.ScanPair;
import org.assetwatch.anomaly.datamodel.TelemetrySample;
import org.assetwatch.anomaly.datamodel.store.StoreUnavailableException;
import org.assetwatch.anomaly.datamodel.store.TelemetryStore;

public class WindowFetcher {
  private final TelemetryStore telemetryStore;
  private final Duration windowSize;

  public WindowFetcher(DetectionContext context) {
    this.telemetryStore = context.getTelemetryStore();
    this.windowSize = context.getConfig().getWindowSize();
  }

  // inclusive bounds
  public Pair<Instant, Instant> window(Instant windowEnd) {
    return Pair.of(windowEnd.minus(windowSize), windowEnd);
  }

  public List<TelemetrySample> fetch(ScanPair pair, Instant windowEnd)
      throws StoreUnavailableException {
    Pair<Instant, Instant> window = window(windowEnd);
    return telemetryStore.querySamples(
        pair.getAssetId(), pair.getMetric(), window.getLeft(), window.getRight());
  }
}
