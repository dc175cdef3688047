package org.assetwatch.anomaly.task.manager.scanner;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import org.assetwatch.anomaly.datamodel.DetectionContext;
import org.assetwatch.anomaly.datamodel.ScanPair;
import org.assetwatch.anomaly.datamodel.store.StoreUnavailableException;
import org.assetwatch.anomaly.datamodel.store.TelemetryStore;

public class PairScanner {
  private final TelemetryStore telemetryStore;
  private final Duration windowSize;

  public PairScanner(DetectionContext context) {
    this.telemetryStore = context.getTelemetryStore();
    this.windowSize = context.getConfig().getWindowSize();
  }

  public Set<ScanPair> scan(Instant now) throws StoreUnavailableException {
    return telemetryStore.findDistinctPairs(now.minus(windowSize), now);
  }
}
