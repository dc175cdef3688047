package org.assetwatch.anomaly.datamodel.store;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.assetwatch.anomaly.datamodel.ScanPair;
import org.assetwatch.anomaly.datamodel.TelemetrySample;

public interface TelemetryStore {

  void append(List<TelemetrySample> samples) throws StoreUnavailableException;

  /**
   * Samples of exactly this pair with {@code start <= timestamp <= end}, ascending by timestamp.
   */
  List<TelemetrySample> querySamples(String assetId, String metric, Instant start, Instant end)
      throws StoreUnavailableException;

  /** Pairs having at least one sample with {@code start <= timestamp <= end}. */
  Set<ScanPair> findDistinctPairs(Instant start, Instant end) throws StoreUnavailableException;
}
