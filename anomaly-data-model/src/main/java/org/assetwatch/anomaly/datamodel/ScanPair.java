package org.assetwatch.anomaly.datamodel;

import lombok.NonNull;
import lombok.Value;

@Value(staticConstructor = "of")
public class ScanPair {
  @NonNull String assetId;
  @NonNull String metric;

  @Override
  public String toString() {
    return assetId + "/" + metric;
  }
}
