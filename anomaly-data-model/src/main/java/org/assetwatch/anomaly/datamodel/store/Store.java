package org.assetwatch.anomaly.datamodel.store;

public interface Store extends AutoCloseable {
  TelemetryStore getTelemetryStore();

  FindingsRepository getFindingsRepository();

  @Override
  void close();
}
