package org.assetwatch.anomaly.datamodel;

import java.time.Clock;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.assetwatch.anomaly.datamodel.config.DetectionConfig;
import org.assetwatch.anomaly.datamodel.queue.DetectionTaskQueue;
import org.assetwatch.anomaly.datamodel.store.FindingsRepository;
import org.assetwatch.anomaly.datamodel.store.Store;
import org.assetwatch.anomaly.datamodel.store.TelemetryStore;

/**
 * Everything a scan or a detection task needs, built once at startup and handed to each
 * component. The task queue is only set where tasks are produced.
 */
@Getter
@Builder(toBuilder = true)
public class DetectionContext {
  @NonNull private final DetectionConfig config;
  @NonNull private final TelemetryStore telemetryStore;
  @NonNull private final FindingsRepository findingsRepository;
  private final DetectionTaskQueue taskQueue;
  @Builder.Default @NonNull private final Clock clock = Clock.systemUTC();

  public static DetectionContextBuilder forStore(DetectionConfig config, Store store) {
    return DetectionContext.builder()
        .config(config)
        .telemetryStore(store.getTelemetryStore())
        .findingsRepository(store.getFindingsRepository());
  }

  public Instant now() {
    return clock.instant();
  }

  public DetectionTaskQueue requireTaskQueue() {
    if (taskQueue == null) {
      throw new IllegalStateException("No task queue configured for this process");
    }
    return taskQueue;
  }
}
