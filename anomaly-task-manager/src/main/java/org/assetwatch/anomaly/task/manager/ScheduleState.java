package org.assetwatch.anomaly.task.manager;

import org.assetwatch.anomaly.datamodel.config.DetectionConfig;

public enum ScheduleState {
  DISABLED,
  ARMED;

  public static ScheduleState from(DetectionConfig config) {
    return config.isScheduleEnabled() ? ARMED : DISABLED;
  }
}
