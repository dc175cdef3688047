package org.assetwatch.anomaly.task.manager.job;

public class AnomalyScanJobConstants {
  public static final String JOB_DATA_MAP_SCAN_DISPATCHER = "scanDispatcher";

  public static final String JOB_NAME = "anomaly-scan";
  public static final String JOB_GROUP = "anomaly";
  public static final String JOB_TRIGGER_NAME = "anomaly-scan-trigger";

  public static final String SCHEDULER_INSTANCE_NAME = "anomaly-scan-scheduler";
  public static final int SCHEDULER_THREAD_COUNT = 2;
}
