package org.assetwatch.anomaly.task.manager.job;

import org.assetwatch.anomaly.datamodel.DetectionContext;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;

public interface JobManager {
  void initJob(DetectionContext context);

  void startJob(Scheduler scheduler) throws SchedulerException;

  void stopJob(Scheduler scheduler) throws SchedulerException;
}
