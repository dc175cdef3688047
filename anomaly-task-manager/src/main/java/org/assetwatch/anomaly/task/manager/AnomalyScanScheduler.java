package org.assetwatch.anomaly.task.manager;

import static org.assetwatch.anomaly.task.manager.job.AnomalyScanJobConstants.SCHEDULER_THREAD_COUNT;

import java.util.Properties;
import org.assetwatch.anomaly.datamodel.DetectionContext;
import org.assetwatch.anomaly.task.manager.job.AnomalyScanJobManager;
import org.assetwatch.anomaly.task.manager.job.JobManager;
import org.assetwatch.anomaly.task.manager.job.ScanDispatcher;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.StdSchedulerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic anomaly scan. When the schedule is disabled no Quartz scheduler is created and the
 * process never scans on its own.
 */
public class AnomalyScanScheduler {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyScanScheduler.class);

  private final ScheduleState state;
  private final Scheduler scheduler;
  private final AnomalyScanJobManager jobManager;

  public AnomalyScanScheduler(DetectionContext context, String schedulerName)
      throws SchedulerException {
    this.state = ScheduleState.from(context.getConfig());
    if (state == ScheduleState.ARMED) {
      this.scheduler = new StdSchedulerFactory(schedulerProperties(schedulerName)).getScheduler();
      this.jobManager = new AnomalyScanJobManager();
      jobManager.initJob(context);
    } else {
      this.scheduler = null;
      this.jobManager = null;
    }
  }

  static Properties schedulerProperties(String schedulerName) {
    Properties properties = new Properties();
    properties.setProperty(StdSchedulerFactory.PROP_SCHED_INSTANCE_NAME, schedulerName);
    properties.setProperty(StdSchedulerFactory.PROP_SCHED_SKIP_UPDATE_CHECK, "true");
    properties.setProperty(
        StdSchedulerFactory.PROP_THREAD_POOL_CLASS, "org.quartz.simpl.SimpleThreadPool");
    properties.setProperty(
        "org.quartz.threadPool.threadCount", String.valueOf(SCHEDULER_THREAD_COUNT));
    properties.setProperty(
        StdSchedulerFactory.PROP_JOB_STORE_CLASS, "org.quartz.simpl.RAMJobStore");
    return properties;
  }

  public void start() throws SchedulerException {
    if (state == ScheduleState.DISABLED) {
      LOGGER.info("[scheduler] Periodic anomaly scan is disabled");
      return;
    }
    jobManager.startJob(scheduler);
    scheduler.start();
  }

  public void stop() throws SchedulerException {
    if (state == ScheduleState.DISABLED) {
      return;
    }
    jobManager.stopJob(scheduler);
    scheduler.shutdown(true);
  }

  public ScheduleState getState() {
    return state;
  }

  public ScanDispatcher getScanDispatcher() {
    return jobManager == null ? null : jobManager.getScanDispatcher();
  }

  JobManager getJobManager() {
    return jobManager;
  }

  Scheduler getScheduler() {
    return scheduler;
  }
}
