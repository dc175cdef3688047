package org.assetwatch.anomaly.task.manager.job;

import static org.assetwatch.anomaly.task.manager.job.AnomalyScanJobConstants.JOB_DATA_MAP_SCAN_DISPATCHER;
import static org.assetwatch.anomaly.task.manager.job.AnomalyScanJobConstants.JOB_GROUP;
import static org.assetwatch.anomaly.task.manager.job.AnomalyScanJobConstants.JOB_NAME;
import static org.assetwatch.anomaly.task.manager.job.AnomalyScanJobConstants.JOB_TRIGGER_NAME;

import org.assetwatch.anomaly.datamodel.DetectionContext;
import org.assetwatch.anomaly.datamodel.config.DetectionConfig;
import org.quartz.CronScheduleBuilder;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.ScheduleBuilder;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class AnomalyScanJobManager implements JobManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyScanJobManager.class);

  private JobKey jobKey;
  private JobDetail jobDetail;
  private Trigger jobTrigger;
  private ScanDispatcher scanDispatcher;

  public void initJob(DetectionContext context) {
    scanDispatcher = new ScanDispatcher(context);
    jobKey = JobKey.jobKey(JOB_NAME, JOB_GROUP);

    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JOB_DATA_MAP_SCAN_DISPATCHER, scanDispatcher);

    jobDetail =
        JobBuilder.newJob(AnomalyScanJob.class)
            .withIdentity(jobKey)
            .usingJobData(jobDataMap)
            .build();

    jobTrigger =
        TriggerBuilder.newTrigger()
            .withIdentity(JOB_TRIGGER_NAME, JOB_GROUP)
            .withSchedule(scheduleFor(context.getConfig()))
            .startNow()
            .build();
  }

  static ScheduleBuilder<? extends Trigger> scheduleFor(DetectionConfig config) {
    if (config.getCronExpression() != null) {
      return CronScheduleBuilder.cronSchedule(config.getCronExpression())
          .withMisfireHandlingInstructionDoNothing();
    }
    // a late tick is dropped rather than replayed
    return SimpleScheduleBuilder.simpleSchedule()
        .withIntervalInMilliseconds(config.getScheduleInterval().toMillis())
        .repeatForever()
        .withMisfireHandlingInstructionNextWithRemainingCount();
  }

  public void startJob(Scheduler scheduler) throws SchedulerException {
    LOGGER.info("Schedule a job:{} with Trigger:{}", jobKey, jobTrigger);
    scheduler.scheduleJob(jobDetail, jobTrigger);
  }

  public void stopJob(Scheduler scheduler) throws SchedulerException {
    if (scheduler.checkExists(jobKey)) {
      scheduler.deleteJob(jobKey);
    }
  }

  public ScanDispatcher getScanDispatcher() {
    return scanDispatcher;
  }

  JobKey getJobKey() {
    return jobKey;
  }

  Trigger getJobTrigger() {
    return jobTrigger;
  }
}
