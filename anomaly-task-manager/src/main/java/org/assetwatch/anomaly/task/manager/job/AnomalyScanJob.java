package org.assetwatch.anomaly.task.manager.job;

import static org.assetwatch.anomaly.task.manager.job.AnomalyScanJobConstants.JOB_DATA_MAP_SCAN_DISPATCHER;

import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class AnomalyScanJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyScanJob.class);

  public void execute(JobExecutionContext jobExecutionContext) {
    JobDetail jobDetail = jobExecutionContext.getJobDetail();
    LOGGER.debug("Starting anomaly scan job: {}", jobDetail.getKey());

    JobDataMap jobDataMap = jobDetail.getJobDataMap();
    ScanDispatcher scanDispatcher = (ScanDispatcher) jobDataMap.get(JOB_DATA_MAP_SCAN_DISPATCHER);

    ScanSummary summary = scanDispatcher.runScan();
    jobExecutionContext.setResult(summary);
    LOGGER.debug("Anomaly scan job finished: {}", summary);
  }
}
