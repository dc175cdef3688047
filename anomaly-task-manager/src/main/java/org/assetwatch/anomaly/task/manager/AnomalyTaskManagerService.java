package org.assetwatch.anomaly.task.manager;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.assetwatch.anomaly.datamodel.DetectionContext;
import org.assetwatch.anomaly.datamodel.config.DetectionConfig;
import org.assetwatch.anomaly.datamodel.queue.DetectionTaskQueue;
import org.assetwatch.anomaly.datamodel.queue.DetectionTaskQueueProvider;
import org.assetwatch.anomaly.datamodel.service.AnomalyService;
import org.assetwatch.anomaly.datamodel.store.Store;
import org.assetwatch.anomaly.datamodel.store.StoreProvider;
import org.assetwatch.anomaly.task.manager.job.AnomalyScanJobConstants;
import org.quartz.SchedulerException;

public class AnomalyTaskManagerService extends AnomalyService {
  private Store store;
  private DetectionTaskQueue taskQueue;
  private AnomalyScanScheduler scanScheduler;

  public AnomalyTaskManagerService(Config appConfig) {
    super(appConfig);
  }

  @Override
  public String getServiceName() {
    return "anomaly-task-manager";
  }

  @Override
  protected void doInit() {
    Config appConfig = getAppConfig();
    DetectionConfig detectionConfig = DetectionConfig.from(appConfig);
    store = StoreProvider.getStore(appConfig.getConfig(StoreProvider.STORE_CONFIG));
    taskQueue =
        DetectionTaskQueueProvider.getProducerQueue(
            appConfig.getConfig(DetectionTaskQueueProvider.QUEUE_CONFIG));
    DetectionContext context =
        DetectionContext.forStore(detectionConfig, store).taskQueue(taskQueue).build();
    try {
      scanScheduler =
          new AnomalyScanScheduler(context, AnomalyScanJobConstants.SCHEDULER_INSTANCE_NAME);
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  protected void doStart() {
    try {
      scanScheduler.start();
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  protected void doStop() {
    try {
      scanScheduler.stop();
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    } finally {
      taskQueue.close();
      store.close();
    }
  }

  ScheduleState getScheduleState() {
    return scanScheduler.getState();
  }

  public static void main(String[] args) {
    AnomalyService.run(new AnomalyTaskManagerService(ConfigFactory.load()));
  }
}
