package org.assetwatch.anomaly.datamodel.queue;

import java.io.IOException;
import org.assetwatch.anomaly.datamodel.DetectionTask;

/** Producer side of the task queue. Enqueue is at-least-once. */
public interface DetectionTaskQueue {
  void enqueue(DetectionTask detectionTask) throws IOException;

  void close();
}
