package org.assetwatch.anomaly.datamodel.queue;

import com.typesafe.config.Config;

public class DetectionTaskQueueProvider {
  public static final String QUEUE_CONFIG = "queue";
  public static final String QUEUE_TYPE = "type";
  public static final String QUEUE_TYPE_KAFKA = "kafka";
  public static final String QUEUE_TYPE_LOCAL = "local";

  public static DetectionTaskQueue getProducerQueue(Config queueConfig) {
    String queueType = queueConfig.getString(QUEUE_TYPE);
    switch (queueType) {
      case QUEUE_TYPE_KAFKA:
        return new KafkaDetectionTaskProducer(queueConfig.getConfig(QUEUE_TYPE_KAFKA));
      default:
        throw new RuntimeException(String.format("Invalid producer queue type:%s", queueType));
    }
  }

  public static KafkaDetectionTaskConsumer getConsumer(Config queueConfig) {
    String queueType = queueConfig.getString(QUEUE_TYPE);
    switch (queueType) {
      case QUEUE_TYPE_KAFKA:
        return new KafkaDetectionTaskConsumer(queueConfig.getConfig(QUEUE_TYPE_KAFKA));
      default:
        throw new RuntimeException(String.format("Invalid consumer queue type:%s", queueType));
    }
  }
}
