package org.assetwatch.anomaly.datamodel.queue;

import com.typesafe.config.Config;
import java.io.IOException;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.assetwatch.anomaly.datamodel.DetectionTask;

public class KafkaDetectionTaskProducer implements DetectionTaskQueue {
  static final String SEND_TIMEOUT_MILLIS_CONFIG = "sendTimeoutMillis";
  static final long DEFAULT_SEND_TIMEOUT_MILLIS = 10_000;

  private final Producer<String, DetectionTask> producer;
  private final String topic;
  private final long sendTimeoutMillis;

  public KafkaDetectionTaskProducer(Config kafkaQueueConfig) {
    this(createProducer(new KafkaConfigReader(kafkaQueueConfig)), kafkaQueueConfig);
  }

  KafkaDetectionTaskProducer(Producer<String, DetectionTask> producer, Config kafkaQueueConfig) {
    this.producer = producer;
    this.topic = new KafkaConfigReader(kafkaQueueConfig).getProducerTopicName();
    this.sendTimeoutMillis =
        kafkaQueueConfig.hasPath(SEND_TIMEOUT_MILLIS_CONFIG)
            ? kafkaQueueConfig.getLong(SEND_TIMEOUT_MILLIS_CONFIG)
            : DEFAULT_SEND_TIMEOUT_MILLIS;
  }

  private static Producer<String, DetectionTask> createProducer(
      KafkaConfigReader kafkaConfigReader) {
    Properties props = new Properties();
    props.putAll(kafkaConfigReader.getProducerConfig());
    return new KafkaProducer<>(props);
  }

  @Override
  public void enqueue(DetectionTask detectionTask) throws IOException {
    // keyed by pair so tasks for one series land on one partition
    ProducerRecord<String, DetectionTask> record =
        new ProducerRecord<>(topic, detectionTask.toPair().toString(), detectionTask);
    try {
      producer.send(record).get(sendTimeoutMillis, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while enqueueing " + detectionTask.toPair(), e);
    } catch (ExecutionException | TimeoutException e) {
      throw new IOException("Failed to enqueue " + detectionTask.toPair(), e);
    } catch (RuntimeException e) {
      throw new IOException("Failed to enqueue " + detectionTask.toPair(), e);
    }
  }

  @Override
  public void close() {
    producer.close();
  }
}
