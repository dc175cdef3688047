package org.assetwatch.anomaly.datamodel.queue;

import com.typesafe.config.Config;
import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedList;
import java.util.Properties;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.RecordDeserializationException;
import org.assetwatch.anomaly.datamodel.DetectionTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class KafkaDetectionTaskConsumer {
  private static final Logger LOGGER = LoggerFactory.getLogger(KafkaDetectionTaskConsumer.class);
  private static final int CONSUMER_POLL_TIMEOUT_MS = 100;

  private final Consumer<String, DetectionTask> consumer;
  private final LinkedList<ConsumerRecord<String, DetectionTask>> linkedList = new LinkedList<>();

  public KafkaDetectionTaskConsumer(Config kafkaQueueConfig) {
    this(createConsumer(new KafkaConfigReader(kafkaQueueConfig)), kafkaQueueConfig);
  }

  KafkaDetectionTaskConsumer(Consumer<String, DetectionTask> consumer, Config kafkaQueueConfig) {
    this.consumer = consumer;
    consumer.subscribe(
        Collections.singletonList(new KafkaConfigReader(kafkaQueueConfig).getConsumerTopicName()));
  }

  private static Consumer<String, DetectionTask> createConsumer(
      KafkaConfigReader kafkaConfigReader) {
    Properties props = new Properties();
    props.putAll(kafkaConfigReader.getConsumerConfig());
    return new KafkaConsumer<>(props);
  }

  public DetectionTask dequeue() throws IOException {
    if (linkedList.isEmpty()) {
      try {
        ConsumerRecords<String, DetectionTask> records =
            consumer.poll(Duration.ofMillis(CONSUMER_POLL_TIMEOUT_MS));
        records.forEach(linkedList::addLast);
      } catch (RecordDeserializationException e) {
        // poll() stays on an undecodable record until it is skipped
        LOGGER.error(
            "Skipping undecodable detection task at {} offset {}",
            e.topicPartition(),
            e.offset(),
            e);
        consumer.seek(e.topicPartition(), e.offset() + 1);
        return null;
      } catch (KafkaException e) {
        throw new IOException("Failed to poll detection tasks", e);
      }
    }

    if (!linkedList.isEmpty()) {
      ConsumerRecord<String, DetectionTask> record = linkedList.remove();
      LOGGER.debug("offset = {}, key = {}", record.offset(), record.key());
      return record.value();
    }

    return null;
  }

  public void wakeup() {
    consumer.wakeup();
  }

  public void close() {
    consumer.close();
  }
}
