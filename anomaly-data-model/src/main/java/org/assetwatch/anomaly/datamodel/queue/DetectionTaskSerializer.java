package org.assetwatch.anomaly.datamodel.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;
import org.assetwatch.anomaly.datamodel.DetectionTask;
import org.assetwatch.anomaly.datamodel.json.ObjectMapperProvider;

public class DetectionTaskSerializer implements Serializer<DetectionTask> {

  @Override
  public byte[] serialize(String topic, DetectionTask detectionTask) {
    if (detectionTask == null) {
      return null;
    }
    try {
      return ObjectMapperProvider.get().writeValueAsBytes(detectionTask);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Unable to serialize detection task " + detectionTask, e);
    }
  }
}
