package org.assetwatch.anomaly.datamodel.queue;

import java.io.IOException;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Deserializer;
import org.assetwatch.anomaly.datamodel.DetectionTask;
import org.assetwatch.anomaly.datamodel.json.ObjectMapperProvider;

public class DetectionTaskDeserializer implements Deserializer<DetectionTask> {

  @Override
  public DetectionTask deserialize(String topic, byte[] data) {
    if (data == null) {
      return null;
    }
    try {
      return ObjectMapperProvider.get().readValue(data, DetectionTask.class);
    } catch (IOException e) {
      throw new SerializationException("Unable to deserialize detection task from " + topic, e);
    }
  }
}
