package org.assetwatch.anomaly.datamodel.store;

import java.io.IOException;
import java.util.UUID;

public class DuplicateFindingException extends IOException {
  private final UUID sourceSampleId;

  public DuplicateFindingException(UUID sourceSampleId, Throwable cause) {
    super("Finding already exists for source sample " + sourceSampleId, cause);
    this.sourceSampleId = sourceSampleId;
  }

  public UUID getSourceSampleId() {
    return sourceSampleId;
  }
}
