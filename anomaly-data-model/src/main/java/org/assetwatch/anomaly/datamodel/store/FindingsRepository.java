package org.assetwatch.anomaly.datamodel.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.assetwatch.anomaly.datamodel.AnomalyFinding;

public interface FindingsRepository {

  Optional<AnomalyFinding> findBySourceSample(UUID sourceSampleId)
      throws StoreUnavailableException;

  /**
   * Inserts the finding. Throws {@link DuplicateFindingException} when a finding already exists
   * for the same source sample.
   */
  void insert(AnomalyFinding finding) throws DuplicateFindingException, StoreUnavailableException;

  /** Findings of one asset with {@code start <= timestamp <= end}, newest first. */
  List<AnomalyFinding> findByAsset(String assetId, Instant start, Instant end)
      throws StoreUnavailableException;
}
