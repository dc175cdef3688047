package org.assetwatch.anomaly.detector;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.assetwatch.anomaly.datamodel.AnomalyFinding;
import org.assetwatch.anomaly.datamodel.store.DuplicateFindingException;
import org.assetwatch.anomaly.datamodel.store.FindingsRepository;
import org.assetwatch.anomaly.datamodel.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores findings at most once per source sample. Returns the stored finding, which is the
 * earlier one when the sample was already flagged.
 */
public class AnomalyPersister {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyPersister.class);
  private static final String FINDINGS_PERSISTED_COUNTER =
      "assetwatch.anomaly.detector.findings.persisted";
  private static final String FINDINGS_DUPLICATE_COUNTER =
      "assetwatch.anomaly.detector.findings.duplicate";
  private static final ConcurrentMap<String, Counter> findingsPersistedCounter =
      new ConcurrentHashMap<>();
  private static final ConcurrentMap<String, Counter> findingsDuplicateCounter =
      new ConcurrentHashMap<>();

  private final FindingsRepository findingsRepository;

  public AnomalyPersister(FindingsRepository findingsRepository) {
    this.findingsRepository = findingsRepository;
  }

  public AnomalyFinding persist(AnomalyFinding candidate) throws StoreUnavailableException {
    if (candidate.getSourceSampleId() != null) {
      Optional<AnomalyFinding> existing =
          findingsRepository.findBySourceSample(candidate.getSourceSampleId());
      if (existing.isPresent()) {
        LOGGER.debug(
            "Finding for sample {} already stored as {}",
            candidate.getSourceSampleId(),
            existing.get().getId());
        countDuplicate(candidate);
        return existing.get();
      }
    }

    try {
      findingsRepository.insert(candidate);
    } catch (DuplicateFindingException e) {
      // another worker stored it between the lookup and the insert
      LOGGER.debug("Lost insert race for sample {}", e.getSourceSampleId());
      countDuplicate(candidate);
      Optional<AnomalyFinding> winner =
          findingsRepository.findBySourceSample(e.getSourceSampleId());
      if (winner.isEmpty()) {
        throw new StoreUnavailableException(
            "Finding for sample " + e.getSourceSampleId() + " rejected as duplicate but not found",
            e);
      }
      return winner.get();
    }

    findingsPersistedCounter
        .computeIfAbsent(
            candidate.getMetric(),
            k ->
                Counter.builder(FINDINGS_PERSISTED_COUNTER)
                    .tag("metric", k)
                    .register(Metrics.globalRegistry))
        .increment();
    return candidate;
  }

  private static void countDuplicate(AnomalyFinding candidate) {
    findingsDuplicateCounter
        .computeIfAbsent(
            candidate.getMetric(),
            k ->
                Counter.builder(FINDINGS_DUPLICATE_COUNTER)
                    .tag("metric", k)
                    .register(Metrics.globalRegistry))
        .increment();
  }
}
