package org.assetwatch.anomaly.detector.evaluator;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.assetwatch.anomaly.datamodel.AnomalyFinding;

@Getter
@Builder
@ToString
public class DetectionResult {
  private final DetectionOutcome outcome;
  private final int sampleCount;
  private final double mean;
  private final double stdDev;
  @Builder.Default private final List<AnomalyFinding> findings = List.of();
}
