package org.assetwatch.anomaly.detector.evaluator;

import java.util.List;
import org.assetwatch.anomaly.datamodel.TelemetrySample;

public class EvaluatorUtil {
  static double populationMean(List<TelemetrySample> samples) {
    double sum = 0;
    for (TelemetrySample sample : samples) {
      sum += sample.getValue();
    }
    return sum / samples.size();
  }

  // divides by n
  static double populationStdDev(List<TelemetrySample> samples, double mean) {
    double squaredDeviations = 0;
    for (TelemetrySample sample : samples) {
      double deviation = sample.getValue() - mean;
      squaredDeviations += deviation * deviation;
    }
    return Math.sqrt(squaredDeviations / samples.size());
  }

  // exact; the std dev of identical values like 98.6 carries rounding residue
  static boolean isConstant(List<TelemetrySample> samples) {
    if (samples.isEmpty()) {
      return true;
    }
    double first = samples.get(0).getValue();
    for (TelemetrySample sample : samples) {
      if (sample.getValue() != first) {
        return false;
      }
    }
    return true;
  }

  static boolean exceedsThreshold(double absoluteZ, double threshold) {
    return absoluteZ > threshold;
  }
}
