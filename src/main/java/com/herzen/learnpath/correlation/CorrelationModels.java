package com.herzen.learnpath.correlation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.herzen.learnpath.domain.DomainModels.Diagnostic;

import java.util.List;
import java.util.Optional;

public class CorrelationModels {
    /**
     * Pearson coefficient of one feature against final grade. {@code coefficient} is null when
     * the association is undefined, in which case {@code undefinedReason} says why.
     */
    public record FeatureCorrelation(String feature,
                                     Double coefficient,
                                     Double pValue,
                                     int sampleSize,
                                     String undefinedReason) {

        public boolean defined() {
            return coefficient != null;
        }
    }

    /**
     * Ranked by |coefficient| descending, ties by feature name; undefined features come last.
     * {@code defined} is false when the run has fewer than two graded students.
     */
    public record CorrelationResult(boolean defined,
                                    int sampleSize,
                                    List<FeatureCorrelation> correlations,
                                    String undefinedReason,
                                    @JsonIgnore List<Diagnostic> diagnostics) {

        public Optional<FeatureCorrelation> forFeature(String feature) {
            return correlations.stream().filter(c -> c.feature().equals(feature)).findFirst();
        }
    }
}
