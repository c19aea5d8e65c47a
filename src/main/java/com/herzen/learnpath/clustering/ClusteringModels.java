package com.herzen.learnpath.clustering;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.herzen.learnpath.domain.DomainModels.Diagnostic;
import com.herzen.learnpath.metrics.MetricsModels.FeatureVector;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ClusteringModels {
    public record ClusteringSettings(int k,
                                     boolean autoK,
                                     int autoKMax,
                                     int maxIterations,
                                     long seed,
                                     boolean parallel,
                                     double labelThreshold) {}

    /**
     * State after one assign/update round. {@code assignments} follows the order of the
     * clustered points (students sorted by id), {@code centroids} are in standardized units.
     */
    public record IterationSnapshot(int iteration,
                                    List<Integer> assignments,
                                    List<List<Double>> centroids,
                                    double inertia,
                                    int reassigned) {}

    /** {@code centroid} is in raw feature units, {@code standardizedCentroid} in cohort z-scores. */
    public record ClusterSummary(int label,
                                 int size,
                                 List<String> members,
                                 FeatureVector centroid,
                                 Map<String, Double> standardizedCentroid,
                                 String description) {}

    public record ClusteringResult(boolean defined,
                                   int requestedK,
                                   int effectiveK,
                                   long seed,
                                   Map<String, Integer> assignments,
                                   List<ClusterSummary> clusters,
                                   int iterations,
                                   boolean converged,
                                   double inertia,
                                   Map<Integer, Double> inertiaByK,
                                   @JsonIgnore List<IterationSnapshot> history,
                                   String undefinedReason,
                                   @JsonIgnore List<Diagnostic> diagnostics) {

        public Optional<ClusterSummary> clusterOf(String studentId) {
            Integer label = assignments.get(studentId);
            if (label == null) return Optional.empty();
            return clusters.stream().filter(c -> c.label() == label).findFirst();
        }
    }
}
