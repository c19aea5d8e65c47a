package com.herzen.learnpath.service;

import com.herzen.learnpath.clustering.ClusteringModels.ClusteringResult;
import com.herzen.learnpath.correlation.CorrelationModels.CorrelationResult;
import com.herzen.learnpath.domain.DomainModels.Diagnostic;
import com.herzen.learnpath.metrics.MetricsModels.CohortSummary;
import com.herzen.learnpath.metrics.MetricsModels.FeatureVector;
import com.herzen.learnpath.recommendation.RecommendationModels.Recommendation;
import com.herzen.learnpath.recommendation.RecommendationModels.SuccessPattern;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public class AnalysisModels {
    /** Per-run overrides; null fields fall back to the analyzer.* configuration. */
    public record AnalysisOptions(Integer k,
                                  Boolean autoK,
                                  Long seed,
                                  String timeframe,
                                  Integer maxRecommendations) {

        public static AnalysisOptions defaults() {
            return new AnalysisOptions(null, null, null, null, null);
        }
    }

    public record StudentReport(String studentId,
                                Double finalGrade,
                                int gradedEvents,
                                Map<String, Long> eventCounts,
                                FeatureVector features,
                                Integer cluster,
                                String clusterDescription,
                                List<Recommendation> recommendations) {}

    public record AnalysisReport(int rowsRead,
                                 int eventsAnalysed,
                                 CohortSummary cohort,
                                 Map<String, Double> featureMedians,
                                 CorrelationResult correlation,
                                 ClusteringResult clustering,
                                 SuccessPattern successPattern,
                                 List<StudentReport> students,
                                 List<String> cohortRecommendations,
                                 List<Diagnostic> diagnostics) {

        public Optional<StudentReport> student(String studentId) {
            return students.stream().filter(s -> s.studentId().equals(studentId)).findFirst();
        }
    }
}
