package com.herzen.learnpath.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.herzen.learnpath.domain.DomainModels.Diagnostic;
import com.herzen.learnpath.parser.ParserDtos.LmsEvent;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MetricsModels {
    /** Feature values keyed by {@link Feature#key()}, always in {@link Feature#ORDERED} order. */
    public record FeatureVector(String id, Map<String, Double> values) {

        public static FeatureVector of(String id, double[] ordered) {
            if (ordered.length != Feature.ORDERED.size()) {
                throw new IllegalArgumentException("Expected " + Feature.ORDERED.size() + " values, got " + ordered.length);
            }
            Map<String, Double> values = new LinkedHashMap<>();
            for (int i = 0; i < ordered.length; i++) {
                values.put(Feature.ORDERED.get(i).key(), ordered[i]);
            }
            return new FeatureVector(id, Collections.unmodifiableMap(values));
        }

        public double get(Feature feature) {
            return values.getOrDefault(feature.key(), 0.0);
        }

        public double[] toArray() {
            return Feature.ORDERED.stream().mapToDouble(this::get).toArray();
        }
    }

    /**
     * Everything derived for one student in a run. Final grade is the mean of the student's
     * graded events and null when none was graded.
     */
    public record StudentProfile(String studentId,
                                 @JsonIgnore List<LmsEvent> events,
                                 Map<String, Long> eventCounts,
                                 FeatureVector features,
                                 Double finalGrade,
                                 int gradedEvents) {}

    public record GradeStats(long count, double mean, double median, double std, double min, double max) {}

    public record CohortSummary(int totalStudents,
                                int totalEvents,
                                double avgEventsPerStudent,
                                LocalDateTime firstEvent,
                                LocalDateTime lastEvent,
                                Map<String, Long> eventTypeHistogram,
                                Map<String, Long> categoryHistogram,
                                Map<Integer, Long> hourlyDistribution,
                                Map<String, Long> dayOfWeekDistribution,
                                int gradedStudents,
                                GradeStats gradeStats) {}

    public record MetricsSettings(long sessionInactivityMinutes,
                                  double minObservationDays,
                                  double maxRegularity,
                                  int nightStartHour,
                                  int nightEndHour,
                                  boolean parallel) {}

    /** Profiles are ordered by student id. */
    public record MetricsResult(List<StudentProfile> profiles,
                                CohortSummary summary,
                                Map<String, Double> featureMedians,
                                @JsonIgnore List<Diagnostic> diagnostics) {

        public List<FeatureVector> featureVectors() {
            return profiles.stream().map(StudentProfile::features).toList();
        }
    }
}
