package com.herzen.learnpath.recommendation;

import java.util.List;

public class RecommendationModels {
    public enum RecommendationKind {
        FEATURE_GAP,
        LOW_GRADE,
        GRADE_CONSISTENCY,
        GRADE_TREND,
        PEER_COMPARISON,
        REINFORCEMENT,
        SEGMENT
    }

    /** {@code priority} starts at 1; {@code feature} is null for messages not tied to one feature. */
    public record Recommendation(int priority, RecommendationKind kind, String text, String feature, double score) {}

    public record StudentRecommendations(String studentId,
                                         Integer cluster,
                                         String clusterDescription,
                                         List<Recommendation> items) {}

    /**
     * Average behaviour of students whose final grade reaches the grade threshold.
     * {@code students} is 0 when nobody qualifies.
     */
    public record SuccessPattern(int students,
                                 double gradeThreshold,
                                 double avgEvents,
                                 double avgSocialEvents,
                                 double avgActivityDuration) {

        public boolean present() {
            return students > 0;
        }
    }

    public record RecommendationSettings(double significanceThreshold, int maxRecommendations, double minGradeThreshold) {}
}
