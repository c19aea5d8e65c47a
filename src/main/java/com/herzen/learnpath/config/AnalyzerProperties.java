package com.herzen.learnpath.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** analyzer.* defaults; per-run overrides come in through AnalysisOptions. */
@Configuration
@ConfigurationProperties(prefix = "analyzer")
@Getter
@Setter
public class AnalyzerProperties {

    /** Parallel aggregation and distance computation; results are identical either way. */
    private boolean parallel = false;

    private ParserProperties parser = new ParserProperties();
    private MetricsProperties metrics = new MetricsProperties();
    private CorrelationProperties correlation = new CorrelationProperties();
    private ClusteringProperties clustering = new ClusteringProperties();
    private RecommendationProperties recommendation = new RecommendationProperties();

    @Getter
    @Setter
    public static class ParserProperties {
        private double minGrade = 0.0;
        private double maxGrade = 100.0;
        private String timestampPattern = "uuuu-MM-dd HH:mm:ss";
        /** Zone used to turn local log timestamps into instants. */
        private String zone = "UTC";
        private boolean dropDuplicates = true;
    }

    @Getter
    @Setter
    public static class MetricsProperties {
        private long sessionInactivityMinutes = 30;
        /** Lower bound of the observation window used for per-day rates. */
        private double minObservationDays = 1.0;
        private double maxRegularity = 10.0;
        private int nightStartHour = 22;
        private int nightEndHour = 5;
    }

    @Getter
    @Setter
    public static class CorrelationProperties {
        private double significanceThreshold = 0.2;
    }

    @Getter
    @Setter
    public static class ClusteringProperties {
        private int k = 3;
        private boolean autoK = false;
        private int autoKMax = 6;
        private int maxIterations = 100;
        private long seed = 42L;
        /** Minimum |z| of a centroid coordinate to mention the feature in the cluster description. */
        private double labelThreshold = 0.5;
    }

    @Getter
    @Setter
    public static class RecommendationProperties {
        private int maxRecommendations = 5;
        /** Final grade at or above which a student counts as successful; below it triggers grade advice. */
        private double minGradeThreshold = 60.0;
    }
}
