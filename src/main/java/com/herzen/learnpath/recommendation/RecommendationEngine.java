package com.herzen.learnpath.recommendation;

import com.herzen.learnpath.clustering.ClusteringModels.ClusterSummary;
import com.herzen.learnpath.config.AnalyzerProperties;
import com.herzen.learnpath.correlation.CorrelationModels.CorrelationResult;
import com.herzen.learnpath.correlation.CorrelationModels.FeatureCorrelation;
import com.herzen.learnpath.metrics.Feature;
import com.herzen.learnpath.metrics.MetricsModels.CohortSummary;
import com.herzen.learnpath.metrics.MetricsModels.StudentProfile;
import com.herzen.learnpath.parser.EventType;
import com.herzen.learnpath.parser.ParserDtos.LmsEvent;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Service;

import java.util.*;

import static com.herzen.learnpath.recommendation.RecommendationModels.*;

@Service
public class RecommendationEngine {
    static final double LOW_ENGAGEMENT_EVENTS = 10.0;
    static final double WEEKEND_SHARE_FLOOR = 0.1;
    static final double GRADE_SPREAD_CEILING = 20.0;
    static final double INCONSISTENT_GRADE_STD = 15.0;
    static final int INCONSISTENT_MIN_GRADES = 4;
    static final int TREND_MIN_GRADES = 3;
    static final double TREND_THRESHOLD = 0.1;
    static final double PEER_ACTIVITY_RATIO = 0.7;
    static final double PEER_SOCIAL_RATIO = 0.5;

    private final AnalyzerProperties properties;

    public RecommendationEngine(AnalyzerProperties properties) {
        this.properties = properties;
    }

    public RecommendationSettings defaultSettings() {
        return new RecommendationSettings(properties.getCorrelation().getSignificanceThreshold(),
                properties.getRecommendation().getMaxRecommendations(),
                properties.getRecommendation().getMinGradeThreshold());
    }

    /** Averages over students whose final grade is at least {@code gradeThreshold}. */
    public SuccessPattern successPattern(List<StudentProfile> profiles, double gradeThreshold) {
        List<StudentProfile> successful = profiles.stream()
                .filter(p -> p.finalGrade() != null && p.finalGrade() >= gradeThreshold)
                .toList();
        if (successful.isEmpty()) return new SuccessPattern(0, gradeThreshold, 0.0, 0.0, 0.0);
        return new SuccessPattern(successful.size(), gradeThreshold,
                successful.stream().mapToDouble(p -> p.features().get(Feature.TOTAL_EVENTS)).average().orElse(0.0),
                successful.stream().mapToLong(this::socialEvents).average().orElse(0.0),
                successful.stream().mapToDouble(p -> p.features().get(Feature.TOTAL_ACTIVITY_DURATION)).average().orElse(0.0));
    }

    /**
     * Feature-gap, grade and peer-comparison advice ranked by score and capped. Feature gaps are
     * scored by coefficient times relative gap below the cohort median. Never returns an empty list.
     */
    public StudentRecommendations recommend(StudentProfile student,
                                            Map<String, Double> cohortMedians,
                                            CorrelationResult correlation,
                                            ClusterSummary cluster,
                                            SuccessPattern success,
                                            RecommendationSettings settings) {
        int cap = Math.max(1, settings.maxRecommendations());
        Integer label = cluster == null ? null : cluster.label();
        String segment = cluster == null ? "unassigned" : cluster.description();

        boolean correlated = correlation != null && correlation.defined()
                && correlation.correlations().stream().anyMatch(FeatureCorrelation::defined);

        List<Candidate> candidates = new ArrayList<>();
        if (correlated) candidates.addAll(featureGaps(student, cohortMedians, correlation, settings));
        candidates.addAll(performance(student, settings.minGradeThreshold()));
        if (success != null && success.present()) peerComparison(student, success).ifPresent(candidates::add);
        candidates.sort(Comparator.comparingDouble((Candidate c) -> -Math.abs(c.score()))
                .thenComparing(Candidate::key));

        if (candidates.isEmpty()) {
            Recommendation only = correlated
                    ? new Recommendation(1, RecommendationKind.REINFORCEMENT, String.format(Locale.US,
                    "You are at or above the cohort median on every behaviour linked to better grades. "
                            + "Keep your current routine (profile: %s).", segment), null, 0.0)
                    : new Recommendation(1, RecommendationKind.SEGMENT, String.format(Locale.US,
                    "Grades in this run cannot be related to activity (too few graded students or no variation). Your activity profile: %s; "
                            + "compare your routine with the cohort median for each behaviour.", segment), null, 0.0);
            return new StudentRecommendations(student.studentId(), label, segment, List.of(only));
        }

        List<Recommendation> items = new ArrayList<>();
        for (Candidate c : candidates.subList(0, Math.min(cap, candidates.size()))) {
            items.add(new Recommendation(items.size() + 1, c.kind(), c.text(), c.feature(), c.score()));
        }
        return new StudentRecommendations(student.studentId(), label, segment, List.copyOf(items));
    }

    private List<Candidate> featureGaps(StudentProfile student, Map<String, Double> cohortMedians,
                                       CorrelationResult correlation, RecommendationSettings settings) {
        List<Candidate> out = new ArrayList<>();
        for (FeatureCorrelation fc : correlation.correlations()) {
            if (!fc.defined() || fc.coefficient() <= settings.significanceThreshold()) continue;
            double median = cohortMedians.getOrDefault(fc.feature(), 0.0);
            double value = student.features().values().getOrDefault(fc.feature(), 0.0);
            if (median <= 0.0 || value >= median) continue;
            Feature f = Feature.fromKey(fc.feature());
            String text = String.format(Locale.US,
                    "Your %s (%.2f %s) is below the cohort median (%.2f %s), and higher values go with better grades (r=%.2f): %s.",
                    f.displayName(), value, f.unit(), median, f.unit(), fc.coefficient(), f.advice());
            out.add(new Candidate(RecommendationKind.FEATURE_GAP, f.key(), text, f.key(), fc.coefficient() * (median - value) / median));
        }
        return out;
    }

    /** Low average, erratic grades and the direction of the grade trend, in event order. */
    private List<Candidate> performance(StudentProfile student, double minGradeThreshold) {
        List<Double> grades = student.events().stream().filter(LmsEvent::graded).map(LmsEvent::grade).toList();
        List<Candidate> out = new ArrayList<>();
        if (grades.isEmpty()) return out;

        DescriptiveStatistics stats = new DescriptiveStatistics();
        grades.forEach(stats::addValue);
        double mean = stats.getMean();
        if (minGradeThreshold > 0 && mean < minGradeThreshold) {
            out.add(new Candidate(RecommendationKind.LOW_GRADE, "grade.low", String.format(Locale.US,
                    "Seek additional help: your average grade (%.1f) is below the %.1f threshold.", mean, minGradeThreshold),
                    null, (minGradeThreshold - mean) / minGradeThreshold));
        }

        double std = stats.getStandardDeviation();
        if (grades.size() >= INCONSISTENT_MIN_GRADES && std > INCONSISTENT_GRADE_STD) {
            out.add(new Candidate(RecommendationKind.GRADE_CONSISTENCY, "grade.consistency", String.format(Locale.US,
                    "Work on consistency: your grades vary significantly between assignments (standard deviation %.1f).", std),
                    null, (std - INCONSISTENT_GRADE_STD) / std));
        }

        if (grades.size() >= TREND_MIN_GRADES) {
            double trend = trend(grades);
            if (trend < -TREND_THRESHOLD) {
                out.add(new Candidate(RecommendationKind.GRADE_TREND, "grade.trend",
                        "Your grades are trending down: review your study strategies before the next assessment.",
                        null, Math.min(1.0, -trend)));
            } else if (trend > TREND_THRESHOLD) {
                out.add(new Candidate(RecommendationKind.GRADE_TREND, "grade.trend",
                        "Your grades are improving: continue with your current strategies.",
                        null, Math.min(1.0, trend)));
            }
        }
        return out;
    }

    /** Least-squares slope of grade against position, divided by the population std of the grades. */
    static double trend(List<Double> grades) {
        SimpleRegression regression = new SimpleRegression();
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (int i = 0; i < grades.size(); i++) {
            regression.addData(i, grades.get(i));
            stats.addValue(grades.get(i));
        }
        double std = Math.sqrt(stats.getPopulationVariance());
        return std > 0 ? regression.getSlope() / std : 0.0;
    }

    private Optional<Candidate> peerComparison(StudentProfile student, SuccessPattern success) {
        List<String> behind = new ArrayList<>();
        double gap = 0.0;
        double events = student.features().get(Feature.TOTAL_EVENTS);
        if (events < success.avgEvents() * PEER_ACTIVITY_RATIO) {
            behind.add("activity frequency");
            gap = Math.max(gap, 1 - events / success.avgEvents());
        }
        long social = socialEvents(student);
        if (social < success.avgSocialEvents() * PEER_SOCIAL_RATIO) {
            behind.add("forum participation");
            gap = Math.max(gap, 1 - social / success.avgSocialEvents());
        }
        if (behind.isEmpty()) return Optional.empty();
        return Optional.of(new Candidate(RecommendationKind.PEER_COMPARISON, "peer", String.format(Locale.US,
                "Increase %s to match students with grades of %.0f or more (%.1f events, %.1f forum actions on average).",
                String.join(" and ", behind), success.gradeThreshold(), success.avgEvents(), success.avgSocialEvents()),
                null, gap));
    }

    private long socialEvents(StudentProfile profile) {
        return Arrays.stream(EventType.values())
                .filter(t -> t.category() == EventType.EventCategory.SOCIAL)
                .mapToLong(t -> profile.eventCounts().getOrDefault(t.wireName(), 0L))
                .sum();
    }

    /** Course-level advice for instructors; may be empty. */
    public List<String> cohortRecommendations(CohortSummary summary) {
        List<String> out = new ArrayList<>();
        if (summary.totalStudents() == 0) return out;

        if (summary.avgEventsPerStudent() < LOW_ENGAGEMENT_EVENTS) {
            out.add(String.format(Locale.US,
                    "Overall engagement is low (%.1f events per student): set weekly activity goals of at least 10 course actions",
                    summary.avgEventsPerStudent()));
        }
        long social = summary.categoryHistogram().getOrDefault("social", 0L);
        long assessment = summary.categoryHistogram().getOrDefault("assessment", 0L);
        if (social < assessment * 0.5) {
            out.add("Encourage forum participation and peer collaboration: social activity is less than half of assessment activity");
        }
        long weekend = summary.dayOfWeekDistribution().getOrDefault("SATURDAY", 0L)
                + summary.dayOfWeekDistribution().getOrDefault("SUNDAY", 0L);
        if (summary.totalEvents() > 0 && (double) weekend / summary.totalEvents() < WEEKEND_SHARE_FLOOR) {
            out.add("Distribute learning activities more evenly across the week, including short weekend tasks");
        }
        if (summary.gradeStats() != null && summary.gradeStats().std() > GRADE_SPREAD_CEILING) {
            out.add(String.format(Locale.US,
                    "Grades vary widely (standard deviation %.1f): offer additional support to students below 70%%",
                    summary.gradeStats().std()));
        }
        return out;
    }

    private record Candidate(RecommendationKind kind, String key, String text, String feature, double score) {}
}
