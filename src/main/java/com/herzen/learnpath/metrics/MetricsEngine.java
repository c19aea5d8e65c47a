package com.herzen.learnpath.metrics;

import com.herzen.learnpath.config.AnalyzerProperties;
import com.herzen.learnpath.domain.DomainModels.Diagnostic;
import com.herzen.learnpath.domain.DomainModels.DiagnosticKind;
import com.herzen.learnpath.parser.EventType;
import com.herzen.learnpath.parser.ParserDtos.LmsEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.herzen.learnpath.metrics.MetricsModels.*;

@Slf4j
@Component
public class MetricsEngine {
    private static final double SECONDS_PER_DAY = 86_400.0;

    private final AnalyzerProperties properties;

    public MetricsEngine(AnalyzerProperties properties) {
        this.properties = properties;
    }

    public MetricsSettings defaultSettings() {
        AnalyzerProperties.MetricsProperties m = properties.getMetrics();
        return new MetricsSettings(m.getSessionInactivityMinutes(), m.getMinObservationDays(), m.getMaxRegularity(),
                m.getNightStartHour(), m.getNightEndHour(), properties.isParallel());
    }

    public MetricsResult compute(List<LmsEvent> events, MetricsSettings settings) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (events.isEmpty()) {
            diagnostics.add(Diagnostic.run(DiagnosticKind.INSUFFICIENT_DATA, "No events to aggregate"));
        }

        Map<String, List<LmsEvent>> byStudent = events.stream()
                .sorted(Comparator.comparing(LmsEvent::timestamp).thenComparingInt(LmsEvent::rowIndex))
                .collect(Collectors.groupingBy(LmsEvent::studentId, TreeMap::new, Collectors.toList()));
        Map<String, Double> submissionMedians = submissionMedians(events);

        Stream<Map.Entry<String, List<LmsEvent>>> groups = settings.parallel()
                ? byStudent.entrySet().parallelStream()
                : byStudent.entrySet().stream();
        List<StudentAggregate> aggregates = groups
                .map(e -> aggregate(e.getKey(), e.getValue(), submissionMedians, settings))
                .toList();

        List<StudentProfile> profiles = new ArrayList<>();
        for (StudentAggregate aggregate : aggregates) {
            profiles.add(aggregate.profile());
            diagnostics.addAll(aggregate.diagnostics());
        }

        CohortSummary summary = summarize(events, profiles);
        log.info("Aggregated {} events into {} student profiles", events.size(), profiles.size());
        return new MetricsResult(List.copyOf(profiles), summary, featureMedians(profiles), List.copyOf(diagnostics));
    }

    private StudentAggregate aggregate(String studentId, List<LmsEvent> rows, Map<String, Double> submissionMedians,
                                       MetricsSettings settings) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        EnumMap<EventType, Long> counts = new EnumMap<>(EventType.class);
        EnumMap<EventType.EventCategory, Long> categories = new EnumMap<>(EventType.EventCategory.class);
        for (LmsEvent e : rows) {
            counts.merge(e.type(), 1L, Long::sum);
            categories.merge(e.type().category(), 1L, Long::sum);
        }

        Instant first = rows.get(0).timestamp();
        Instant last = rows.get(rows.size() - 1).timestamp();
        double elapsedDays = Duration.between(first, last).getSeconds() / SECONDS_PER_DAY;
        double windowDays = Math.max(elapsedDays, settings.minObservationDays());

        List<List<LmsEvent>> sessions = sessions(rows, settings.sessionInactivityMinutes());
        double totalSessionSeconds = sessions.stream().mapToDouble(this::sessionSeconds).sum();
        double totalDuration = rows.stream().mapToDouble(LmsEvent::durationSeconds).sum();

        double[] values = new double[Feature.ORDERED.size()];
        values[Feature.TOTAL_EVENTS.ordinal()] = rows.size();
        values[Feature.ACTIVE_DAYS.ordinal()] = rows.stream().map(e -> e.localTime().toLocalDate()).distinct().count();
        values[Feature.EVENTS_PER_DAY.ordinal()] = rows.size() / windowDays;
        values[Feature.LOGIN_RATE.ordinal()] = counts.getOrDefault(EventType.LOGIN, 0L) / windowDays;
        values[Feature.CONTENT_RATE.ordinal()] = categories.getOrDefault(EventType.EventCategory.CONTENT, 0L) / windowDays;
        values[Feature.ASSESSMENT_RATE.ordinal()] = categories.getOrDefault(EventType.EventCategory.ASSESSMENT, 0L) / windowDays;
        values[Feature.QUIZ_FREQUENCY.ordinal()] = counts.getOrDefault(EventType.QUIZ_ATTEMPT, 0L) / windowDays;
        values[Feature.FORUM_PARTICIPATION_RATE.ordinal()] = categories.getOrDefault(EventType.EventCategory.SOCIAL, 0L) / windowDays;
        values[Feature.SESSION_COUNT.ordinal()] = sessions.size();
        values[Feature.AVG_SESSION_DURATION.ordinal()] = totalSessionSeconds / sessions.size();
        values[Feature.AVG_EVENTS_PER_SESSION.ordinal()] = (double) rows.size() / sessions.size();
        values[Feature.TOTAL_ACTIVITY_DURATION.ordinal()] = totalDuration;
        values[Feature.EARLY_SUBMISSION_RATE.ordinal()] = earlySubmissionRate(rows, submissionMedians);
        values[Feature.ACTIVITY_REGULARITY.ordinal()] = regularity(studentId, rows, settings.maxRegularity(), diagnostics);
        values[Feature.NIGHT_ACTIVITY_SHARE.ordinal()] =
                share(rows, e -> isNight(e.localTime(), settings.nightStartHour(), settings.nightEndHour()));
        values[Feature.WEEKEND_ACTIVITY_SHARE.ordinal()] = share(rows, e -> isWeekend(e.localTime()));

        for (Feature feature : Feature.ORDERED) {
            double v = values[feature.ordinal()];
            if (!Double.isFinite(v) || v < 0) {
                diagnostics.add(Diagnostic.student(DiagnosticKind.NUMERIC_DEGENERACY, studentId,
                        feature.key() + " evaluated to " + v + ", replaced by 0"));
                log.warn("Student {}: {} evaluated to {}, replaced by 0", studentId, feature.key(), v);
                values[feature.ordinal()] = 0.0;
            }
        }

        List<Double> grades = rows.stream().filter(LmsEvent::graded).map(LmsEvent::grade).toList();
        Double finalGrade = grades.isEmpty() ? null : grades.stream().mapToDouble(Double::doubleValue).average().orElseThrow();

        Map<String, Long> eventCounts = new LinkedHashMap<>();
        for (EventType type : EventType.values()) {
            eventCounts.put(type.wireName(), counts.getOrDefault(type, 0L));
        }

        StudentProfile profile = new StudentProfile(studentId, List.copyOf(rows), Collections.unmodifiableMap(eventCounts),
                FeatureVector.of(studentId, values), finalGrade, grades.size());
        return new StudentAggregate(profile, diagnostics);
    }

    /** A gap longer than the inactivity threshold starts a new session. */
    List<List<LmsEvent>> sessions(List<LmsEvent> rows, long inactivityMinutes) {
        long thresholdSeconds = inactivityMinutes * 60;
        List<List<LmsEvent>> sessions = new ArrayList<>();
        List<LmsEvent> current = new ArrayList<>();
        LmsEvent previous = null;
        for (LmsEvent e : rows) {
            if (previous != null && Duration.between(previous.timestamp(), e.timestamp()).getSeconds() > thresholdSeconds) {
                sessions.add(current);
                current = new ArrayList<>();
            }
            current.add(e);
            previous = e;
        }
        if (!current.isEmpty()) sessions.add(current);
        return sessions;
    }

    /** Span from the first to the last event plus the time spent on the last activity. */
    private double sessionSeconds(List<LmsEvent> session) {
        LmsEvent first = session.get(0);
        LmsEvent last = session.get(session.size() - 1);
        return Duration.between(first.timestamp(), last.timestamp()).getSeconds() + last.durationSeconds();
    }

    private double earlySubmissionRate(List<LmsEvent> rows, Map<String, Double> submissionMedians) {
        List<LmsEvent> submissions = rows.stream().filter(e -> e.type() == EventType.ASSIGNMENT_SUBMIT).toList();
        if (submissions.isEmpty()) return 0.0;
        long early = submissions.stream()
                .filter(e -> e.timestamp().getEpochSecond() < submissionMedians.getOrDefault(moduleKey(e), Double.NEGATIVE_INFINITY))
                .count();
        return (double) early / submissions.size();
    }

    private Map<String, Double> submissionMedians(List<LmsEvent> events) {
        Map<String, DescriptiveStatistics> byModule = new HashMap<>();
        events.stream()
                .filter(e -> e.type() == EventType.ASSIGNMENT_SUBMIT)
                .forEach(e -> byModule.computeIfAbsent(moduleKey(e), k -> new DescriptiveStatistics())
                        .addValue(e.timestamp().getEpochSecond()));
        Map<String, Double> medians = new HashMap<>();
        byModule.forEach((module, stats) -> medians.put(module, stats.getPercentile(50)));
        return medians;
    }

    private String moduleKey(LmsEvent e) {
        return Objects.toString(e.courseId(), "") + "/" + Objects.toString(e.moduleId(), "");
    }

    /** Inverse coefficient of variation of the gaps between consecutive events, capped at maxRegularity. */
    private double regularity(String studentId, List<LmsEvent> rows, double maxRegularity, List<Diagnostic> diagnostics) {
        if (rows.size() < 2) return 0.0;
        DescriptiveStatistics gaps = new DescriptiveStatistics();
        for (int i = 1; i < rows.size(); i++) {
            gaps.addValue(Duration.between(rows.get(i - 1).timestamp(), rows.get(i).timestamp()).getSeconds());
        }
        double mean = gaps.getMean();
        if (mean == 0.0) {
            diagnostics.add(Diagnostic.student(DiagnosticKind.NUMERIC_DEGENERACY, studentId,
                    "activity_regularity undefined: all events share one timestamp, using 0"));
            return 0.0;
        }
        double std = Math.sqrt(gaps.getPopulationVariance());
        if (std == 0.0) {
            diagnostics.add(Diagnostic.student(DiagnosticKind.NUMERIC_DEGENERACY, studentId,
                    "activity_regularity unbounded: identical gaps between events, using " + maxRegularity));
            return maxRegularity;
        }
        return Math.min(mean / std, maxRegularity);
    }

    private double share(List<LmsEvent> rows, Predicate<LmsEvent> predicate) {
        return rows.isEmpty() ? 0.0 : (double) rows.stream().filter(predicate).count() / rows.size();
    }

    private boolean isNight(LocalDateTime time, int startHour, int endHour) {
        int hour = time.getHour();
        return startHour > endHour ? (hour >= startHour || hour < endHour) : (hour >= startHour && hour < endHour);
    }

    private boolean isWeekend(LocalDateTime time) {
        DayOfWeek day = time.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    private CohortSummary summarize(List<LmsEvent> events, List<StudentProfile> profiles) {
        Map<String, Long> typeHistogram = new LinkedHashMap<>();
        for (EventType type : EventType.values()) typeHistogram.put(type.wireName(), 0L);
        Map<String, Long> categoryHistogram = new LinkedHashMap<>();
        for (EventType.EventCategory c : EventType.EventCategory.values()) categoryHistogram.put(c.name().toLowerCase(Locale.ROOT), 0L);
        Map<Integer, Long> hourly = new LinkedHashMap<>();
        for (int h = 0; h < 24; h++) hourly.put(h, 0L);
        Map<String, Long> daily = new LinkedHashMap<>();
        for (DayOfWeek d : DayOfWeek.values()) daily.put(d.name(), 0L);

        LocalDateTime firstEvent = null;
        LocalDateTime lastEvent = null;
        DescriptiveStatistics grades = new DescriptiveStatistics();
        for (LmsEvent e : events) {
            typeHistogram.merge(e.type().wireName(), 1L, Long::sum);
            categoryHistogram.merge(e.type().category().name().toLowerCase(Locale.ROOT), 1L, Long::sum);
            hourly.merge(e.localTime().getHour(), 1L, Long::sum);
            daily.merge(e.localTime().getDayOfWeek().name(), 1L, Long::sum);
            if (firstEvent == null || e.localTime().isBefore(firstEvent)) firstEvent = e.localTime();
            if (lastEvent == null || e.localTime().isAfter(lastEvent)) lastEvent = e.localTime();
            if (e.graded()) grades.addValue(e.grade());
        }

        GradeStats gradeStats = grades.getN() == 0 ? null : new GradeStats(grades.getN(), grades.getMean(),
                grades.getPercentile(50), grades.getStandardDeviation(), grades.getMin(), grades.getMax());
        int graded = (int) profiles.stream().filter(p -> p.finalGrade() != null).count();
        double avgEvents = profiles.isEmpty() ? 0.0 : (double) events.size() / profiles.size();

        return new CohortSummary(profiles.size(), events.size(), avgEvents, firstEvent, lastEvent,
                Collections.unmodifiableMap(typeHistogram), Collections.unmodifiableMap(categoryHistogram),
                Collections.unmodifiableMap(hourly), Collections.unmodifiableMap(daily), graded, gradeStats);
    }

    private Map<String, Double> featureMedians(List<StudentProfile> profiles) {
        Map<String, Double> medians = new LinkedHashMap<>();
        for (Feature feature : Feature.ORDERED) {
            DescriptiveStatistics stats = new DescriptiveStatistics();
            profiles.forEach(p -> stats.addValue(p.features().get(feature)));
            medians.put(feature.key(), stats.getN() == 0 ? 0.0 : stats.getPercentile(50));
        }
        return Collections.unmodifiableMap(medians);
    }

    private record StudentAggregate(StudentProfile profile, List<Diagnostic> diagnostics) {}
}
