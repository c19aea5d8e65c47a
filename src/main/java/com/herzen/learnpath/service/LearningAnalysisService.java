package com.herzen.learnpath.service;

import com.herzen.learnpath.clustering.ClusteringEngine;
import com.herzen.learnpath.clustering.ClusteringModels.ClusteringResult;
import com.herzen.learnpath.clustering.ClusteringModels.ClusteringSettings;
import com.herzen.learnpath.correlation.CorrelationEngine;
import com.herzen.learnpath.correlation.CorrelationModels.CorrelationResult;
import com.herzen.learnpath.domain.DomainModels.Diagnostic;
import com.herzen.learnpath.metrics.MetricsEngine;
import com.herzen.learnpath.metrics.MetricsModels.MetricsResult;
import com.herzen.learnpath.metrics.MetricsModels.StudentProfile;
import com.herzen.learnpath.parser.LmsLogParser;
import com.herzen.learnpath.parser.ParserDtos.LmsEvent;
import com.herzen.learnpath.parser.ParserDtos.ParseResult;
import com.herzen.learnpath.parser.SchemaException;
import com.herzen.learnpath.recommendation.RecommendationEngine;
import com.herzen.learnpath.recommendation.RecommendationModels.RecommendationSettings;
import com.herzen.learnpath.recommendation.RecommendationModels.StudentRecommendations;
import com.herzen.learnpath.recommendation.RecommendationModels.SuccessPattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.herzen.learnpath.service.AnalysisModels.*;

/**
 * Runs parser, metrics, correlation, clustering and recommendations over one log. Every
 * artifact of a run is created here and handed back in the report; nothing is kept between runs.
 */
@Slf4j
@Service
public class LearningAnalysisService {
    private final LmsLogParser parser;
    private final MetricsEngine metricsEngine;
    private final CorrelationEngine correlationEngine;
    private final ClusteringEngine clusteringEngine;
    private final RecommendationEngine recommendationEngine;

    public LearningAnalysisService(LmsLogParser parser,
                                   MetricsEngine metricsEngine,
                                   CorrelationEngine correlationEngine,
                                   ClusteringEngine clusteringEngine,
                                   RecommendationEngine recommendationEngine) {
        this.parser = parser;
        this.metricsEngine = metricsEngine;
        this.correlationEngine = correlationEngine;
        this.clusteringEngine = clusteringEngine;
        this.recommendationEngine = recommendationEngine;
    }

    public AnalysisReport analyze(String csv, AnalysisOptions options) {
        return analyze(new StringReader(csv == null ? "" : csv), options);
    }

    /** @throws SchemaException when the source cannot be analysed at all */
    public AnalysisReport analyze(Reader source, AnalysisOptions options) {
        AnalysisOptions opts = options == null ? AnalysisOptions.defaults() : options;
        List<Diagnostic> diagnostics = new ArrayList<>();

        ParseResult parsed = parser.parse(source, parser.defaultSettings());
        diagnostics.addAll(parsed.diagnostics());
        List<LmsEvent> events = parser.filterByTimeframe(parsed.events(), opts.timeframe(), diagnostics);

        MetricsResult metrics = metricsEngine.compute(events, metricsEngine.defaultSettings());
        diagnostics.addAll(metrics.diagnostics());

        CorrelationResult correlation = correlationEngine.correlate(metrics.profiles());
        diagnostics.addAll(correlation.diagnostics());

        ClusteringResult clustering = clusteringEngine.cluster(metrics.featureVectors(), clusteringSettings(opts));
        diagnostics.addAll(clustering.diagnostics());

        RecommendationSettings recSettings = recommendationSettings(opts);
        SuccessPattern success = recommendationEngine.successPattern(metrics.profiles(), recSettings.minGradeThreshold());
        List<StudentReport> students = new ArrayList<>();
        for (StudentProfile profile : metrics.profiles()) {
            StudentRecommendations recs = recommendationEngine.recommend(profile, metrics.featureMedians(),
                    correlation, clustering.clusterOf(profile.studentId()).orElse(null), success, recSettings);
            students.add(new StudentReport(profile.studentId(), profile.finalGrade(), profile.gradedEvents(),
                    profile.eventCounts(), profile.features(), recs.cluster(), recs.clusterDescription(), recs.items()));
        }

        log.info("Analysis finished: {} students, {} events, {} diagnostics",
                students.size(), events.size(), diagnostics.size());
        return new AnalysisReport(parsed.rowsRead(), events.size(), metrics.summary(), metrics.featureMedians(),
                correlation, clustering, success, List.copyOf(students),
                recommendationEngine.cohortRecommendations(metrics.summary()), List.copyOf(diagnostics));
    }

    public Optional<StudentReport> analyzeStudent(String csv, String studentId, AnalysisOptions options) {
        return analyze(csv, options).student(studentId);
    }

    private ClusteringSettings clusteringSettings(AnalysisOptions opts) {
        ClusteringSettings d = clusteringEngine.defaultSettings();
        return new ClusteringSettings(
                opts.k() != null ? opts.k() : d.k(),
                opts.autoK() != null ? opts.autoK() : d.autoK(),
                d.autoKMax(),
                d.maxIterations(),
                opts.seed() != null ? opts.seed() : d.seed(),
                d.parallel(),
                d.labelThreshold());
    }

    private RecommendationSettings recommendationSettings(AnalysisOptions opts) {
        RecommendationSettings d = recommendationEngine.defaultSettings();
        return new RecommendationSettings(d.significanceThreshold(),
                opts.maxRecommendations() != null ? opts.maxRecommendations() : d.maxRecommendations(),
                d.minGradeThreshold());
    }
}
