package com.herzen.learnpath.correlation;

import com.herzen.learnpath.domain.DomainModels.Diagnostic;
import com.herzen.learnpath.domain.DomainModels.DiagnosticKind;
import com.herzen.learnpath.metrics.Feature;
import com.herzen.learnpath.metrics.MetricsModels.StudentProfile;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.herzen.learnpath.correlation.CorrelationModels.*;

@Slf4j
@Component
public class CorrelationEngine {
    static final Comparator<FeatureCorrelation> RANKING = Comparator
            .comparing((FeatureCorrelation c) -> !c.defined())
            .thenComparing(c -> c.defined() ? -Math.abs(c.coefficient()) : 0.0)
            .thenComparing(FeatureCorrelation::feature);

    public CorrelationResult correlate(List<StudentProfile> profiles) {
        List<StudentProfile> graded = profiles.stream().filter(p -> p.finalGrade() != null).toList();
        int n = graded.size();
        List<Diagnostic> diagnostics = new ArrayList<>();

        if (n < 2) {
            String reason = "Correlation needs at least 2 graded students, found " + n;
            log.warn(reason);
            diagnostics.add(Diagnostic.run(DiagnosticKind.INSUFFICIENT_DATA, reason));
            List<FeatureCorrelation> undefined = Feature.ORDERED.stream()
                    .map(f -> new FeatureCorrelation(f.key(), null, null, n, reason))
                    .sorted(RANKING)
                    .toList();
            return new CorrelationResult(false, n, undefined, reason, List.copyOf(diagnostics));
        }

        double[] grades = graded.stream().mapToDouble(StudentProfile::finalGrade).toArray();
        boolean constantGrades = isConstant(grades);
        if (constantGrades) {
            diagnostics.add(Diagnostic.run(DiagnosticKind.NUMERIC_DEGENERACY,
                    "All graded students share one final grade, every coefficient is undefined"));
        }

        PearsonsCorrelation pearson = new PearsonsCorrelation();
        List<FeatureCorrelation> correlations = new ArrayList<>();
        for (Feature feature : Feature.ORDERED) {
            double[] values = graded.stream().mapToDouble(p -> p.features().get(feature)).toArray();
            if (constantGrades) {
                correlations.add(new FeatureCorrelation(feature.key(), null, null, n, "final grade is constant"));
                continue;
            }
            if (isConstant(values)) {
                diagnostics.add(Diagnostic.run(DiagnosticKind.NUMERIC_DEGENERACY,
                        feature.key() + " is constant across graded students, correlation undefined"));
                correlations.add(new FeatureCorrelation(feature.key(), null, null, n, "feature is constant"));
                continue;
            }
            double r = pearson.correlation(values, grades);
            if (!Double.isFinite(r)) {
                diagnostics.add(Diagnostic.run(DiagnosticKind.NUMERIC_DEGENERACY,
                        feature.key() + " produced a non-finite coefficient, reported as undefined"));
                correlations.add(new FeatureCorrelation(feature.key(), null, null, n, "non-finite coefficient"));
                continue;
            }
            r = Math.max(-1.0, Math.min(1.0, r));
            correlations.add(new FeatureCorrelation(feature.key(), r, pValue(r, n), n, null));
        }

        correlations.sort(RANKING);
        log.info("Correlated {} features against grades of {} students", correlations.size(), n);
        return new CorrelationResult(true, n, List.copyOf(correlations), null, List.copyOf(diagnostics));
    }

    private boolean isConstant(double[] values) {
        for (double v : values) {
            if (v != values[0]) return false;
        }
        return true;
    }

    /** Two-sided p-value of H0: r = 0 under Student's t with n-2 degrees of freedom. */
    private Double pValue(double r, int n) {
        if (n <= 2) return null;
        if (Math.abs(r) >= 1.0) return 0.0;
        double t = Math.abs(r) * Math.sqrt((n - 2) / (1 - r * r));
        return 2 * (1 - new TDistribution(n - 2).cumulativeProbability(t));
    }
}
