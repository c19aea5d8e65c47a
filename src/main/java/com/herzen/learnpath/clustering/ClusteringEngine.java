package com.herzen.learnpath.clustering;

import com.herzen.learnpath.config.AnalyzerProperties;
import com.herzen.learnpath.domain.DomainModels.Diagnostic;
import com.herzen.learnpath.domain.DomainModels.DiagnosticKind;
import com.herzen.learnpath.metrics.Feature;
import com.herzen.learnpath.metrics.MetricsModels.FeatureVector;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.herzen.learnpath.clustering.ClusteringModels.*;

/**
 * K-means over z-scored feature vectors with seeded k-means++ initialisation.
 * Every assign/update round is recorded as an immutable {@link IterationSnapshot}.
 */
@Slf4j
@Component
public class ClusteringEngine {
    private static final int DESCRIPTION_FEATURES = 2;

    private final AnalyzerProperties properties;

    public ClusteringEngine(AnalyzerProperties properties) {
        this.properties = properties;
    }

    public ClusteringSettings defaultSettings() {
        AnalyzerProperties.ClusteringProperties c = properties.getClustering();
        return new ClusteringSettings(c.getK(), c.isAutoK(), c.getAutoKMax(), c.getMaxIterations(), c.getSeed(),
                properties.isParallel(), c.getLabelThreshold());
    }

    public ClusteringResult cluster(List<FeatureVector> vectors, ClusteringSettings settings) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<FeatureVector> ordered = vectors.stream().sorted(Comparator.comparing(FeatureVector::id)).toList();
        int n = ordered.size();
        if (n == 0) {
            String reason = "No students to cluster";
            diagnostics.add(Diagnostic.run(DiagnosticKind.INSUFFICIENT_DATA, reason));
            log.warn(reason);
            return new ClusteringResult(false, settings.k(), 0, settings.seed(), Map.of(), List.of(), 0, false, 0.0,
                    Map.of(), List.of(), reason, List.copyOf(diagnostics));
        }

        double[][] raw = ordered.stream().map(FeatureVector::toArray).toArray(double[][]::new);
        double[][] points = standardize(raw, diagnostics);
        int distinct = countDistinct(points);

        int maxIterations = settings.maxIterations();
        if (maxIterations < 1) {
            diagnostics.add(Diagnostic.run(DiagnosticKind.PARAMETER_ADJUSTED, "max iterations " + maxIterations + " raised to 1"));
            maxIterations = 1;
        }

        int requested = settings.k();
        Map<Integer, Double> inertiaByK = Map.of();
        if (settings.autoK()) {
            inertiaByK = elbowInertias(points, distinct, settings, maxIterations);
            if (inertiaByK.size() < 3) {
                diagnostics.add(Diagnostic.run(DiagnosticKind.PARAMETER_ADJUSTED,
                        "Automatic k needs at least 3 candidate values, using configured k=" + requested));
            } else {
                requested = elbow(inertiaByK);
                log.info("Elbow heuristic selected k={} from inertias {}", requested, inertiaByK);
            }
        }
        int k = adjustK(requested, n, distinct, diagnostics);

        List<IterationSnapshot> history = runKMeans(points, k, settings.seed(), maxIterations, settings.parallel());
        IterationSnapshot last = history.get(history.size() - 1);
        boolean converged = last.reassigned() == 0;
        if (!converged) {
            diagnostics.add(Diagnostic.run(DiagnosticKind.NUMERIC_DEGENERACY,
                    "K-means stopped at the iteration bound (" + maxIterations + ") before assignments settled"));
        }

        Map<String, Integer> assignments = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            assignments.put(ordered.get(i).id(), last.assignments().get(i));
        }
        List<ClusterSummary> clusters = summarize(ordered, raw, last, k, settings.labelThreshold());

        log.info("Clustered {} students into {} groups in {} iterations (converged={}, inertia={})",
                n, k, history.size(), converged, last.inertia());
        return new ClusteringResult(true, settings.k(), k, settings.seed(), Collections.unmodifiableMap(assignments),
                clusters, history.size(), converged, last.inertia(), inertiaByK, List.copyOf(history), null,
                List.copyOf(diagnostics));
    }

    /** Lloyd iterations until no point changes cluster or the bound is hit. */
    public List<IterationSnapshot> runKMeans(double[][] points, int k, long seed, int maxIterations, boolean parallel) {
        double[][] centroids = initialCentroids(points, k, new Random(seed));
        int[] previous = null;
        List<IterationSnapshot> history = new ArrayList<>();

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            final double[][] current = centroids;
            IntStream indexes = IntStream.range(0, points.length);
            if (parallel) indexes = indexes.parallel();
            int[] assignments = indexes.map(i -> nearest(points[i], current)).toArray();
            assignments = fillEmptyClusters(points, assignments, current, k);

            double[][] updated = means(points, assignments, k, current);
            int reassigned = previous == null ? points.length : changed(previous, assignments);
            double inertia = inertia(points, assignments, updated);
            history.add(snapshot(iteration, assignments, updated, inertia, reassigned));
            log.debug("Iteration {}: {} reassigned, inertia {}", iteration, reassigned, inertia);

            if (reassigned == 0) break;
            previous = assignments;
            centroids = updated;
        }
        return List.copyOf(history);
    }

    /** k-means++ seeding driven only by the supplied random source. */
    double[][] initialCentroids(double[][] points, int k, Random random) {
        int n = points.length;
        List<Integer> chosen = new ArrayList<>();
        chosen.add(random.nextInt(n));
        double[] d2 = new double[n];
        for (int i = 0; i < n; i++) d2[i] = squaredDistance(points[i], points[chosen.get(0)]);

        while (chosen.size() < k) {
            double total = Arrays.stream(d2).sum();
            int next = -1;
            if (total > 0) {
                double target = random.nextDouble() * total;
                double acc = 0.0;
                for (int i = 0; i < n; i++) {
                    if (d2[i] == 0.0) continue;
                    acc += d2[i];
                    next = i;
                    if (acc > target) break;
                }
            } else {
                for (int i = 0; i < n && next < 0; i++) {
                    if (!chosen.contains(i)) next = i;
                }
            }
            chosen.add(next);
            for (int i = 0; i < n; i++) d2[i] = Math.min(d2[i], squaredDistance(points[i], points[next]));
        }
        return chosen.stream().map(i -> points[i].clone()).toArray(double[][]::new);
    }

    private int nearest(double[] point, double[][] centroids) {
        int best = 0;
        double bestDistance = squaredDistance(point, centroids[0]);
        for (int c = 1; c < centroids.length; c++) {
            double d = squaredDistance(point, centroids[c]);
            if (d < bestDistance) {
                best = c;
                bestDistance = d;
            }
        }
        return best;
    }

    /** An empty cluster takes the point farthest from its centroid among clusters with more than one member. */
    private int[] fillEmptyClusters(double[][] points, int[] assignments, double[][] centroids, int k) {
        int[] result = assignments.clone();
        int[] sizes = new int[k];
        for (int a : result) sizes[a]++;
        for (int c = 0; c < k; c++) {
            if (sizes[c] > 0) continue;
            int donor = -1;
            double farthest = -1.0;
            for (int i = 0; i < points.length; i++) {
                if (sizes[result[i]] <= 1) continue;
                double d = squaredDistance(points[i], centroids[result[i]]);
                if (d > farthest) {
                    farthest = d;
                    donor = i;
                }
            }
            if (donor < 0) break;
            sizes[result[donor]]--;
            result[donor] = c;
            sizes[c]++;
        }
        return result;
    }

    private double[][] means(double[][] points, int[] assignments, int k, double[][] fallback) {
        int dims = points[0].length;
        double[][] sums = new double[k][dims];
        int[] counts = new int[k];
        for (int i = 0; i < points.length; i++) {
            counts[assignments[i]]++;
            for (int d = 0; d < dims; d++) sums[assignments[i]][d] += points[i][d];
        }
        for (int c = 0; c < k; c++) {
            if (counts[c] == 0) {
                sums[c] = fallback[c].clone();
                continue;
            }
            for (int d = 0; d < dims; d++) sums[c][d] /= counts[c];
        }
        return sums;
    }

    private int changed(int[] previous, int[] current) {
        int changed = 0;
        for (int i = 0; i < current.length; i++) {
            if (previous[i] != current[i]) changed++;
        }
        return changed;
    }

    private double inertia(double[][] points, int[] assignments, double[][] centroids) {
        double sum = 0.0;
        for (int i = 0; i < points.length; i++) sum += squaredDistance(points[i], centroids[assignments[i]]);
        return sum;
    }

    private IterationSnapshot snapshot(int iteration, int[] assignments, double[][] centroids, double inertia, int reassigned) {
        List<Integer> labels = Arrays.stream(assignments).boxed().toList();
        List<List<Double>> centers = Arrays.stream(centroids)
                .map(c -> Arrays.stream(c).boxed().toList())
                .toList();
        return new IterationSnapshot(iteration, labels, centers, inertia, reassigned);
    }

    /** Column-wise z-scores with the cohort mean and population standard deviation. */
    private double[][] standardize(double[][] raw, List<Diagnostic> diagnostics) {
        int n = raw.length;
        int dims = raw[0].length;
        double[][] z = new double[n][dims];
        for (int d = 0; d < dims; d++) {
            DescriptiveStatistics column = new DescriptiveStatistics();
            for (double[] row : raw) column.addValue(row[d]);
            double mean = column.getMean();
            double std = Math.sqrt(column.getPopulationVariance());
            if (std == 0.0 || !Double.isFinite(std)) {
                if (n > 1) {
                    diagnostics.add(Diagnostic.run(DiagnosticKind.NUMERIC_DEGENERACY,
                            Feature.ORDERED.get(d).key() + " has zero variance, standardized to 0"));
                }
                continue;
            }
            for (int i = 0; i < n; i++) z[i][d] = (raw[i][d] - mean) / std;
        }
        return z;
    }

    private int countDistinct(double[][] points) {
        return (int) Arrays.stream(points)
                .map(p -> Arrays.stream(p).boxed().toList())
                .distinct()
                .count();
    }

    private int adjustK(int requested, int students, int distinct, List<Diagnostic> diagnostics) {
        int k = requested;
        if (k < 1) {
            adjusted(diagnostics, "k=" + k + " raised to 1");
            k = 1;
        }
        if (k > students) {
            adjusted(diagnostics, "k=" + k + " reduced to the student count " + students);
            k = students;
        }
        if (k > distinct) {
            adjusted(diagnostics, "k=" + k + " reduced to the number of distinct feature vectors " + distinct);
            k = distinct;
        }
        return k;
    }

    private void adjusted(List<Diagnostic> diagnostics, String message) {
        log.warn(message);
        diagnostics.add(Diagnostic.run(DiagnosticKind.PARAMETER_ADJUSTED, message));
    }

    private Map<Integer, Double> elbowInertias(double[][] points, int distinct, ClusteringSettings settings, int maxIterations) {
        int upper = Math.min(settings.autoKMax(), distinct);
        Map<Integer, Double> inertias = new LinkedHashMap<>();
        for (int k = 1; k <= upper; k++) {
            List<IterationSnapshot> run = runKMeans(points, k, settings.seed(), maxIterations, settings.parallel());
            inertias.put(k, run.get(run.size() - 1).inertia());
        }
        return Collections.unmodifiableMap(inertias);
    }

    /** k with the largest second difference of inertia; the smaller k wins ties. */
    public static int elbow(Map<Integer, Double> inertiaByK) {
        int best = 2;
        double bestBend = Double.NEGATIVE_INFINITY;
        for (int k = 2; inertiaByK.containsKey(k + 1); k++) {
            double bend = inertiaByK.get(k - 1) - 2 * inertiaByK.get(k) + inertiaByK.get(k + 1);
            if (bend > bestBend) {
                bestBend = bend;
                best = k;
            }
        }
        return best;
    }

    private List<ClusterSummary> summarize(List<FeatureVector> ordered, double[][] raw, IterationSnapshot last,
                                           int k, double labelThreshold) {
        int dims = Feature.ORDERED.size();
        List<ClusterSummary> summaries = new ArrayList<>();
        for (int c = 0; c < k; c++) {
            final int label = c;
            List<Integer> memberIdx = IntStream.range(0, ordered.size())
                    .filter(i -> last.assignments().get(i) == label)
                    .boxed()
                    .toList();

            double[] mean = new double[dims];
            for (int i : memberIdx) {
                for (int d = 0; d < dims; d++) mean[d] += raw[i][d];
            }
            if (!memberIdx.isEmpty()) {
                for (int d = 0; d < dims; d++) mean[d] /= memberIdx.size();
            }

            Map<String, Double> standardized = new LinkedHashMap<>();
            List<Double> centroid = last.centroids().get(c);
            for (int d = 0; d < dims; d++) standardized.put(Feature.ORDERED.get(d).key(), centroid.get(d));

            summaries.add(new ClusterSummary(c, memberIdx.size(),
                    memberIdx.stream().map(i -> ordered.get(i).id()).toList(),
                    FeatureVector.of("cluster-" + c, mean),
                    Collections.unmodifiableMap(standardized),
                    describe(standardized, labelThreshold)));
        }
        return List.copyOf(summaries);
    }

    /** Up to two features whose centroid z-score deviates most from the cohort mean. */
    public static String describe(Map<String, Double> standardizedCentroid, double threshold) {
        String description = standardizedCentroid.entrySet().stream()
                .filter(e -> Math.abs(e.getValue()) >= threshold)
                .sorted(Comparator.comparing((Map.Entry<String, Double> e) -> -Math.abs(e.getValue()))
                        .thenComparing(e -> e.getKey()))
                .limit(DESCRIPTION_FEATURES)
                .map(e -> (e.getValue() > 0 ? "high " : "low ") + Feature.fromKey(e.getKey()).displayName())
                .collect(Collectors.joining(", "));
        return description.isEmpty() ? "close to cohort average" : description;
    }

    private static double squaredDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }
}
