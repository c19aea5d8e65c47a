package com.herzen.learnpath;

import com.herzen.learnpath.api.AnalysisController;
import com.herzen.learnpath.clustering.ClusteringModels.ClusteringResult;
import com.herzen.learnpath.correlation.CorrelationModels.CorrelationResult;
import com.herzen.learnpath.metrics.Feature;
import com.herzen.learnpath.metrics.MetricsModels.FeatureVector;
import com.herzen.learnpath.parser.SchemaException;
import com.herzen.learnpath.recommendation.RecommendationModels.Recommendation;
import com.herzen.learnpath.recommendation.RecommendationModels.RecommendationKind;
import com.herzen.learnpath.recommendation.RecommendationModels.SuccessPattern;
import com.herzen.learnpath.service.AnalysisModels.AnalysisOptions;
import com.herzen.learnpath.service.AnalysisModels.AnalysisReport;
import com.herzen.learnpath.service.AnalysisModels.StudentReport;
import com.herzen.learnpath.service.LearningAnalysisService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnalysisController.class)
class AnalysisControllerTest {
    private static final String CSV = "student_id,event_type,event_time\ns1,login,2024-01-15 09:00:00\n";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private LearningAnalysisService analysisService;

    private StudentReport studentReport() {
        return new StudentReport("s1", 80.0, 1, Map.of("login", 1L), FeatureVector.of("s1", new double[Feature.ORDERED.size()]), 0,
                "close to cohort average", List.of(new Recommendation(1, RecommendationKind.REINFORCEMENT, "Keep going", null, 0.0)));
    }

    @Test
    void analyseReturnsReport() throws Exception {
        AnalysisReport report = new AnalysisReport(1, 1, null, Map.of(),
                new CorrelationResult(false, 1, List.of(), "too few graded students", List.of()),
                new ClusteringResult(true, 3, 1, 42L, Map.of("s1", 0), List.of(), 1, true, 0.0, Map.of(), List.of(), null, List.of()),
                new SuccessPattern(1, 60.0, 1.0, 0.0, 0.0),
                List.of(studentReport()), List.of(), List.of());
        when(analysisService.analyze(anyString(), argThat((AnalysisOptions o) -> o != null && Integer.valueOf(2).equals(o.k()))))
                .thenReturn(report);

        mockMvc.perform(post("/api/analysis").param("k", "2").contentType("text/csv").content(CSV))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rowsRead").value(1))
                .andExpect(jsonPath("$.clustering.effectiveK").value(1))
                .andExpect(jsonPath("$.students[0].studentId").value("s1"))
                .andExpect(jsonPath("$.students[0].recommendations[0].text").value("Keep going"))
                .andExpect(jsonPath("$.students[0].recommendations[0].kind").value("REINFORCEMENT"))
                .andExpect(jsonPath("$.successPattern.students").value(1));
    }

    @Test
    void schemaProblemIsBadRequest() throws Exception {
        when(analysisService.analyze(anyString(), any(AnalysisOptions.class)))
                .thenThrow(new SchemaException("Missing required column(s): event_time"));

        mockMvc.perform(post("/api/analysis").contentType("text/csv").content("student_id\n"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("Missing required column(s): event_time"));
    }

    @Test
    void nonNumericParameterIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/analysis").param("k", "many").contentType("text/csv").content(CSV))
                .andExpect(status().isBadRequest());
    }

    @Test
    void studentEndpointReturnsSingleReport() throws Exception {
        when(analysisService.analyzeStudent(anyString(), eq("s1"), any(AnalysisOptions.class)))
                .thenReturn(Optional.of(studentReport()));

        mockMvc.perform(post("/api/analysis/students/s1").contentType("text/csv").content(CSV))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.finalGrade").value(80.0))
                .andExpect(jsonPath("$.features.values.total_events").value(0.0));
    }

    @Test
    void unknownStudentIsNotFound() throws Exception {
        when(analysisService.analyzeStudent(anyString(), eq("ghost"), any(AnalysisOptions.class)))
                .thenReturn(Optional.empty());

        mockMvc.perform(post("/api/analysis/students/ghost").contentType("text/csv").content(CSV))
                .andExpect(status().isNotFound());
    }
}
