package com.herzen.learnpath;

import com.herzen.learnpath.domain.DomainModels.Diagnostic;
import com.herzen.learnpath.domain.DomainModels.DiagnosticKind;
import com.herzen.learnpath.parser.SchemaException;
import com.herzen.learnpath.service.AnalysisModels.AnalysisOptions;
import com.herzen.learnpath.service.AnalysisModels.AnalysisReport;
import com.herzen.learnpath.service.AnalysisModels.StudentReport;
import com.herzen.learnpath.service.LearningAnalysisService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class LearningAnalysisServiceTest {
    private static final String LOG = """
            student_id,event_type,event_time,module,course,grade,activity_duration
            s1,login,2024-01-15 09:00:00,m1,c1,,0
            s1,content_view,2024-01-15 09:05:00,m1,c1,,600
            s1,forum_post,2024-01-15 09:20:00,m1,c1,,300
            s1,quiz_attempt,2024-01-16 10:00:00,m1,c1,92,900
            s1,forum_post,2024-01-17 18:00:00,m1,c1,,200
            s2,login,2024-01-15 21:00:00,m1,c1,,0
            s2,quiz_attempt,2024-01-18 23:30:00,m1,c1,55,400
            s3,login,2024-01-15 08:00:00,m1,c1,,0
            s3,forum_post,2024-01-15 08:10:00,m1,c1,,250
            s3,forum_post,2024-01-16 08:10:00,m1,c1,,250
            s3,assignment_submit,2024-01-16 09:00:00,m1,c1,88,1200
            s4,login,2024-01-19 22:00:00,m1,c1,,0
            s4,assignment_submit,2024-01-20 23:50:00,m1,c1,48,300
            s5,content_view,2024-01-15 12:00:00,m1,c1,,900
            s5,forum_post,2024-01-16 12:30:00,m1,c1,,100
            s5,quiz_attempt,2024-01-17 13:00:00,m1,c1,75,600
            s6,login,2024-01-21 20:00:00,m1,c1,,0
            s6,quiz_attempt,2024-01-21 20:30:00,m1,c1,61,300
            s6,download,2024-02-02 10:00:00,m1,c1,,500
            s7,teleport,2024-01-15 10:00:00,m1,c1,,0
            """;

    @Autowired
    private LearningAnalysisService service;

    @Test
    void analysesWholeLogAndReportsRejectedRow() {
        AnalysisReport report = service.analyze(LOG, AnalysisOptions.defaults());

        assertEquals(20, report.rowsRead());
        assertEquals(19, report.eventsAnalysed());
        assertEquals(List.of("s1", "s2", "s3", "s4", "s5", "s6"),
                report.students().stream().map(StudentReport::studentId).toList());

        Diagnostic rejected = report.diagnostics().stream()
                .filter(d -> d.kind() == DiagnosticKind.ROW_REJECTED).findFirst().orElseThrow();
        assertEquals(20, rejected.rowIndex());
        assertTrue(rejected.rawContent().contains("teleport"));

        assertTrue(report.correlation().defined());
        assertEquals(6, report.correlation().sampleSize());
        assertTrue(report.clustering().defined());
        assertEquals(3, report.clustering().effectiveK());
        assertEquals(6, report.clustering().assignments().size());
        for (StudentReport student : report.students()) {
            assertFalse(student.recommendations().isEmpty());
            assertNotNull(student.cluster());
            assertNotNull(student.finalGrade());
        }
        assertEquals(6, report.cohort().totalStudents());
        assertEquals(6, report.cohort().gradedStudents());
        assertEquals(4, report.successPattern().students());
        assertEquals(60.0, report.successPattern().gradeThreshold());
    }

    @Test
    void repeatedRunsProduceIdenticalReports() {
        AnalysisOptions options = new AnalysisOptions(2, false, 7L, null, 3);

        assertEquals(service.analyze(LOG, options), service.analyze(LOG, options));
    }

    @Test
    void optionsOverrideConfiguredDefaults() {
        AnalysisReport report = service.analyze(LOG, new AnalysisOptions(2, false, 11L, "2024-01", 1));

        assertEquals(2, report.clustering().effectiveK());
        assertEquals(11L, report.clustering().seed());
        assertEquals(18, report.eventsAnalysed());
        report.students().forEach(s -> assertEquals(1, s.recommendations().size()));
    }

    @Test
    void singleStudentLogStillProducesAdvice() {
        String log = """
                student_id,event_type,event_time,module,course,grade,activity_duration
                1001,login,2024-01-15 09:30:00,module_1,course_101,,0
                1001,assignment_submit,2024-01-15 11:45:00,module_1,course_101,85,120
                """;

        StudentReport student = service.analyzeStudent(log, "1001", AnalysisOptions.defaults()).orElseThrow();

        assertEquals(85.0, student.finalGrade());
        assertEquals(0, student.cluster());
        assertFalse(student.recommendations().isEmpty());

        AnalysisReport report = service.analyze(log, AnalysisOptions.defaults());
        assertFalse(report.correlation().defined());
        assertEquals(1, report.clustering().effectiveK());
        assertTrue(report.diagnostics().stream().anyMatch(d -> d.kind() == DiagnosticKind.PARAMETER_ADJUSTED));
        assertTrue(report.diagnostics().stream().anyMatch(d -> d.kind() == DiagnosticKind.INSUFFICIENT_DATA));
    }

    @Test
    void unknownStudentIsEmpty() {
        assertTrue(service.analyzeStudent(LOG, "nobody", AnalysisOptions.defaults()).isEmpty());
    }

    @Test
    void logWithoutRequiredColumnIsRejected() {
        SchemaException ex = assertThrows(SchemaException.class,
                () -> service.analyze("student_id,event_type\ns1,login\n", AnalysisOptions.defaults()));
        assertTrue(ex.getMessage().contains("event_time"));
    }
}
