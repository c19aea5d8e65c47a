package com.herzen.learnpath;

import com.herzen.learnpath.config.AnalyzerProperties;
import com.herzen.learnpath.domain.DomainModels.Diagnostic;
import com.herzen.learnpath.domain.DomainModels.DiagnosticKind;
import com.herzen.learnpath.parser.EventType;
import com.herzen.learnpath.parser.LmsLogParser;
import com.herzen.learnpath.parser.ParserDtos.LmsEvent;
import com.herzen.learnpath.parser.SchemaException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LmsLogParserTest {
    private static final String HEADER = "student_id,event_type,event_time,module,course,grade,activity_duration\n";

    private final LmsLogParser parser = new LmsLogParser(new AnalyzerProperties());

    @Test
    void parsesRowsAndOrdersThemChronologically() {
        var result = parser.parse(HEADER + """
                1001,assignment_submit,2024-01-15 11:45:00,module_1,course_101,85,120
                1001,login,2024-01-15 09:30:00,module_1,course_101,,0
                """);

        assertEquals(2, result.rowsRead());
        assertTrue(result.diagnostics().isEmpty());
        assertEquals(EventType.LOGIN, result.events().get(0).type());
        LmsEvent submit = result.events().get(1);
        assertEquals(EventType.ASSIGNMENT_SUBMIT, submit.type());
        assertEquals(85.0, submit.grade());
        assertEquals(120.0, submit.durationSeconds());
        assertEquals("module_1", submit.moduleId());
        assertEquals("course_101", submit.courseId());
        assertNull(result.events().get(0).grade());
    }

    @Test
    void unknownEventTypeIsReportedWithItsRowIndex() {
        var result = parser.parse(HEADER + """
                1001,login,2024-01-15 09:30:00,module_1,course_101,,0
                1002,teleport,2024-01-15 10:00:00,module_1,course_101,,0
                """);

        assertEquals(1, result.events().size());
        Diagnostic diagnostic = result.diagnostics().get(0);
        assertEquals(DiagnosticKind.ROW_REJECTED, diagnostic.kind());
        assertEquals(2, diagnostic.rowIndex());
        assertTrue(diagnostic.rawContent().contains("teleport"));
        assertTrue(diagnostic.message().contains("teleport"));
    }

    @Test
    void eventTypeMatchingIgnoresCaseAndSurroundingSpaces() {
        var result = parser.parse(HEADER + "1001, Quiz_Attempt ,2024-01-15 09:30:00,module_1,course_101,70,30\n");
        assertEquals(EventType.QUIZ_ATTEMPT, result.events().get(0).type());
    }

    @Test
    void gradeOutsideRangeIsDroppedWithDiagnostic() {
        var result = parser.parse(HEADER + """
                1001,quiz_attempt,2024-01-15 09:30:00,module_1,course_101,150,30
                1001,quiz_attempt,2024-01-15 10:30:00,module_1,course_101,abc,30
                """);

        assertEquals(2, result.events().size());
        assertTrue(result.events().stream().noneMatch(LmsEvent::graded));
        assertEquals(2, result.diagnostics().stream().filter(d -> d.kind() == DiagnosticKind.ROW_CORRECTED).count());
    }

    @Test
    void negativeDurationIsClampedToZero() {
        var result = parser.parse(HEADER + "1001,content_view,2024-01-15 09:30:00,module_1,course_101,,-45\n");

        assertEquals(0.0, result.events().get(0).durationSeconds());
        assertEquals(DiagnosticKind.ROW_CORRECTED, result.diagnostics().get(0).kind());
        assertEquals(1, result.diagnostics().get(0).rowIndex());
    }

    @Test
    void rowsWithoutStudentOrWithBadTimestampAreRejected() {
        var result = parser.parse(HEADER + """
                ,login,2024-01-15 09:30:00,module_1,course_101,,0
                1001,login,15/01/2024 09:30,module_1,course_101,,0
                1001,login,2024-01-15 09:30:00,module_1,course_101,,0
                """);

        assertEquals(1, result.events().size());
        assertEquals(List.of(1, 2), result.diagnostics().stream().map(Diagnostic::rowIndex).toList());
        assertTrue(result.diagnostics().stream().allMatch(d -> d.kind() == DiagnosticKind.ROW_REJECTED));
    }

    @Test
    void impossibleCalendarTimestampsAreRejectedNotAdjusted() {
        var result = parser.parse(HEADER + """
                1001,login,2024-01-15 09:30:00,module_1,course_101,,0
                1002,login,2024-02-30 09:30:00,module_1,course_101,,0
                1003,login,2023-04-31 24:00:00,module_1,course_101,,0
                1004,login,2024-02-29 23:59:59,module_1,course_101,,0
                """);

        assertEquals(List.of("1001", "1004"), result.events().stream().map(LmsEvent::studentId).toList());
        assertEquals(List.of(2, 3), result.diagnostics().stream().map(Diagnostic::rowIndex).toList());
        assertTrue(result.diagnostics().stream().allMatch(d -> d.kind() == DiagnosticKind.ROW_REJECTED
                && d.message().startsWith("Unparseable event_time")));
    }

    @Test
    void duplicateRowsAreSkipped() {
        var result = parser.parse(HEADER + """
                1001,login,2024-01-15 09:30:00,module_1,course_101,,0
                1001,login,2024-01-15 09:30:00,module_1,course_101,,0
                """);

        assertEquals(1, result.events().size());
        assertEquals(DiagnosticKind.DUPLICATE_ROW, result.diagnostics().get(0).kind());
        assertEquals(2, result.diagnostics().get(0).rowIndex());
    }

    @Test
    void missingRequiredColumnAbortsTheRun() {
        var ex = assertThrows(SchemaException.class, () -> parser.parse("""
                student_id,event_type,module,course
                1001,login,module_1,course_101
                """));
        assertTrue(ex.getMessage().contains("event_time"));
    }

    @Test
    void sourceWithoutValidRowsAbortsTheRun() {
        assertThrows(SchemaException.class, () -> parser.parse(HEADER + "1001,teleport,2024-01-15 09:30:00,m,c,,0\n"));
        assertThrows(SchemaException.class, () -> parser.parse(""));
    }

    @Test
    void optionalColumnsMayBeAbsent() {
        var result = parser.parse("""
                student_id,event_type,event_time
                1001,forum_post,2024-01-15 09:30:00
                """);

        LmsEvent event = result.events().get(0);
        assertNull(event.grade());
        assertNull(event.moduleId());
        assertEquals(0.0, event.durationSeconds());
    }

    @Test
    void quotedCellsMayContainCommas() {
        var result = parser.parse(HEADER + "\"1001\",login,2024-01-15 09:30:00,\"module, part 1\",course_101,,0\n");
        assertEquals("module, part 1", result.events().get(0).moduleId());
    }

    @Test
    void timeframeKeepsOnlyMatchingMonth() {
        var events = parser.parse(HEADER + """
                1001,login,2024-01-15 09:30:00,module_1,course_101,,0
                1001,login,2024-02-15 09:30:00,module_1,course_101,,0
                1001,login,2023-02-15 09:30:00,module_1,course_101,,0
                """).events();
        List<Diagnostic> diagnostics = new ArrayList<>();

        assertEquals(1, parser.filterByTimeframe(events, "2024-02", diagnostics).size());
        assertEquals(2, parser.filterByTimeframe(events, "2024", diagnostics).size());
        assertTrue(diagnostics.isEmpty());

        assertEquals(3, parser.filterByTimeframe(events, "Feb 2024", diagnostics).size());
        assertEquals(DiagnosticKind.PARAMETER_ADJUSTED, diagnostics.get(0).kind());
    }
}
