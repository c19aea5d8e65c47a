package com.herzen.learnpath.parser;

import com.herzen.learnpath.domain.DomainModels.Diagnostic;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

public class ParserDtos {
    /**
     * One validated log row. {@code grade} is null unless the row carried a grade inside the
     * configured range; {@code durationSeconds} is never negative.
     */
    public record LmsEvent(int rowIndex,
                           String studentId,
                           EventType type,
                           Instant timestamp,
                           LocalDateTime localTime,
                           String moduleId,
                           String courseId,
                           Double grade,
                           double durationSeconds) {

        public boolean graded() {
            return grade != null;
        }
    }

    public record ParseResult(List<LmsEvent> events, List<Diagnostic> diagnostics, int rowsRead) {}

    public record ParserSettings(double minGrade,
                                 double maxGrade,
                                 String timestampPattern,
                                 String zone,
                                 boolean dropDuplicates) {}
}
