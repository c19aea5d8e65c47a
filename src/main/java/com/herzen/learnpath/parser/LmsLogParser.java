package com.herzen.learnpath.parser;

import com.herzen.learnpath.config.AnalyzerProperties;
import com.herzen.learnpath.domain.DomainModels.Diagnostic;
import com.herzen.learnpath.domain.DomainModels.DiagnosticKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.herzen.learnpath.parser.ParserDtos.*;

@Slf4j
@Component
public class LmsLogParser {
    public static final String STUDENT_ID = "student_id";
    public static final String EVENT_TYPE = "event_type";
    public static final String EVENT_TIME = "event_time";
    public static final String MODULE = "module";
    public static final String COURSE = "course";
    public static final String GRADE = "grade";
    public static final String DURATION = "activity_duration";

    private static final List<String> REQUIRED_COLUMNS = List.of(STUDENT_ID, EVENT_TYPE, EVENT_TIME);
    private static final Map<String, String> COLUMN_ALIASES = Map.of(
            "module_id", MODULE,
            "course_id", COURSE,
            "timestamp", EVENT_TIME,
            "duration", DURATION
    );
    private static final Pattern TIMEFRAME_PATTERN = Pattern.compile("^(\\d{4})(?:-(\\d{1,2}))?$");

    private final AnalyzerProperties properties;

    public LmsLogParser(AnalyzerProperties properties) {
        this.properties = properties;
    }

    public ParserSettings defaultSettings() {
        AnalyzerProperties.ParserProperties p = properties.getParser();
        return new ParserSettings(p.getMinGrade(), p.getMaxGrade(), p.getTimestampPattern(), p.getZone(), p.isDropDuplicates());
    }

    public ParseResult parse(String content) {
        return parse(new StringReader(content == null ? "" : content), defaultSettings());
    }

    public ParseResult parse(Reader source, ParserSettings settings) {
        List<String> lines;
        try (BufferedReader reader = new BufferedReader(source)) {
            lines = reader.lines().toList();
        } catch (IOException | UncheckedIOException e) {
            throw new SchemaException("Log source is unreadable: " + e.getMessage(), e);
        }

        int headerIdx = 0;
        while (headerIdx < lines.size() && lines.get(headerIdx).isBlank()) headerIdx++;
        if (headerIdx >= lines.size()) {
            throw new SchemaException("Log source is empty: header row expected");
        }
        Map<String, Integer> columns = parseHeader(lines.get(headerIdx));
        int width = splitRow(lines.get(headerIdx)).size();

        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(settings.timestampPattern())
                .withResolverStyle(ResolverStyle.STRICT);
        ZoneId zone = ZoneId.of(settings.zone());
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<LmsEvent> events = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int rowIndex = 0;

        for (int i = headerIdx + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) continue;
            rowIndex++;

            if (settings.dropDuplicates() && !seen.add(line.trim())) {
                diagnostics.add(Diagnostic.row(DiagnosticKind.DUPLICATE_ROW, rowIndex, line, "Identical to an earlier row, skipped"));
                continue;
            }

            List<String> cells = splitRow(line);
            if (cells.size() > width) {
                reject(diagnostics, rowIndex, line, "Expected at most " + width + " columns, found " + cells.size());
                continue;
            }
            parseRow(rowIndex, line, cells, columns, settings, formatter, zone, diagnostics).ifPresent(events::add);
        }

        if (events.isEmpty()) {
            throw new SchemaException("Log source contains no valid rows (" + rowIndex + " rows read)");
        }

        events.sort(Comparator.comparing(LmsEvent::timestamp).thenComparingInt(LmsEvent::rowIndex));
        log.info("Parsed {} of {} rows ({} diagnostics)", events.size(), rowIndex, diagnostics.size());
        return new ParseResult(List.copyOf(events), List.copyOf(diagnostics), rowIndex);
    }

    /**
     * Keeps events of one year ({@code YYYY}) or one month ({@code YYYY-MM}). An unusable
     * timeframe leaves the events untouched and is reported.
     */
    public List<LmsEvent> filterByTimeframe(List<LmsEvent> events, String timeframe, List<Diagnostic> diagnostics) {
        if (timeframe == null || timeframe.isBlank()) return events;
        Matcher matcher = TIMEFRAME_PATTERN.matcher(timeframe.trim());
        if (!matcher.matches()) {
            diagnostics.add(Diagnostic.run(DiagnosticKind.PARAMETER_ADJUSTED, "Invalid timeframe '" + timeframe + "', using all data"));
            return events;
        }
        int year = Integer.parseInt(matcher.group(1));
        Integer month = matcher.group(2) == null ? null : Integer.parseInt(matcher.group(2));
        if (month != null && (month < 1 || month > 12)) {
            diagnostics.add(Diagnostic.run(DiagnosticKind.PARAMETER_ADJUSTED, "Invalid timeframe '" + timeframe + "', using all data"));
            return events;
        }
        List<LmsEvent> kept = events.stream()
                .filter(e -> e.localTime().getYear() == year)
                .filter(e -> month == null || e.localTime().getMonthValue() == month)
                .toList();
        log.info("Timeframe {} keeps {} of {} events", timeframe, kept.size(), events.size());
        if (kept.isEmpty()) {
            diagnostics.add(Diagnostic.run(DiagnosticKind.INSUFFICIENT_DATA, "No events inside timeframe " + timeframe));
        }
        return kept;
    }

    private Map<String, Integer> parseHeader(String headerLine) {
        Map<String, Integer> columns = new HashMap<>();
        List<String> names = splitRow(headerLine);
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i).trim().toLowerCase(Locale.ROOT);
            if (i == 0 && name.startsWith("\uFEFF")) name = name.substring(1);
            columns.putIfAbsent(COLUMN_ALIASES.getOrDefault(name, name), i);
        }
        List<String> missing = REQUIRED_COLUMNS.stream().filter(c -> !columns.containsKey(c)).toList();
        if (!missing.isEmpty()) {
            throw new SchemaException("Missing required column(s): " + String.join(", ", missing));
        }
        return columns;
    }

    private Optional<LmsEvent> parseRow(int rowIndex, String line, List<String> cells, Map<String, Integer> columns,
                                        ParserSettings settings, DateTimeFormatter formatter, ZoneId zone,
                                        List<Diagnostic> diagnostics) {
        String studentId = cell(cells, columns, STUDENT_ID);
        if (studentId == null) {
            reject(diagnostics, rowIndex, line, "Missing student_id");
            return Optional.empty();
        }

        String rawType = cell(cells, columns, EVENT_TYPE);
        Optional<EventType> type = EventType.fromWireName(rawType);
        if (type.isEmpty()) {
            reject(diagnostics, rowIndex, line, "Unknown event_type: " + rawType);
            return Optional.empty();
        }

        String rawTime = cell(cells, columns, EVENT_TIME);
        LocalDateTime localTime = parseTime(rawTime, formatter);
        if (localTime == null) {
            reject(diagnostics, rowIndex, line, "Unparseable event_time: " + rawTime);
            return Optional.empty();
        }

        Double grade = parseGrade(rowIndex, line, cell(cells, columns, GRADE), settings, diagnostics);
        double duration = parseDuration(rowIndex, line, cell(cells, columns, DURATION), diagnostics);

        return Optional.of(new LmsEvent(rowIndex, studentId, type.get(), localTime.atZone(zone).toInstant(), localTime,
                cell(cells, columns, MODULE), cell(cells, columns, COURSE), grade, duration));
    }

    private LocalDateTime parseTime(String raw, DateTimeFormatter formatter) {
        if (raw == null) return null;
        try {
            return LocalDateTime.parse(raw, formatter);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(raw, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            } catch (DateTimeException ignored) {
                return null;
            }
        }
    }

    private Double parseGrade(int rowIndex, String line, String raw, ParserSettings settings, List<Diagnostic> diagnostics) {
        if (raw == null) return null;
        double value;
        try {
            value = Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            correct(diagnostics, rowIndex, line, "Non-numeric grade '" + raw + "' treated as absent");
            return null;
        }
        if (!Double.isFinite(value) || value < settings.minGrade() || value > settings.maxGrade()) {
            correct(diagnostics, rowIndex, line, "Grade " + raw + " outside [" + settings.minGrade() + ", " + settings.maxGrade() + "] treated as absent");
            return null;
        }
        return value;
    }

    private double parseDuration(int rowIndex, String line, String raw, List<Diagnostic> diagnostics) {
        if (raw == null) return 0.0;
        double value;
        try {
            value = Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            correct(diagnostics, rowIndex, line, "Non-numeric activity_duration '" + raw + "' set to 0");
            return 0.0;
        }
        if (!Double.isFinite(value) || value < 0) {
            correct(diagnostics, rowIndex, line, "Invalid activity_duration " + raw + " clamped to 0");
            return 0.0;
        }
        return value;
    }

    private String cell(List<String> cells, Map<String, Integer> columns, String column) {
        Integer idx = columns.get(column);
        if (idx == null || idx >= cells.size()) return null;
        String value = cells.get(idx).trim();
        return value.isEmpty() ? null : value;
    }

    private void reject(List<Diagnostic> diagnostics, int rowIndex, String line, String reason) {
        log.debug("Row {} rejected: {}", rowIndex, reason);
        diagnostics.add(Diagnostic.row(DiagnosticKind.ROW_REJECTED, rowIndex, line, reason));
    }

    private void correct(List<Diagnostic> diagnostics, int rowIndex, String line, String reason) {
        log.debug("Row {} corrected: {}", rowIndex, reason);
        diagnostics.add(Diagnostic.row(DiagnosticKind.ROW_CORRECTED, rowIndex, line, reason));
    }

    /** Comma separated, double quotes enclose fields and {@code ""} escapes a quote. */
    static List<String> splitRow(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        cells.add(current.toString());
        return cells;
    }
}
