package org.dxworks.fortframe.io;

import org.dxworks.fortframe.diagnostics.WarningKind;
import org.dxworks.fortframe.diagnostics.WarningLog;
import org.dxworks.fortframe.parser.FortranTextUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Follows the file units of one procedure through OPEN, READ, WRITE, REWIND,
 * BACKSPACE and CLOSE, remembering which IF / SELECT CASE branch each operation
 * happened in.
 */
public class IoTracker {

    static final String UNKNOWN_FILE = "<unknown>";

    private static final Pattern TRIM_ADJUST = Pattern.compile(
            "^\\s*(?:trim|adjustl)\\s*\\(\\s*(.+?)\\s*\\)\\s*$", Pattern.CASE_INSENSITIVE);

    private final Map<String, IoSession> openSessions = new LinkedHashMap<>();
    private final Map<String, List<IoSession>> completed = new LinkedHashMap<>();
    private final List<IoSession> stragglers = new ArrayList<>();
    private final List<IoCondition> conditionStack = new ArrayList<>();

    // ---- Condition context ----

    public void pushCondition(String text, Integer line) {
        conditionStack.add(new IoCondition(text.strip(), IoCondition.typeOf(text), line));
    }

    public void popCondition() {
        if (!conditionStack.isEmpty()) {
            conditionStack.remove(conditionStack.size() - 1);
        }
    }

    public IoCondition currentCondition() {
        return conditionStack.isEmpty() ? null : conditionStack.get(conditionStack.size() - 1);
    }

    String currentConditionType() {
        IoCondition current = currentCondition();
        return current == null ? null : current.type;
    }

    public List<IoCondition> conditions() {
        return Collections.unmodifiableList(conditionStack);
    }

    // ---- Sessions ----

    public void start(String unit, String filename, Integer line) {
        IoSession previous = openSessions.remove(unit);
        if (previous != null) {
            archive(previous);
        }
        openSessions.put(unit, new IoSession(unit, filename, line));
    }

    /** Adds an operation to the open session of {@code unit}; ignored when the unit is not open. */
    public void record(String unit, String kind, String raw, Integer line) {
        IoSession session = openSessions.get(unit);
        if (session != null) {
            session.add(kind, raw, line, currentCondition());
        }
    }

    /** Like {@link #record}, but a never-opened unit gets a session named {@code unit_<N>}. */
    public void recordOrCreate(String unit, String kind, String raw, Integer line) {
        if (unit == null) {
            return;
        }
        IoSession session = openSessions.computeIfAbsent(unit, u -> new IoSession(u, "unit_" + u, line));
        session.add(kind, raw, line, currentCondition());
    }

    public void close(String unit) {
        IoSession session = openSessions.remove(unit);
        if (session != null) {
            session.close();
            archive(session);
        }
    }

    /** Archives every session still open; they are reported as stragglers. */
    public void finish(WarningLog warnings, String file, Integer line, String entity) {
        if (openSessions.isEmpty()) {
            return;
        }
        stragglers.addAll(openSessions.values());
        if (warnings != null) {
            warnings.warn(WarningKind.IO_TRACKER, file, line, entity, "Unclosed I/O sessions: " + openSessions.values());
        }
        for (IoSession session : openSessions.values()) {
            archive(session);
        }
        openSessions.clear();
    }

    private void archive(IoSession session) {
        completed.computeIfAbsent(session.unit, k -> new ArrayList<>()).add(session);
    }

    public boolean isEmpty() {
        return completed.isEmpty() && openSessions.isEmpty();
    }

    public List<IoSession> getStragglers() {
        return Collections.unmodifiableList(stragglers);
    }

    public List<IoSession> completedSessions() {
        List<IoSession> all = new ArrayList<>();
        completed.values().forEach(all::addAll);
        return all;
    }

    // ---- Summary ----

    /**
     * Collapses a filename expression to a stable key: quotes removed, only the
     * operand after the last {@code //}, TRIM/ADJUSTL wrappers unwrapped.
     */
    public static String normalizeFileKey(String filename) {
        if (filename == null || filename.isBlank()) {
            return UNKNOWN_FILE;
        }
        String f = filename.strip();
        int concat = f.lastIndexOf("//");
        if (concat >= 0) {
            f = f.substring(concat + 2).strip();
        }
        f = stripQuotes(f);
        Matcher m = TRIM_ADJUST.matcher(f);
        if (m.matches()) {
            return normalizeFileKey(m.group(1));
        }
        return f.isEmpty() ? UNKNOWN_FILE : f;
    }

    private static String stripQuotes(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && (text.charAt(start) == '"' || text.charAt(start) == '\'')) {
            start++;
        }
        while (end > start && (text.charAt(end - 1) == '"' || text.charAt(end - 1) == '\'')) {
            end--;
        }
        return text.substring(start, end);
    }

    private static String keyOf(IoSession session) {
        String key = normalizeFileKey(session.file);
        if (UNKNOWN_FILE.equals(key) && session.unit != null && !session.unit.isEmpty()) {
            key = "unit_" + session.unit;
        }
        return key;
    }

    public Map<String, List<IoOperation>> operationsTimeline() {
        Map<String, List<IoOperation>> timeline = new LinkedHashMap<>();
        for (IoSession session : completedSessions()) {
            timeline.computeIfAbsent(keyOf(session), k -> new ArrayList<>()).addAll(session.operations);
        }
        return timeline;
    }

    public Map<String, FileIoReport> summarize() {
        Map<String, FileIoSummary> summaries = new LinkedHashMap<>();
        Map<String, Map<List<String>, Integer>> reads = new LinkedHashMap<>();
        Map<String, Map<List<String>, Integer>> writes = new LinkedHashMap<>();

        for (IoSession session : completedSessions()) {
            String key = keyOf(session);
            FileIoSummary summary = summaries.computeIfAbsent(key, k -> new FileIoSummary(session.unit));
            Map<List<String>, Integer> dataReads = reads.computeIfAbsent(key, k -> new LinkedHashMap<>());
            Map<List<String>, Integer> dataWrites = writes.computeIfAbsent(key, k -> new LinkedHashMap<>());

            for (IoOperation op : session.operations) {
                String kind = op.kind.toLowerCase();
                if (!kind.equals("read") && !kind.equals("write")) {
                    continue;
                }
                List<String> columns = columnsOf(op.raw);
                if (columns == null) {
                    continue;
                }
                if (kind.equals("read")) {
                    classifyRead(summary, dataReads, columns);
                } else {
                    classifyWrite(summary, dataWrites, columns);
                }
            }
        }

        Map<String, List<IoOperation>> timeline = operationsTimeline();
        Map<String, FileIoReport> result = new LinkedHashMap<>();
        for (Map.Entry<String, FileIoSummary> entry : summaries.entrySet()) {
            String key = entry.getKey();
            FileIoSummary summary = entry.getValue();
            reads.get(key).forEach((cols, count) -> summary.dataReads.add(new DataRowGroup(cols, count)));
            writes.get(key).forEach((cols, count) -> summary.dataWrites.add(new DataRowGroup(cols, count)));
            FileIoReport report = new FileIoReport(summary);
            report.timeline.addAll(timeline.getOrDefault(key, List.of()));
            result.put(key, report);
        }
        return result;
    }

    private static void classifyRead(FileIoSummary summary, Map<List<String>, Integer> dataReads, List<String> columns) {
        if (columns.size() == 1) {
            String single = columns.get(0);
            if (single.equals("i")) {
                addOnce(summary.indexReads, single);
            } else if (single.equals("titldum") || single.equals("header")) {
                addOnce(summary.headers, single);
            } else if (single.contains("(") || single.contains("%")) {
                dataReads.merge(columns, 1, Integer::sum);
            } else {
                addOnce(summary.headers, single);
            }
        } else {
            dataReads.merge(columns, 1, Integer::sum);
        }
    }

    private static void classifyWrite(FileIoSummary summary, Map<List<String>, Integer> dataWrites, List<String> columns) {
        if (columns.size() == 1 && (columns.get(0).equals("titldum") || columns.get(0).equals("header"))) {
            addOnce(summary.headerWrites, columns.get(0));
        } else {
            dataWrites.merge(columns, 1, Integer::sum);
        }
    }

    private static void addOnce(List<String> list, String value) {
        if (!list.contains(value)) {
            list.add(value);
        }
    }

    /** Column list following the statement's control parenthesis, or null when there is none. */
    static List<String> columnsOf(String raw) {
        int open = raw.indexOf('(');
        if (open < 0) {
            return null;
        }
        int close = FortranTextUtils.findMatchingParen(raw, open);
        if (close < 0 || close + 1 >= raw.length()) {
            return null;
        }
        String part = raw.substring(close + 1).strip();
        if (part.isEmpty()) {
            return null;
        }
        List<String> columns = new ArrayList<>();
        for (String column : FortranTextUtils.splitTopLevel(part, ',')) {
            String c = column.strip();
            if (c.startsWith("(") && c.endsWith(")")) {
                c = c.substring(1, c.length() - 1).strip();
            }
            if (!c.isEmpty()) {
                columns.add(c);
            }
        }
        return columns.isEmpty() ? null : List.copyOf(columns);
    }
}
