package org.dxworks.fortframe.io;

import org.dxworks.fortframe.parser.FortranTextUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Feeds executable statements to an {@link IoTracker}: IF / SELECT CASE
 * structure first, then the I/O statement itself.
 */
public final class IoStatementParser {

    private IoStatementParser() {
        // utility class
    }

    private static final Pattern IF_THEN = Pattern.compile("^if\\s*\\((.+)\\)\\s*then$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ELSE_IF = Pattern.compile("^else\\s*if\\s*\\((.+)\\)\\s*then$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ELSE = Pattern.compile("^else$", Pattern.CASE_INSENSITIVE);
    private static final Pattern END_IF = Pattern.compile("^end\\s*if(?:\\s+\\w+)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SELECT_CASE = Pattern.compile(
            "^(?:\\w+\\s*:\\s*)?select\\s*case\\s*\\((.+)\\)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CASE = Pattern.compile("^case\\s*\\((.+)\\)(?:\\s+\\w+)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CASE_DEFAULT = Pattern.compile("^case\\s+default(?:\\s+\\w+)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern END_SELECT = Pattern.compile("^end\\s*select(?:\\s+\\w+)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOGICAL_IF = Pattern.compile("^if\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern NAMED_IF = Pattern.compile("^\\w+\\s*:\\s*(if\\s*\\(.*)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern IO_STATEMENT = Pattern.compile(
            "^(open|read|write|rewind|backspace|close)\\b\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern IO_UNIT = Pattern.compile("\\(\\s*(?<unit>[^,)\\s]+)(?:\\s*,|\\s*\\))");
    private static final Pattern UNIT_KEYWORD = Pattern.compile("(\\(\\s*)unit\\s*=\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_UNIT = Pattern.compile("^(\\w+)");
    private static final Pattern RECL = Pattern.compile("recl\\s*=\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern FMT = Pattern.compile("fmt\\s*=\\s*([^,)]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern FILE_KEYWORD = Pattern.compile("file\\s*=", Pattern.CASE_INSENSITIVE);

    /**
     * @param raw  the statement with its string literals restored
     * @param line source line number of the statement
     */
    public static void observe(String raw, Integer line, IoTracker tracker) {
        String statement = raw.strip();
        if (LOGICAL_IF.matcher(statement).lookingAt()) {
            int open = statement.indexOf('(');
            int close = FortranTextUtils.findMatchingParen(statement, open);
            String action = close < 0 ? "" : statement.substring(close + 1).strip();
            if (!action.isEmpty() && !action.equalsIgnoreCase("then")) {
                // one-line IF: the condition only covers its own action
                tracker.pushCondition("if (" + statement.substring(open + 1, close).strip() + ")", line);
                parseIo(action, line, tracker);
                tracker.popCondition();
                return;
            }
        }
        updateConditions(statement, line, tracker);
        parseIo(statement, line, tracker);
    }

    static void updateConditions(String statement, Integer line, IoTracker tracker) {
        Matcher named = NAMED_IF.matcher(statement);
        String text = named.matches() ? named.group(1) : statement;

        Matcher m;
        if ((m = IF_THEN.matcher(text)).matches()) {
            tracker.pushCondition("if (" + m.group(1).strip() + ")", line);
        } else if ((m = ELSE_IF.matcher(text)).matches()) {
            replaceIfBranch(tracker, "else if (" + m.group(1).strip() + ")", line);
        } else if (ELSE.matcher(text).matches()) {
            replaceIfBranch(tracker, "else", line);
        } else if (END_IF.matcher(text).matches()) {
            popIfBranch(tracker);
        } else if ((m = SELECT_CASE.matcher(text)).matches()) {
            tracker.pushCondition("select case (" + m.group(1).strip() + ")", line);
        } else if ((m = CASE.matcher(text)).matches()) {
            replaceCase(tracker, "case (" + m.group(1).strip() + ")", line);
        } else if (CASE_DEFAULT.matcher(text).matches()) {
            replaceCase(tracker, "case default", line);
        } else if (END_SELECT.matcher(text).matches()) {
            if ("case".equals(tracker.currentConditionType())) {
                tracker.popCondition();
            }
            if ("select".equals(tracker.currentConditionType())) {
                tracker.popCondition();
            }
        }
    }

    private static void replaceIfBranch(IoTracker tracker, String text, Integer line) {
        popIfBranch(tracker);
        tracker.pushCondition(text, line);
    }

    private static void popIfBranch(IoTracker tracker) {
        String type = tracker.currentConditionType();
        if ("if".equals(type) || "else".equals(type)) {
            tracker.popCondition();
        }
    }

    private static void replaceCase(IoTracker tracker, String text, Integer line) {
        if ("case".equals(tracker.currentConditionType())) {
            tracker.popCondition();
        }
        tracker.pushCondition(text, line);
    }

    static void parseIo(String statement, Integer line, IoTracker tracker) {
        Matcher io = IO_STATEMENT.matcher(statement);
        if (!io.matches()) {
            return;
        }
        String keyword = io.group(1).toLowerCase();
        String unit = unitOf(io.group(2));

        switch (keyword) {
            case "open": {
                String filename = filenameExpression(statement);
                tracker.start(unit, filename, line);
                Matcher recl = RECL.matcher(statement);
                if (recl.find()) {
                    tracker.record(unit, "meta", "Record length: " + recl.group(1), line);
                }
                tracker.record(unit, "open", statement, line);
                break;
            }
            case "read": {
                Matcher fmt = FMT.matcher(statement);
                if (fmt.find()) {
                    tracker.record(unit, "meta", "Format: " + fmt.group(1).strip(), line);
                }
                tracker.record(unit, "read", statement, line);
                break;
            }
            case "write": {
                Matcher fmt = FMT.matcher(statement);
                if (fmt.find()) {
                    tracker.recordOrCreate(unit, "meta", "Format: " + fmt.group(1).strip(), line);
                }
                tracker.recordOrCreate(unit, "write", statement, line);
                break;
            }
            case "rewind":
            case "backspace":
                tracker.record(unit, keyword, statement, line);
                break;
            case "close":
                tracker.record(unit, "close", statement, line);
                tracker.close(unit);
                break;
            default:
                break;
        }
    }

    /** First argument of the control list, with a {@code unit=} keyword removed; or the bare unit of {@code rewind 10}. */
    static String unitOf(String arguments) {
        String args = arguments.strip();
        if (args.startsWith("(")) {
            Matcher m = IO_UNIT.matcher(UNIT_KEYWORD.matcher(args).replaceFirst("$1"));
            return m.find() ? m.group("unit") : null;
        }
        Matcher bare = BARE_UNIT.matcher(args);
        return bare.find() ? bare.group(1) : null;
    }

    /** The expression after {@code file=}, up to the closing parenthesis of the OPEN control list. */
    static String filenameExpression(String statement) {
        Matcher m = FILE_KEYWORD.matcher(statement);
        if (!m.find()) {
            return null;
        }
        int idx = m.end();
        while (idx < statement.length() && Character.isWhitespace(statement.charAt(idx))) {
            idx++;
        }
        int depth = 0;
        StringBuilder expr = new StringBuilder();
        char quote = 0;
        for (; idx < statement.length(); idx++) {
            char c = statement.charAt(idx);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    break;
                }
                depth--;
            } else if (c == ',' && depth == 0) {
                break;
            }
            expr.append(c);
        }
        return expr.toString().strip();
    }
}
