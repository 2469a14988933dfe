package org.dxworks.fortframe.reader;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.SourceForm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns raw Fortran text into logical statements: comments removed, continuation
 * lines joined, {@code ;}-separated statements split. Documentation comments are
 * kept as separate lines that start with {@code "!" + docmark}; comments marked with
 * the predocmark are moved after the statement that follows them.
 */
public class FortranReader implements LineSource {

    private static final int FIXED_FORM_LINE_LENGTH = 72;
    private static final int FIXED_FORM_CONTINUATION_COLUMN = 5;

    private final List<SourceLine> lines;
    private final Deque<SourceLine> pushedBack = new ArrayDeque<>();
    private int position;
    private int currentLineNumber;

    public FortranReader(String source, SourceForm form, FortframeConfig config) {
        String text = source.startsWith("\uFEFF") ? source.substring(1) : source;
        Splitter splitter = new Splitter(config.getDocmark(), config.getPredocmark());
        this.lines = form == SourceForm.FIXED
                ? splitter.readFixed(text, config.isFixedLengthLimit())
                : splitter.readFree(text);
    }

    public static FortranReader free(String source, FortframeConfig config) {
        return new FortranReader(source, SourceForm.FREE, config);
    }

    @Override
    public boolean hasNext() {
        return !pushedBack.isEmpty() || position < lines.size();
    }

    @Override
    public SourceLine next() {
        SourceLine line = pushedBack.isEmpty() ? lines.get(position++) : pushedBack.pop();
        currentLineNumber = line.lineNumber;
        return line;
    }

    @Override
    public void pushBack(SourceLine line) {
        pushedBack.push(line);
    }

    @Override
    public int currentLineNumber() {
        return currentLineNumber;
    }

    public List<SourceLine> allLines() {
        return List.copyOf(lines);
    }

    private static final class Splitter {
        private final String docPrefix;
        private final String docmark;
        private final String predocmark;

        private final List<SourceLine> out = new ArrayList<>();
        private final List<String> pendingDocs = new ArrayList<>();
        private final List<String> predocs = new ArrayList<>();
        private final StringBuilder pending = new StringBuilder();
        private int pendingStart = -1;
        private char openQuote;

        Splitter(String docmark, String predocmark) {
            this.docmark = docmark;
            this.predocmark = predocmark;
            this.docPrefix = "!" + docmark;
        }

        List<SourceLine> readFree(String text) {
            String[] physical = text.split("\r?\n", -1);
            for (int i = 0; i < physical.length; i++) {
                int lineNumber = i + 1;
                String raw = physical[i].replace('\t', ' ');
                if (pending.length() == 0 && raw.strip().startsWith("#")) {
                    continue;
                }

                char carried = openQuote;
                int commentAt = findCommentStart(raw);
                String code = (commentAt >= 0 ? raw.substring(0, commentAt) : raw).strip();
                String comment = commentAt >= 0 ? raw.substring(commentAt + 1) : null;

                if (code.isEmpty()) {
                    if (comment != null) {
                        handleComment(comment, lineNumber);
                    }
                    continue;
                }

                if (pending.length() > 0 && code.startsWith("&")) {
                    code = code.substring(1).strip();
                }
                boolean continues = code.endsWith("&");
                if (continues) {
                    code = code.substring(0, code.length() - 1).stripTrailing();
                }
                append(code, lineNumber, carried);
                if (comment != null) {
                    queueComment(comment);
                }
                if (!continues) {
                    flush();
                }
            }
            flush();
            return out;
        }

        List<SourceLine> readFixed(String text, boolean lengthLimit) {
            String[] physical = text.split("\r?\n", -1);
            for (int i = 0; i < physical.length; i++) {
                int lineNumber = i + 1;
                String raw = physical[i];
                if (raw.isBlank()) {
                    continue;
                }
                char first = raw.charAt(0);
                if (first == 'c' || first == 'C' || first == '*' || first == '!') {
                    handleComment(raw.substring(1), lineNumber);
                    continue;
                }
                if (first == '#') {
                    continue;
                }
                String line = lengthLimit && raw.length() > FIXED_FORM_LINE_LENGTH
                        ? raw.substring(0, FIXED_FORM_LINE_LENGTH)
                        : raw;
                line = line.replace('\t', ' ');

                boolean continuation = line.length() > FIXED_FORM_CONTINUATION_COLUMN
                        && line.charAt(FIXED_FORM_CONTINUATION_COLUMN) != ' '
                        && line.charAt(FIXED_FORM_CONTINUATION_COLUMN) != '0'
                        && line.substring(0, FIXED_FORM_CONTINUATION_COLUMN).isBlank();
                String body;
                if (continuation && pending.length() > 0) {
                    body = line.substring(FIXED_FORM_CONTINUATION_COLUMN + 1);
                } else {
                    flush();
                    body = line;
                }

                char carried = openQuote;
                int commentAt = findCommentStart(body);
                String code = (commentAt >= 0 ? body.substring(0, commentAt) : body).strip();
                if (!code.isEmpty()) {
                    append(code, lineNumber, carried);
                }
                if (commentAt >= 0) {
                    String comment = body.substring(commentAt + 1);
                    if (pending.length() > 0) {
                        queueComment(comment);
                    } else {
                        handleComment(comment, lineNumber);
                    }
                }
            }
            flush();
            return out;
        }

        private void append(String code, int lineNumber, char carriedQuote) {
            if (pending.length() == 0) {
                pendingStart = lineNumber;
            } else if (carriedQuote == 0) {
                pending.append(' ');
            }
            pending.append(code);
        }

        // A comment met outside any statement: doc lines are emitted in place,
        // predoc lines wait for the next statement.
        private void handleComment(String comment, int lineNumber) {
            if (pending.length() > 0) {
                queueComment(comment);
                return;
            }
            if (comment.startsWith(docmark)) {
                out.add(new SourceLine(docPrefix + comment.substring(docmark.length()), lineNumber));
            } else if (comment.startsWith(predocmark)) {
                predocs.add(docPrefix + comment.substring(predocmark.length()));
            }
        }

        private void queueComment(String comment) {
            if (comment.startsWith(docmark)) {
                pendingDocs.add(docPrefix + comment.substring(docmark.length()));
            } else if (comment.startsWith(predocmark)) {
                predocs.add(docPrefix + comment.substring(predocmark.length()));
            }
        }

        private void flush() {
            if (pending.length() == 0) {
                return;
            }
            int start = pendingStart;
            for (String statement : splitStatements(pending.toString())) {
                out.add(new SourceLine(statement, start));
            }
            for (String doc : pendingDocs) {
                out.add(new SourceLine(doc, start));
            }
            for (String doc : predocs) {
                out.add(new SourceLine(doc, start));
            }
            pendingDocs.clear();
            predocs.clear();
            pending.setLength(0);
            pendingStart = -1;
            openQuote = 0;
        }

        // Index of the '!' opening a comment, honouring string literals that may
        // already be open from a previous continuation line.
        private int findCommentStart(String text) {
            char quote = openQuote;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (quote != 0) {
                    if (c == quote) {
                        quote = 0;
                    }
                } else if (c == '\'' || c == '"') {
                    quote = c;
                } else if (c == '!') {
                    openQuote = 0;
                    return i;
                }
            }
            openQuote = quote;
            return -1;
        }

        private static List<String> splitStatements(String text) {
            List<String> parts = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            char quote = 0;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (quote != 0) {
                    if (c == quote) {
                        quote = 0;
                    }
                    current.append(c);
                } else if (c == '\'' || c == '"') {
                    quote = c;
                    current.append(c);
                } else if (c == ';') {
                    addStatement(parts, current);
                } else {
                    current.append(c);
                }
            }
            addStatement(parts, current);
            return parts;
        }

        private static void addStatement(List<String> parts, StringBuilder current) {
            String statement = current.toString().strip();
            if (!statement.isEmpty()) {
                parts.add(statement);
            }
            current.setLength(0);
        }
    }
}
