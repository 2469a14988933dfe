package org.dxworks.fortframe.io;

/** The innermost IF / SELECT CASE branch enclosing an I/O statement. */
public class IoCondition {
    public String text;
    public String type;
    public Integer line;

    public IoCondition(String text, String type, Integer line) {
        this.text = text;
        this.type = type;
        this.line = line;
    }

    static String typeOf(String conditionText) {
        String lower = conditionText.strip().toLowerCase();
        if (lower.startsWith("if")) {
            return "if";
        } else if (lower.startsWith("select case")) {
            return "select";
        } else if (lower.startsWith("case")) {
            return "case";
        } else if (lower.startsWith("else")) {
            return "else";
        } else if (lower.startsWith("do")) {
            return "do";
        }
        return "unknown";
    }
}
