package org.dxworks.fortframe.reader;

public class SourceLine {
    public final String text;
    public final int lineNumber;

    public SourceLine(String text, int lineNumber) {
        this.text = text;
        this.lineNumber = lineNumber;
    }

    @Override
    public String toString() {
        return lineNumber + ": " + text;
    }
}
