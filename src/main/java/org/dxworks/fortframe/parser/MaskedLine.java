package org.dxworks.fortframe.parser;

import java.util.List;

/**
 * A statement whose string literals were replaced by {@code "0"}, {@code "1"}, ...
 * placeholders, together with the literals themselves.
 */
public class MaskedLine {
    public final String text;
    public final List<String> strings;
    public final int lineNumber;

    public MaskedLine(String text, List<String> strings, int lineNumber) {
        this.text = text;
        this.strings = strings;
        this.lineNumber = lineNumber;
    }

    public String restore() {
        return QuotedStrings.restore(text, strings);
    }

    public String restore(String fragment) {
        return QuotedStrings.restore(fragment, strings);
    }
}
