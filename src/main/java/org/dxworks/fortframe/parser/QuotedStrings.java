package org.dxworks.fortframe.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class QuotedStrings {

    public static final Pattern QUOTES = Pattern.compile("\"(?:[^\"]|\"\")*+\"|'(?:[^']|'')*+'");
    private static final Pattern PLACEHOLDER = Pattern.compile("\"(\\d+)\"");

    private QuotedStrings() {
        // utility class
    }

    public static MaskedLine mask(String line, int lineNumber) {
        List<String> strings = new ArrayList<>();
        StringBuilder masked = new StringBuilder();
        Matcher m = QUOTES.matcher(line);
        int last = 0;
        while (m.find()) {
            masked.append(line, last, m.start());
            masked.append('"').append(strings.size()).append('"');
            strings.add(m.group());
            last = m.end();
        }
        masked.append(line.substring(last));
        return new MaskedLine(masked.toString(), strings, lineNumber);
    }

    public static String restore(String text, List<String> strings) {
        if (text == null || strings.isEmpty()) {
            return text;
        }
        Matcher m = PLACEHOLDER.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            int index = Integer.parseInt(m.group(1));
            String replacement = index < strings.size() ? strings.get(index) : m.group();
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
