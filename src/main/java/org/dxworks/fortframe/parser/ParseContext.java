package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.diagnostics.WarningLog;
import org.dxworks.fortframe.reader.LineSource;
import org.dxworks.fortframe.reader.SourceLine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** State shared by everything parsed from one source file. */
public class ParseContext {
    public final FortframeConfig config;
    public final WarningLog warnings;
    public final String filename;
    public final LineSource source;
    public final Pattern variablePattern;
    public final Pattern varTypePattern;
    public final String docPrefix;

    public ParseContext(FortframeConfig config, WarningLog warnings, String filename, LineSource source) {
        this.config = config;
        this.warnings = warnings;
        this.filename = filename;
        this.source = source;
        this.variablePattern = FortranPatterns.variablePattern(config.getExtraVartypes());
        this.varTypePattern = FortranPatterns.varTypePattern(config.getExtraVartypes());
        this.docPrefix = "!" + config.getDocmark();
    }

    public boolean isDocLine(String text) {
        return text.startsWith(docPrefix);
    }

    /** Consumes the run of doc comment lines that follows the current statement. */
    public List<String> readDocstring() {
        List<String> doc = new ArrayList<>();
        while (source.hasNext()) {
            SourceLine line = source.next();
            if (!isDocLine(line.text)) {
                source.pushBack(line);
                break;
            }
            doc.add(line.text.substring(docPrefix.length()));
        }
        return doc;
    }
}
