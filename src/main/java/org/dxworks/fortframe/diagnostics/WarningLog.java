package org.dxworks.fortframe.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects non-fatal findings of a parse/correlate run. Every warning is also
 * echoed on standard error unless the log was created quiet.
 */
public class WarningLog {

    private final List<FortranWarning> warnings = new ArrayList<>();
    private final boolean echo;

    public WarningLog() {
        this(true);
    }

    public WarningLog(boolean echo) {
        this.echo = echo;
    }

    public static WarningLog quiet() {
        return new WarningLog(false);
    }

    public synchronized void warn(WarningKind kind, String file, Integer line, String entity, String message) {
        FortranWarning warning = new FortranWarning(kind, file, line, entity, message);
        warnings.add(warning);
        if (echo) {
            System.err.println(warning);
        }
    }

    public List<FortranWarning> all() {
        return Collections.unmodifiableList(warnings);
    }

    public List<FortranWarning> ofKind(WarningKind kind) {
        return warnings.stream().filter(w -> w.category == kind).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }
}
