package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.diagnostics.WarningKind;
import org.dxworks.fortframe.diagnostics.WarningLog;
import org.dxworks.fortframe.model.EntityKind;
import org.dxworks.fortframe.model.FortranEntity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Leading {@code key: value} lines of a doc comment. Recognised keys move from
 * the doc text into {@link FortranEntity#meta}; the {@code display} key
 * overrides the display list for the entity and its children.
 */
public final class DocMetadata {

    private DocMetadata() {
        // utility class
    }

    public static final Set<String> KEYS = Set.of(
            "author", "category", "date", "deprecated", "display", "graph", "license", "proc_internals",
            "source", "summary", "title", "version");

    private static final Pattern META_LINE = Pattern.compile("^\\s*(\\w+)\\s*:\\s*(.*?)\\s*$");
    private static final List<String> PERMISSIONS = List.of("public", "private", "protected");

    public static void read(FortranEntity entity, WarningLog warnings, boolean warnUndocumented) {
        if (entity.docList.isEmpty()) {
            if (warnUndocumented && entity.kind() != EntityKind.SOURCE_FILE) {
                warnings.warn(WarningKind.UNDOCUMENTED, entity.getFilename(), entity.lineNumber, entity.name,
                        "Undocumented " + entity.kind().getName() + " '" + entity.name + "'");
            }
            applyDisplay(entity);
            return;
        }

        List<String> remaining = new ArrayList<>(entity.docList);
        while (!remaining.isEmpty()) {
            Matcher m = META_LINE.matcher(remaining.get(0));
            if (!m.matches() || !KEYS.contains(m.group(1).toLowerCase())) {
                break;
            }
            entity.meta.put(m.group(1).toLowerCase(), m.group(2));
            remaining.remove(0);
        }
        entity.docList = remaining;
        applyDisplay(entity);
    }

    private static void applyDisplay(FortranEntity entity) {
        String value = entity.meta.get("display");
        if (value == null) {
            return;
        }
        List<String> requested = new ArrayList<>();
        for (String item : Arrays.asList(value.toLowerCase().split("[\\s,]+"))) {
            if (!item.isEmpty()) {
                requested.add(item);
            }
        }
        if (entity.kind() == EntityKind.SOURCE_FILE) {
            requested.removeIf("none"::equals);
        }
        if (requested.isEmpty()) {
            return;
        }
        if (requested.contains("none")) {
            entity.display = new ArrayList<>();
        } else if (requested.stream().anyMatch(PERMISSIONS::contains)) {
            entity.display = requested;
        }
    }
}
