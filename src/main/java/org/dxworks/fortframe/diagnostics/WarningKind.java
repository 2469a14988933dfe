package org.dxworks.fortframe.diagnostics;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WarningKind {
    RESOLUTION("resolution"),
    IO_TRACKER("io_tracker"),
    UNDOCUMENTED("undocumented"),
    ATTRIBUTE("attribute"),
    STRUCTURE("structure");

    private final String name;

    WarningKind(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
