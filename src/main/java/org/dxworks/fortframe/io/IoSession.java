package org.dxworks.fortframe.io;

import java.util.ArrayList;
import java.util.List;

/** Everything done through one unit between its OPEN and its CLOSE. */
public class IoSession {
    public final String unit;
    public final String file;
    public final Integer lineNumber;
    public final List<IoOperation> operations = new ArrayList<>();
    public boolean closed;

    public IoSession(String unit, String file, Integer lineNumber) {
        this.unit = unit;
        this.file = file;
        this.lineNumber = lineNumber;
    }

    public void add(String kind, String raw, Integer line, IoCondition condition) {
        operations.add(new IoOperation(kind, raw, line, condition));
    }

    public void close() {
        closed = true;
    }

    @Override
    public String toString() {
        return "unit " + unit + " (" + file + ")";
    }
}
