package org.dxworks.fortframe.io;

import java.util.List;

/** Identical READ/WRITE column lists collapsed into one entry with a repetition count. */
public class DataRowGroup {
    public List<String> columns;
    public int rows;

    public DataRowGroup(List<String> columns, int rows) {
        this.columns = columns;
        this.rows = rows;
    }
}
