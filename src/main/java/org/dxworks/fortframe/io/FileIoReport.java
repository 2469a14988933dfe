package org.dxworks.fortframe.io;

import java.util.ArrayList;
import java.util.List;

public class FileIoReport {
    public FileIoSummary summary;
    public List<IoOperation> timeline = new ArrayList<>();

    public FileIoReport(FileIoSummary summary) {
        this.summary = summary;
    }
}
