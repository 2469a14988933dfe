package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.dxworks.fortframe.io.FileIoReport;
import org.dxworks.fortframe.io.IoTracker;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Modules, submodules, programs, procedures and block data. */
public abstract class FortranCodeUnit extends FortranContainer {
    public List<UseStatement> uses = new ArrayList<>();
    public List<CallRecord> calls = new ArrayList<>();
    @JsonIgnore
    public List<String> memberAccessResults = new ArrayList<>();
    @JsonIgnore
    public List<String> otherResults = new ArrayList<>();
    @JsonIgnore
    public final IoTracker ioTracker = new IoTracker();
    /** Lower-cased names this unit makes public, including names only given a PUBLIC attribute. */
    @JsonIgnore
    public List<String> publicList = new ArrayList<>();

    protected FortranCodeUnit(String name, FortranEntity parent, String permission) {
        super(name, parent, permission);
    }

    public Map<String, FileIoReport> ioSummary() {
        return ioTracker.summarize();
    }

    public boolean hasCall(String lastName) {
        for (CallRecord call : calls) {
            if (call.lastName().equals(lastName)) {
                return true;
            }
        }
        return false;
    }
}
