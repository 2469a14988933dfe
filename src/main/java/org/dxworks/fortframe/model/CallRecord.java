package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One procedure reference found in executable code: the {@code %}-separated name
 * segments and the line they were found on.
 */
@JsonPropertyOrder({"chain", "line", "target"})
public class CallRecord {
    public final List<String> chain;
    public final Integer line;
    @JsonIgnore
    public FortranEntity resolved;

    public CallRecord(List<String> chain, Integer line) {
        this.chain = List.copyOf(chain);
        this.line = line;
    }

    public String lastName() {
        return chain.get(chain.size() - 1);
    }

    /** Name of the resolved procedure, or the last chain segment when unresolved. */
    public String getTarget() {
        return resolved != null ? resolved.name : lastName();
    }

    public boolean isResolved() {
        return resolved != null;
    }
}
