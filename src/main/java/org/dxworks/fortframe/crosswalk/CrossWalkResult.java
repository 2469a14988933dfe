package org.dxworks.fortframe.crosswalk;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonPropertyOrder({"kind", "procedure", "file", "variables", "unresolved"})
public class CrossWalkResult {
    public final String kind = "crosswalk";
    public String procedure;
    public String file;
    /** Resolved access paths, keyed by their root as written in the source. */
    public Map<String, CrossWalkNode> variables = new LinkedHashMap<>();
    /** Roots that name no variable visible in the procedure. */
    public List<String> unresolved = new ArrayList<>();

    public boolean isEmpty() {
        return variables.isEmpty() && unresolved.isEmpty();
    }
}
