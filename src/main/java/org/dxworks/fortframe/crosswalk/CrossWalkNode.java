package org.dxworks.fortframe.crosswalk;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.fortframe.model.FortranVariable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A variable reached through a member-access path, with the components accessed below it. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "vartype", "initial", "filename", "docList", "variables"})
public class CrossWalkNode {
    public String name;
    public String vartype;
    public String initial;
    /** Only set on the root of a path. */
    public String filename;
    public List<String> docList = new ArrayList<>();
    public Map<String, CrossWalkNode> variables = new LinkedHashMap<>();

    static CrossWalkNode of(FortranVariable variable) {
        CrossWalkNode node = new CrossWalkNode();
        node.name = variable.name;
        node.vartype = variable.vartype;
        node.initial = variable.initial;
        node.docList = new ArrayList<>(variable.docList);
        return node;
    }
}
