package org.dxworks.fortframe.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"kind", "raw", "line", "condition"})
public class IoOperation {
    public String kind;
    public String raw;
    public Integer line;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public IoCondition condition;

    public IoOperation(String kind, String raw, Integer line, IoCondition condition) {
        this.kind = kind;
        this.raw = raw == null ? "" : raw.strip();
        this.line = line;
        this.condition = condition;
    }
}
