package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Common part of every node of the documentation model.
 * <p>
 * {@link #parent} is the single owner of the entity. {@link #scope}, when set, is
 * where names used by the entity are looked up; it differs from the owner only
 * for entities moved between collections after parsing (common block members).
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"kind", "name", "permission", "lineNumber", "numLines", "docList", "meta"})
public abstract class FortranEntity {
    public String name;
    public String permission = "public";
    @JsonIgnore
    public FortranEntity parent;
    @JsonIgnore
    public FortranEntity scope;
    public List<String> docList = new ArrayList<>();
    public Map<String, String> meta = new LinkedHashMap<>();
    public Integer lineNumber;
    public int numLines;
    @JsonIgnore
    public boolean visible;
    @JsonIgnore
    public List<String> display = new ArrayList<>();

    protected FortranEntity(String name, FortranEntity parent, String permission) {
        this.name = name;
        this.parent = parent;
        if (permission != null) {
            this.permission = permission.toLowerCase();
        }
        if (parent != null) {
            this.display = parent.display;
        }
    }

    @JsonIgnore
    public abstract EntityKind kind();

    @JsonProperty("kind")
    public String getKindName() {
        return kind().getName();
    }

    /** Where names used by this entity are resolved: the recorded scope, else the owner. */
    @JsonIgnore
    public FortranEntity lookupScope() {
        return scope != null ? scope : parent;
    }

    @JsonIgnore
    public FortranSourceFile getSourceFile() {
        FortranEntity current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current instanceof FortranSourceFile ? (FortranSourceFile) current : null;
    }

    @JsonIgnore
    public String getFilename() {
        FortranSourceFile file = getSourceFile();
        return file == null ? null : file.name;
    }

    @JsonIgnore
    public String lowerName() {
        return name == null ? "" : name.toLowerCase();
    }

    @Override
    public String toString() {
        return kind().getName() + " '" + name + "'";
    }
}
