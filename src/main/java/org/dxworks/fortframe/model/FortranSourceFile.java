package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"kind", "name", "path", "form"})
public class FortranSourceFile extends FortranContainer {
    public String path;
    public String form;
    public List<FortranModule> modules = new ArrayList<>();
    public List<FortranSubmodule> submodules = new ArrayList<>();
    public List<FortranProgram> programs = new ArrayList<>();
    public List<FortranBlockData> blockData = new ArrayList<>();

    public FortranSourceFile(String name, String path, String form, List<String> display) {
        super(name, null, "public");
        this.path = path;
        this.form = form;
        this.display = new ArrayList<>(display);
        this.visible = true;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.SOURCE_FILE;
    }
}
