package org.dxworks.fortframe.diagnostics;

public class FortranWarning {
    public final String kind = "warning";
    public WarningKind category;
    public String file;
    public Integer line;
    public String entity;
    public String message;

    public FortranWarning(WarningKind category, String file, Integer line, String entity, String message) {
        this.category = category;
        this.file = file;
        this.line = line;
        this.entity = entity;
        this.message = message;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Warning: ").append(message);
        if (entity != null && !entity.isEmpty()) {
            sb.append(" [").append(entity).append("]");
        }
        if (file != null) {
            sb.append(" (").append(file);
            if (line != null) {
                sb.append(":").append(line);
            }
            sb.append(")");
        }
        return sb.toString();
    }
}
