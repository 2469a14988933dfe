package org.dxworks.fortframe.diagnostics;

/**
 * A statement appeared where the enclosing construct does not allow it, or the
 * nesting of constructs is broken.
 */
public class FortranStructureException extends RuntimeException {

    private final String file;
    private final Integer line;

    public FortranStructureException(String file, Integer line, String message) {
        super(format(file, line, message));
        this.file = file;
        this.line = line;
    }

    public String getFile() {
        return file;
    }

    public Integer getLine() {
        return line;
    }

    static String format(String file, Integer line, String message) {
        StringBuilder sb = new StringBuilder("ERROR in file '").append(file).append("'");
        if (line != null) {
            sb.append(" at line ").append(line);
        }
        return sb.append(": ").append(message).toString();
    }
}
