package org.dxworks.fortframe.diagnostics;

/**
 * A literal could not be interpreted where an integer constant is required,
 * e.g. a non-integer enumerator value. Always fatal.
 */
public class FortranLiteralException extends RuntimeException {

    private final String file;
    private final Integer line;

    public FortranLiteralException(String file, Integer line, String message) {
        super(FortranStructureException.format(file, line, message));
        this.file = file;
        this.line = line;
    }

    public String getFile() {
        return file;
    }

    public Integer getLine() {
        return line;
    }
}
