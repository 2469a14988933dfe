package org.dxworks.fortframe.reader;

/**
 * A forward-only stream of logical Fortran statements that can return the
 * most recently read line.
 */
public interface LineSource {

    boolean hasNext();

    SourceLine next();

    void pushBack(SourceLine line);

    /** Line number of the statement returned by the last {@link #next()} call, or 0 before the first. */
    int currentLineNumber();
}
