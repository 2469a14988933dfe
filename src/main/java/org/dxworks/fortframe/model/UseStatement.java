package org.dxworks.fortframe.model;

/** {@code use <module>[, only: ...][, local => remote]}; the rest of the line is kept in {@link #clause}. */
public class UseStatement {
    public EntityRef<FortranModule> module;
    public String clause;
    public Integer line;

    public UseStatement(String moduleName, String clause, Integer line) {
        this.module = new EntityRef<>(moduleName);
        this.clause = clause == null ? "" : clause;
        this.line = line;
    }
}
