package com.raditha.smells.model;

import java.util.Collections;
import java.util.List;

/**
 * A class, interface, enum, record or anonymous class body.
 * <p>
 * Equality is identity: functions point back at their class, so structural
 * equality would recurse.
 */
public final class ClassDef {

    private final String name;
    private final Range range;
    private final List<String> fields;
    private final List<FunctionDef> methods;

    /**
     * @param name    Simple name, or "anonymous Type" for anonymous bodies
     * @param range   Declaration range
     * @param fields  Field names in first-seen order
     * @param methods Backing list of owned functions. The builder finishes filling
     *                it before the unit is published; this class only exposes a
     *                read-only view.
     */
    public ClassDef(String name, Range range, List<String> fields, List<FunctionDef> methods) {
        this.name = name;
        this.range = range;
        this.fields = List.copyOf(fields);
        this.methods = Collections.unmodifiableList(methods);
    }

    public String name() {
        return name;
    }

    public Range range() {
        return range;
    }

    public List<String> fields() {
        return fields;
    }

    public List<FunctionDef> methods() {
        return methods;
    }

    public int fieldCount() {
        return fields.size();
    }

    public int methodCount() {
        return methods.size();
    }

    public int lineCount() {
        return range.lineSpan();
    }

    @Override
    public String toString() {
        return name + " " + range.toDisplayString();
    }
}
