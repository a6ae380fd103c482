package com.formulatrace.app.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * One node of a traced dependency tree.
 * Children are precedents or dependents depending on the trace mode.
 * A node without a formula is always a leaf.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DependencyNode {

    /** Formula placeholder carried by a node whose address was already visited. */
    public static final String CIRCULAR_REFERENCE = "(circular reference - already visited)";

    private final String address;
    private final Object value;
    private final String numberFormat;
    private final String formula;
    private final List<DependencyNode> children = new ArrayList<>();

    public DependencyNode(String address, Object value, String numberFormat, String formula) {
        this.address = address;
        this.value = value;
        this.numberFormat = numberFormat;
        this.formula = formula;
    }

    public static DependencyNode leaf(CellSnapshot cell) {
        return new DependencyNode(cell.getAddress(), cell.getValue(), cell.getNumberFormat(), cell.getFormula());
    }

    public static DependencyNode circular(CellSnapshot cell) {
        return new DependencyNode(cell.getAddress(), cell.getValue(), cell.getNumberFormat(), CIRCULAR_REFERENCE);
    }

    public String getAddress() {
        return address;
    }

    public Object getValue() {
        return value;
    }

    public String getNumberFormat() {
        return numberFormat;
    }

    public String getFormula() {
        return formula;
    }

    public List<DependencyNode> getChildren() {
        return children;
    }

    public void addChild(DependencyNode child) {
        children.add(child);
    }

    public boolean isCircular() {
        return CIRCULAR_REFERENCE.equals(formula);
    }
}
