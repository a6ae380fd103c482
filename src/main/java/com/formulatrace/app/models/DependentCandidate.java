package com.formulatrace.app.models;

import java.util.List;

/**
 * A formula cell found during a workbook scan, with the references its
 * formula makes. Used to answer "who points at me" without a host index.
 */
public final class DependentCandidate {
    private final String dependentAddress;
    private final List<ParsedReference> references;

    public DependentCandidate(String dependentAddress, List<ParsedReference> references) {
        this.dependentAddress = dependentAddress;
        this.references = List.copyOf(references);
    }

    public String getDependentAddress() {
        return dependentAddress;
    }

    public List<ParsedReference> getReferences() {
        return references;
    }

    public boolean references(CellAddress target) {
        for (ParsedReference reference : references) {
            if (reference.references(target)) {
                return true;
            }
        }
        return false;
    }
}
