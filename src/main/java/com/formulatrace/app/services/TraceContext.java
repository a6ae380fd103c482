package com.formulatrace.app.services;

import com.formulatrace.app.models.DependentCandidate;
import com.formulatrace.app.models.TraceMode;
import com.formulatrace.app.models.TraceSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * State of a single trace call: visited addresses, provenance flags,
 * truncation, and the lazily built dependent candidates.
 * Created by the top-level call, passed down every recursive step and
 * dropped afterwards. Never shared between traces.
 */
public class TraceContext {

    private final TraceMode mode;
    private final int maxDepth;
    private final CancellationSignal cancellation;

    private final Set<String> visited = new HashSet<>();
    private boolean usedHostIndex;
    private boolean usedFormulaScan;
    private boolean truncated;
    private List<DependentCandidate> candidateCache;
    private final List<String> skippedSheets = new ArrayList<>();

    public TraceContext(TraceMode mode, int maxDepth, CancellationSignal cancellation) {
        this.mode = mode;
        this.maxDepth = maxDepth;
        this.cancellation = cancellation;
    }

    public TraceMode getMode() {
        return mode;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public CancellationSignal getCancellation() {
        return cancellation;
    }

    /**
     * Records a visit. Returns false if the key was already visited.
     */
    public boolean markVisited(String key) {
        return visited.add(key);
    }

    public Set<String> getVisited() {
        return visited;
    }

    public void markHostIndexUsed() {
        usedHostIndex = true;
    }

    public void markFormulaScanUsed() {
        usedFormulaScan = true;
    }

    public void markTruncated() {
        truncated = true;
    }

    public boolean isUsedHostIndex() {
        return usedHostIndex;
    }

    public boolean isUsedFormulaScan() {
        return usedFormulaScan;
    }

    public boolean isTruncated() {
        return truncated;
    }

    public List<DependentCandidate> getCandidateCache() {
        return candidateCache;
    }

    public void setCandidateCache(List<DependentCandidate> candidateCache) {
        this.candidateCache = candidateCache;
    }

    public List<String> getSkippedSheets() {
        return skippedSheets;
    }

    /**
     * MIXED when both the host index and formula scanning contributed,
     * NONE when neither was consulted.
     */
    public TraceSource resolveSource() {
        if (usedHostIndex && usedFormulaScan) return TraceSource.MIXED;
        if (usedHostIndex) return TraceSource.API;
        if (usedFormulaScan) return TraceSource.FORMULA_SCAN;
        return TraceSource.NONE;
    }
}
